package com.uniclass.search.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.uniclass.common.dto.IndexStats;
import com.uniclass.common.dto.SearchHit;
import com.uniclass.common.exception.SearchEngineException;
import com.uniclass.search.config.SearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 通过 HTTP 调用外部嵌入/ANN 检索服务。
 * <p>
 * 协议：
 * - POST {baseUrl}/search  请求 {"query": "...", "top_k": 5}，响应 {"results": [{code, title, table, similarity}]}
 * - GET  {baseUrl}/stats   响应 {"total_items", "embedding_dim", "tables"}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpSearchEngine implements SearchEngine {

    private final OkHttpClient searchHttpClient;
    private final SearchProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    @Override
    public List<SearchHit> search(String query, int topK) {
        String url = properties.getBaseUrl() + "/search";

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", query);
        payload.put("top_k", topK);

        Request request = newRequest(url)
                .post(RequestBody.create(payload.toString(), JSON_MEDIA))
                .build();

        JsonNode json = execute(request);
        JsonNode results = json.path("results");
        if (!results.isArray()) {
            throw new SearchEngineException("检索服务响应缺少 results 字段");
        }

        List<SearchHit> hits = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            hits.add(SearchHit.builder()
                    .code(node.path("code").asText())
                    .title(node.path("title").asText())
                    .table(node.path("table").asText())
                    .similarity(clamp(node.path("similarity").asDouble()))
                    .build());
        }
        log.debug("检索完成: top_k={}, 返回 {} 条", topK, hits.size());
        return hits;
    }

    @Override
    public IndexStats stats() {
        JsonNode json = execute(newRequest(properties.getBaseUrl() + "/stats").get().build());

        List<String> tables = new ArrayList<>();
        json.path("tables").forEach(t -> tables.add(t.asText()));
        return IndexStats.builder()
                .totalItems(json.path("total_items").asLong())
                .embeddingDim(json.path("embedding_dim").asInt())
                .tables(tables)
                .build();
    }

    @Override
    public String getEngineName() {
        return "http";
    }

    private Request.Builder newRequest(String url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("Accept", "application/json");
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.addHeader("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private JsonNode execute(Request request) {
        try (Response response = searchHttpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.error("检索服务调用失败: {} - {}", response.code(), body);
                throw new SearchEngineException("检索服务返回错误: " + response.code());
            }
            return objectMapper.readTree(body);

        } catch (SearchEngineException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new SearchEngineException("检索服务响应不是合法 JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SearchEngineException("调用检索服务时发生网络错误: " + e.getMessage(), e);
        }
    }

    /** 相似度限定在 [0, 1] */
    private static double clamp(double similarity) {
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
