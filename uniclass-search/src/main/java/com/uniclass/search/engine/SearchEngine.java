package com.uniclass.search.engine;

import com.uniclass.common.dto.IndexStats;
import com.uniclass.common.dto.SearchHit;

import java.util.List;

/**
 * 向量检索引擎接口（嵌入模型 + 近似最近邻索引，由外部服务提供）。
 */
public interface SearchEngine {

    /**
     * 执行一次语义检索。
     *
     * @param query 查询文本
     * @param topK  返回条数上限
     * @return 按相似度降序排列的结果
     * @throws com.uniclass.common.exception.SearchEngineException 调用失败时
     */
    List<SearchHit> search(String query, int topK);

    /**
     * 索引概况。
     */
    IndexStats stats();

    /**
     * 引擎名称，用于日志与健康检查。
     */
    String getEngineName();
}
