package com.uniclass.gateway.service;

import com.uniclass.common.dto.SearchHit;
import com.uniclass.common.exception.SearchEngineException;
import com.uniclass.search.engine.SearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 在有界线程池上执行检索调用，并在请求截止时间到达时放弃等待。
 * <p>
 * 超时的调用只是不再被等待（会尝试中断），不做重试。
 */
@Slf4j
@Component
public class BoundedSearchExecutor {

    private final SearchEngine searchEngine;
    private final ExecutorService executor;

    public BoundedSearchExecutor(SearchEngine searchEngine,
                                 @Qualifier("searchExecutor") ExecutorService executor) {
        this.searchEngine = searchEngine;
        this.executor = executor;
    }

    /**
     * @param deadlineNanos {@link System#nanoTime()} 基准下的截止时刻
     * @throws SearchTimeoutException 截止前未返回
     * @throws SearchEngineException  检索服务报错
     */
    public List<SearchHit> search(String query, int topK, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new SearchTimeoutException("请求已超过截止时间");
        }

        Future<List<SearchHit>> future;
        try {
            future = executor.submit(() -> searchEngine.search(query, topK));
        } catch (RejectedExecutionException e) {
            throw new SearchEngineException("检索线程池已满", e);
        }

        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("检索超时，放弃等待: query={}", query);
            throw new SearchTimeoutException("检索超时");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SearchEngineException("等待检索结果时被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SearchEngineException) {
                throw (SearchEngineException) cause;
            }
            throw new SearchEngineException("检索调用异常: " + cause.getMessage(), cause);
        }
    }

    public String getEngineName() {
        return searchEngine.getEngineName();
    }
}
