package com.eyelevel.documentindexer.common.apiclient.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs every failed embedding attempt and, once, the outcome of a call that needed retries.
 */
@Component("embeddingRetryListener")
@Slf4j
public class EmbeddingRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Embedding request failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (context.getRetryCount() == 0) {
            return;
        }
        if (throwable == null) {
            log.info("Embedding request succeeded after {} failed attempt(s).", context.getRetryCount());
        } else {
            log.error("Embedding request gave up after {} attempt(s): {}", context.getRetryCount(),
                      throwable.getMessage());
        }
    }
}
