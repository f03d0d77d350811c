package com.eyelevel.documentindexer.common.apiclient.ocr;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs failed submit and poll attempts against Azure Document Intelligence.
 */
@Component("documentIntelligenceRetryListener")
@Slf4j
public class DocumentIntelligenceRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("OCR call failed on attempt {} ({}): {}", context.getRetryCount(),
                 throwable.getClass().getSimpleName(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 0) {
            log.error("OCR call abandoned after {} attempt(s).", context.getRetryCount());
        }
    }
}
