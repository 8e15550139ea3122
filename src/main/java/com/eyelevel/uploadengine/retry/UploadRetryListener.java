package com.eyelevel.uploadengine.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class UploadRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("[{}] Upload attempt {} to provider '{}' failed (priority {}): {}",
                context.getAttribute(RetryEngine.REQUEST_ATTRIBUTE), context.getRetryCount(),
                context.getAttribute(RetryEngine.PROVIDER_ATTRIBUTE),
                context.getAttribute(RetryEngine.PRIORITY_ATTRIBUTE), throwable.getMessage());
    }
}
