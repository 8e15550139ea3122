package com.eyelevel.uploadengine.retry;

import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.exception.UploadAttemptFailedException;
import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.AttemptResult;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.RetryOutcome;
import com.eyelevel.uploadengine.model.UploadRequest;
import com.eyelevel.uploadengine.transport.UploadTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Runs one upload against one provider, retrying with jittered exponential backoff until it succeeds or
 * {@code maxRetries} retries have failed.
 * <p>
 * Every attempt is recorded in the {@link HealthTracker}; a successful one is also charged to the
 * {@link CostLedger}. The calling thread blocks through the backoff sleeps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryEngine {

    static final String PROVIDER_ATTRIBUTE = "upload.provider";
    static final String REQUEST_ATTRIBUTE = "upload.request";
    static final String PRIORITY_ATTRIBUTE = "upload.priority";

    private final UploadTransport transport;
    private final HealthTracker healthTracker;
    private final CostLedger costLedger;
    private final JitteredExponentialBackOffPolicy backOffPolicy;
    private final UploadRetryListener retryListener;
    private final Clock clock;

    /**
     * Attempts the upload up to {@code request.maxRetries + 1} times. Only a failed transport attempt is retried;
     * once the provider has accepted the payload the upload is never repeated, even if recording it fails.
     *
     * @param provider the provider to upload to.
     * @param request  the upload.
     * @return {@link RetryOutcome#SUCCESS} on the first successful attempt, {@link RetryOutcome#EXHAUSTED}
     * once all attempts failed.
     */
    public RetryOutcome execute(final Provider provider, final UploadRequest request) {
        final RetryTemplate template = buildTemplate(request);
        final AttemptResult accepted = template.execute(context -> attempt(provider, request, context), context -> {
            log.error("[{}] Upload to provider '{}' failed after {} attempts", request.getRequestId(),
                    provider.getId(), context.getRetryCount());
            return null;
        });
        if (accepted == null) {
            return RetryOutcome.EXHAUSTED;
        }
        recordSuccess(provider, request, accepted);
        return RetryOutcome.SUCCESS;
    }

    private RetryTemplate buildTemplate(final UploadRequest request) {
        final RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(Math.max(0, request.getMaxRetries()) + 1,
                Map.of(UploadAttemptFailedException.class, true)));
        template.setBackOffPolicy(backOffPolicy);
        template.registerListener(retryListener);
        return template;
    }

    private AttemptResult attempt(final Provider provider, final UploadRequest request, final RetryContext context) {
        context.setAttribute(PROVIDER_ATTRIBUTE, provider.getId());
        context.setAttribute(REQUEST_ATTRIBUTE, request.getRequestId());
        context.setAttribute(PRIORITY_ATTRIBUTE, request.getPriority());

        final AttemptResult result = invokeTransport(provider, request);
        if (!result.success()) {
            recordFailure(provider, request, result);
            throw new UploadAttemptFailedException(result.errorMessage() != null
                    ? result.errorMessage()
                    : "Provider rejected the upload");
        }
        log.info("[{}] Upload to provider '{}' succeeded on attempt {} in {}ms ({} priority)",
                request.getRequestId(), provider.getId(), context.getRetryCount() + 1, result.responseTimeMs(),
                request.getPriority());
        return result;
    }

    private void recordFailure(final Provider provider, final UploadRequest request, final AttemptResult result) {
        try {
            healthTracker.recordAttempt(provider.getId(), false, result.responseTimeMs(), 0);
        } catch (RuntimeException e) {
            log.error("[{}] Could not record failed attempt on provider '{}'", request.getRequestId(),
                    provider.getId(), e);
        }
    }

    // The payload is already stored at this point; errors here must not turn into another upload.
    private void recordSuccess(final Provider provider, final UploadRequest request, final AttemptResult result) {
        try {
            healthTracker.recordAttempt(provider.getId(), true, result.responseTimeMs(), result.bytesTransferred());
        } catch (RuntimeException e) {
            log.error("[{}] Could not record successful attempt on provider '{}'", request.getRequestId(),
                    provider.getId(), e);
        }
        try {
            costLedger.recordSpend(provider.getId(), request.getEstimatedSizeBytes());
        } catch (RuntimeException e) {
            log.error("[{}] Could not record spend of {} bytes on provider '{}'", request.getRequestId(),
                    request.getEstimatedSizeBytes(), provider.getId(), e);
        }
    }

    private AttemptResult invokeTransport(final Provider provider, final UploadRequest request) {
        final long start = clock.millis();
        try {
            final AttemptResult result = transport.attemptUpload(provider, request);
            return result != null ? result : AttemptResult.failure(clock.millis() - start, "Transport returned no result");
        } catch (RuntimeException e) {
            log.debug("[{}] Transport threw during upload to '{}'", request.getRequestId(), provider.getId(), e);
            return AttemptResult.failure(clock.millis() - start, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
