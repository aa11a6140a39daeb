package uk.gegc.pixelperfect.features.processing.infra.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.application.ProcessingErrorNormalizer;
import uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException;
import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingErrorCode;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Invokes a backend, retrying only rate-limited attempts with exponential backoff and jitter.
 * Every other failure is returned to the caller on the first occurrence.
 */
@Slf4j
@Component
public class BackendCallExecutor {

    private final ImageBackendRegistry backendRegistry;
    private final ProcessingErrorNormalizer errorNormalizer;
    private final BackendProperties.Retry retry;

    public BackendCallExecutor(ImageBackendRegistry backendRegistry,
                               ProcessingErrorNormalizer errorNormalizer,
                               BackendProperties properties) {
        this.backendRegistry = backendRegistry;
        this.errorNormalizer = errorNormalizer;
        this.retry = properties.getRetry();
    }

    public Object call(BackendDescriptor backend, Map<String, Object> input, String jobId) {
        ImageBackend transport = backendRegistry.backendFor(backend.providerKind());
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        for (int attempt = 0; ; attempt++) {
            try {
                return transport.call(backend, input);
            } catch (RuntimeException e) {
                boolean retryable = errorNormalizer.isRateLimited(e);
                if (!retryable || attempt >= maxAttempts - 1) {
                    throw e;
                }
                long delayMs = calculateBackoffDelay(attempt);
                log.warn("Backend {} rate limited for job {} (attempt {}/{}), retrying in {} ms",
                        backend.id(), jobId, attempt + 1, maxAttempts, delayMs);
                sleepForRateLimit(delayMs);
            }
        }
    }

    long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = retry.getBaseDelayMs() * (1L << Math.min(retryCount, 20));
        double jitterRange = retry.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (ThreadLocalRandom.current().nextDouble() * 2 * jitterRange);
        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, retry.getMaxDelayMs());
    }

    private void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProcessingException(ProcessingErrorCode.RATE_LIMITED,
                    "Interrupted while waiting for rate limit", ie);
        }
    }
}
