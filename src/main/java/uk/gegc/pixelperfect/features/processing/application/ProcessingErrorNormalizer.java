package uk.gegc.pixelperfect.features.processing.application;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException;
import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingErrorCode;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps arbitrary backend failures onto {@link ProcessingException}.
 *
 * <p>Message vocabularies are checked case-insensitively and in order: rate limit, safety, timeout, no output.
 * The message of every throwable in the cause chain is considered. Unrecognised failures become
 * {@link ProcessingErrorCode#PROCESSING_FAILED} with the original message preserved.
 */
@Component
public class ProcessingErrorNormalizer {

    private static final String DEFAULT_MESSAGE = "Image processing failed";
    private static final int MAX_CAUSE_DEPTH = 10;

    private static final List<Map.Entry<ProcessingErrorCode, List<String>>> VOCABULARY = List.of(
            Map.entry(ProcessingErrorCode.RATE_LIMITED, List.of("rate limit", "429", "throttled", "too many requests")),
            Map.entry(ProcessingErrorCode.SAFETY, List.of("nsfw", "safety")),
            Map.entry(ProcessingErrorCode.TIMEOUT, List.of("timeout", "timed out")),
            Map.entry(ProcessingErrorCode.NO_OUTPUT, List.of("no output", "empty output", "empty result", "no image"))
    );

    public ProcessingException normalize(Throwable error) {
        if (error == null) {
            return new ProcessingException(ProcessingErrorCode.PROCESSING_FAILED, DEFAULT_MESSAGE);
        }
        if (error instanceof ProcessingException processingException) {
            return processingException;
        }

        String message = error.getMessage() == null || error.getMessage().isBlank()
                ? DEFAULT_MESSAGE
                : error.getMessage();

        ProcessingErrorCode structural = classifyByType(error);
        if (structural != null) {
            return new ProcessingException(structural, message, error);
        }

        String haystack = collectMessages(error);
        for (Map.Entry<ProcessingErrorCode, List<String>> entry : VOCABULARY) {
            for (String term : entry.getValue()) {
                if (haystack.contains(term)) {
                    return new ProcessingException(entry.getKey(), message, error);
                }
            }
        }
        return new ProcessingException(ProcessingErrorCode.PROCESSING_FAILED, message, error);
    }

    public boolean isRateLimited(Throwable error) {
        return normalize(error).getCode() == ProcessingErrorCode.RATE_LIMITED;
    }

    private ProcessingErrorCode classifyByType(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof RestClientResponseException responseException
                    && responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return ProcessingErrorCode.RATE_LIMITED;
            }
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return ProcessingErrorCode.TIMEOUT;
            }
            if (current instanceof ResourceAccessException && current.getCause() instanceof SocketTimeoutException) {
                return ProcessingErrorCode.TIMEOUT;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private String collectMessages(Throwable error) {
        StringBuilder messages = new StringBuilder();
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current.getMessage() != null) {
                messages.append(current.getMessage()).append('\n');
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return messages.toString().toLowerCase(Locale.ROOT);
    }
}
