package uk.gegc.pixelperfect.features.processing.application;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.processing.application.output.OutputUrlExtractor;
import uk.gegc.pixelperfect.features.processing.application.output.PropertyOutputExtractor;
import uk.gegc.pixelperfect.features.processing.application.output.StringOutputExtractor;
import uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException;
import uk.gegc.pixelperfect.features.processing.domain.model.CanonicalResult;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Converts raw backend output into a {@link CanonicalResult}.
 *
 * <p>Collections and arrays are reduced to their first element, then the extractors run in order
 * (string coercion, {@code url}, {@code href}); the first non-blank value wins.
 *
 * <p>The MIME type of a hosted URL is guessed from the file extension of its path: {@code .png} is
 * image/png, {@code .webp} is image/webp and anything else is reported as image/jpeg. This is a
 * heuristic only; backends are free to serve a different format under any name.
 */
@Component
public class OutputNormalizer {

    private static final String DATA_URI_PREFIX = "data:";

    private final List<OutputUrlExtractor> extractors = List.of(
            new StringOutputExtractor(),
            PropertyOutputExtractor.url(),
            PropertyOutputExtractor.href()
    );

    private final Clock clock;
    private final OutputProperties properties;

    public OutputNormalizer(Clock clock, OutputProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    public CanonicalResult normalize(Object rawOutput) {
        Object candidate = firstElement(rawOutput);
        String url = extractUrl(candidate)
                .orElseThrow(() -> ProcessingException.noOutput("No output URL returned from backend"));

        if (url.regionMatches(true, 0, DATA_URI_PREFIX, 0, DATA_URI_PREFIX.length())) {
            return CanonicalResult.of(url, mimeTypeOfDataUri(url), null);
        }
        Instant expiresAt = clock.instant().plus(properties.getUrlTtl());
        return CanonicalResult.of(url, detectMimeType(url), expiresAt);
    }

    Optional<String> extractUrl(Object candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        for (OutputUrlExtractor extractor : extractors) {
            Optional<String> url = extractor.extract(candidate)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty());
            if (url.isPresent()) {
                return url;
            }
        }
        return Optional.empty();
    }

    private Object firstElement(Object rawOutput) {
        if (rawOutput instanceof List<?> list) {
            return list.isEmpty() ? null : list.get(0);
        }
        if (rawOutput instanceof Object[] array) {
            return array.length == 0 ? null : array[0];
        }
        if (rawOutput instanceof JsonNode node && node.isArray()) {
            return node.isEmpty() ? null : node.get(0);
        }
        return rawOutput;
    }

    static String detectMimeType(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException ex) {
            path = url;
        }
        if (path == null) {
            path = url;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) {
            return "image/png";
        }
        if (lower.endsWith(".webp")) {
            return "image/webp";
        }
        return "image/jpeg";
    }

    private static String mimeTypeOfDataUri(String dataUri) {
        int end = dataUri.indexOf(';');
        if (end < 0) {
            end = dataUri.indexOf(',');
        }
        String mime = end > DATA_URI_PREFIX.length() ? dataUri.substring(DATA_URI_PREFIX.length(), end) : "";
        return mime.isBlank() ? "image/png" : mime.toLowerCase(Locale.ROOT);
    }
}
