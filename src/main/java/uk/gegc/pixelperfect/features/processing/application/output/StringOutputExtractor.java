package uk.gegc.pixelperfect.features.processing.application.output;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URL;
import java.util.Map;
import java.util.Optional;

/**
 * Plain strings, {@link URI}/{@link URL} values, JSON text nodes, and file handles whose string form is a URL.
 */
public class StringOutputExtractor implements OutputUrlExtractor {

    @Override
    public Optional<String> extract(Object value) {
        if (value instanceof CharSequence text) {
            return Optional.of(text.toString());
        }
        if (value instanceof URI || value instanceof URL) {
            return Optional.of(value.toString());
        }
        if (value instanceof JsonNode node) {
            return node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
        }
        if (value == null || value instanceof Map || value instanceof Iterable) {
            return Optional.empty();
        }
        String coerced = String.valueOf(value);
        if (coerced.startsWith("http") || coerced.startsWith("data:")) {
            return Optional.of(coerced);
        }
        return Optional.empty();
    }
}
