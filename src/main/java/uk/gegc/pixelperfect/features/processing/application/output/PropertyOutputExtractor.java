package uk.gegc.pixelperfect.features.processing.application.output;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads a named property ({@code url} or {@code href}) from a map or JSON object.
 * The property may hold a string or a zero-argument {@link Supplier}.
 */
public class PropertyOutputExtractor implements OutputUrlExtractor {

    private final String property;
    private final boolean allowSupplier;

    public PropertyOutputExtractor(String property, boolean allowSupplier) {
        this.property = property;
        this.allowSupplier = allowSupplier;
    }

    public static PropertyOutputExtractor url() {
        return new PropertyOutputExtractor("url", true);
    }

    public static PropertyOutputExtractor href() {
        return new PropertyOutputExtractor("href", false);
    }

    @Override
    public Optional<String> extract(Object value) {
        if (value instanceof Map<?, ?> map) {
            return fromProperty(map.get(property));
        }
        if (value instanceof JsonNode node && node.isObject()) {
            JsonNode child = node.get(property);
            return child != null && child.isTextual() ? Optional.of(child.asText()) : Optional.empty();
        }
        return Optional.empty();
    }

    private Optional<String> fromProperty(Object candidate) {
        if (candidate instanceof CharSequence text) {
            return Optional.of(text.toString());
        }
        if (allowSupplier && candidate instanceof Supplier<?> supplier) {
            Object supplied = supplier.get();
            return supplied == null ? Optional.empty() : Optional.of(supplied.toString());
        }
        return Optional.empty();
    }
}
