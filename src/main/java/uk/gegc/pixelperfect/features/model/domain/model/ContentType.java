package uk.gegc.pixelperfect.features.model.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse content classification produced by image analysis.
 */
public enum ContentType {
    PHOTO,
    PORTRAIT,
    DOCUMENT,
    ILLUSTRATION,
    VINTAGE,
    PRODUCT,
    LANDSCAPE,
    OTHER;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return OTHER;
        }
    }
}
