package uk.gegc.pixelperfect.features.model.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum ProcessingMode {
    UPSCALE,
    ENHANCE,
    BOTH,
    CUSTOM;

    /**
     * Modes that produce a larger image and therefore need a scale-capable backend.
     */
    public boolean requiresUpscale() {
        return this == UPSCALE || this == BOTH;
    }

    /**
     * Modes that change the image content and therefore need an enhancing backend.
     */
    public boolean requiresEnhance() {
        return this != UPSCALE;
    }

    /**
     * Capabilities a backend must declare to run this mode.
     */
    public Set<ModelCapability> requiredCapabilities() {
        Set<ModelCapability> required = EnumSet.noneOf(ModelCapability.class);
        if (requiresUpscale()) {
            required.add(ModelCapability.UPSCALE);
        }
        if (requiresEnhance()) {
            required.add(ModelCapability.ENHANCE);
        }
        return required;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProcessingMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UPSCALE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
