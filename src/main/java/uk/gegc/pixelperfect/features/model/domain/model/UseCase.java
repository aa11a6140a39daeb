package uk.gegc.pixelperfect.features.model.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum UseCase {
    GENERAL_UPSCALE("general-upscale"),
    PORTRAITS("portraits"),
    DAMAGED_PHOTOS("damaged-photos"),
    TEXT_LOGOS("text-logos"),
    MAX_QUALITY("max-quality");

    private final String key;

    UseCase(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static UseCase fromKey(String key) {
        return Arrays.stream(values())
                .filter(u -> u.key.equalsIgnoreCase(key) || u.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown use case: " + key));
    }
}
