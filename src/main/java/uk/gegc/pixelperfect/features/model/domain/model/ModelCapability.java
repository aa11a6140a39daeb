package uk.gegc.pixelperfect.features.model.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ModelCapability {
    UPSCALE("upscale"),
    ENHANCE("enhance"),
    TEXT_PRESERVATION("text-preservation"),
    FACE_RESTORATION("face-restoration"),
    DENOISE("denoise"),
    DAMAGE_REPAIR("damage-repair"),
    OUTPUT_4K("4k-output"),
    OUTPUT_8K("8k-output");

    private final String wireName;

    ModelCapability(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts both the wire name ({@code face-restoration}) and the constant name ({@code FACE_RESTORATION}).
     */
    @JsonCreator
    public static ModelCapability fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Capability must not be null");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.wireName.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + value));
    }
}
