package uk.gegc.pixelperfect.features.model.domain.model;

public record SelectionPreferences(
        boolean enhanceFaces,
        boolean denoise,
        boolean prioritizeQuality
) {

    public static SelectionPreferences none() {
        return new SelectionPreferences(false, false, false);
    }
}
