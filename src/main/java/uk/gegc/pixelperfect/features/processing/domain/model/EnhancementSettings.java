package uk.gegc.pixelperfect.features.processing.domain.model;

/**
 * Individual enhancement actions a user can toggle.
 */
public record EnhancementSettings(
        boolean clarity,
        boolean color,
        boolean lighting,
        boolean denoise,
        boolean artifacts,
        boolean details
) {

    public static EnhancementSettings none() {
        return new EnhancementSettings(false, false, false, false, false, false);
    }

    public boolean any() {
        return clarity || color || lighting || denoise || artifacts || details;
    }
}
