package uk.gegc.pixelperfect.shared.util;

import java.util.Locale;

/**
 * Helpers for {@code data:<mime>;base64,<payload>} URIs.
 */
public final class DataUris {

    private static final String PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    private DataUris() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean isDataUri(String value) {
        return value != null && value.regionMatches(true, 0, PREFIX, 0, PREFIX.length());
    }

    /**
     * Wraps raw base64 image data, or returns the value unchanged when it already is a data URI or a URL.
     */
    public static String toDataUri(String imageData, String mimeType) {
        if (imageData == null || imageData.isBlank()) {
            throw new IllegalArgumentException("Image data is required");
        }
        String trimmed = imageData.trim();
        if (isDataUri(trimmed) || trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        String mime = mimeType == null || mimeType.isBlank() ? "image/png" : mimeType.trim().toLowerCase(Locale.ROOT);
        return PREFIX + mime + BASE64_MARKER + trimmed;
    }

    public static String mimeType(String dataUri) {
        if (!isDataUri(dataUri)) {
            return null;
        }
        int end = dataUri.indexOf(';');
        if (end < 0) {
            end = dataUri.indexOf(',');
        }
        return end > PREFIX.length() ? dataUri.substring(PREFIX.length(), end).toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Base64 payload of a data URI.
     */
    public static String payload(String dataUri) {
        int idx = dataUri.indexOf(BASE64_MARKER);
        if (!isDataUri(dataUri) || idx < 0) {
            throw new IllegalArgumentException("Not a base64 data URI");
        }
        return dataUri.substring(idx + BASE64_MARKER.length());
    }
}
