package uk.gegc.pixelperfect.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://pixelperfect.app/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Model Errors ====================
    public static final URI MODEL_NOT_FOUND = URI.create(BASE_URL + "/model-not-found");
    public static final URI MODEL_NOT_AVAILABLE = URI.create(BASE_URL + "/model-not-available");
    public static final URI NO_ELIGIBLE_MODEL = URI.create(BASE_URL + "/no-eligible-model");

    // ==================== Processing Errors ====================
    public static final URI PROCESSING_FAILED = URI.create(BASE_URL + "/processing-failed");
    public static final URI NO_OUTPUT = URI.create(BASE_URL + "/no-output");
    public static final URI CONTENT_REJECTED = URI.create(BASE_URL + "/content-rejected");
    public static final URI BACKEND_TIMEOUT = URI.create(BASE_URL + "/backend-timeout");
    public static final URI ILLEGAL_STATE = URI.create(BASE_URL + "/illegal-state");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== Billing Errors ====================
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
