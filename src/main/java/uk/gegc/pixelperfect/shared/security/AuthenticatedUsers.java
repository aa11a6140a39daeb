package uk.gegc.pixelperfect.shared.security;

import uk.gegc.pixelperfect.shared.exception.UnauthorizedException;

import java.security.Principal;
import java.util.UUID;

/**
 * Authentication happens upstream; requests arrive with a principal whose name is the user id.
 */
public final class AuthenticatedUsers {

    private AuthenticatedUsers() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static UUID resolveUserId(Principal principal) {
        String name = principal != null ? principal.getName() : null;
        if (name == null || name.isBlank()) {
            throw new UnauthorizedException("No authenticated user found");
        }
        try {
            return UUID.fromString(name.trim());
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Unknown principal");
        }
    }
}
