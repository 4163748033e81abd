package com.artgrid.exception;

/**
 * Exception thrown when an authenticated user lacks the role required for an action.
 *
 * Authentication failures (missing or invalid token) are reported as 401 by the
 * security entry point. This exception covers the other case: the caller is known but
 * is not allowed to perform the request, e.g. a student calling a moderation endpoint.
 *
 * GlobalExceptionHandler maps this to HTTP 403 Forbidden with RFC 7807 format.
 *
 * @see com.artgrid.service.AccessPolicy
 * @see com.artgrid.exception.GlobalExceptionHandler
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    /**
     * Caller is neither a moderator nor an administrator.
     *
     * @param action the attempted action (e.g. "approve artworks")
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException moderatorRequired(String action) {
        return new UnauthorizedException(
                String.format("Moderator access required to %s.", action)
        );
    }

    /**
     * Caller is not an administrator.
     *
     * @param action the attempted action (e.g. "delete users")
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException adminRequired(String action) {
        return new UnauthorizedException(
                String.format("Admin access required to %s.", action)
        );
    }

    public static UnauthorizedException selfDeletion() {
        return new UnauthorizedException("Administrators cannot delete their own account.");
    }
}
