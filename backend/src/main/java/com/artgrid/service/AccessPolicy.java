package com.artgrid.service;

import com.artgrid.entity.User;
import com.artgrid.exception.UnauthorizedException;
import com.artgrid.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling user and checks roles for privileged operations.
 *
 * Every privileged service method starts with one of the {@code require*} calls. The
 * role is read from the database on each call, so a demotion takes effect immediately
 * even while older tokens carrying the previous role are still valid.
 *
 * <ul>
 *   <li>No usable authentication, or a token whose user was deleted: {@link SecurityException} (401)</li>
 *   <li>Authenticated but missing the role: {@link UnauthorizedException} (403)</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessPolicy {

    private final UserRepository userRepository;

    /**
     * Load the user behind the current request.
     *
     * The JwtAuthenticationFilter sets the principal name to the user ID.
     *
     * @param authentication the Spring Security authentication object
     * @return the authenticated User entity
     * @throws SecurityException if the request is not authenticated or the user no longer exists
     */
    public User currentUser(Authentication authentication) {
        if (authentication == null
                || authentication instanceof AnonymousAuthenticationToken
                || !authentication.isAuthenticated()) {
            throw new SecurityException("Authentication required");
        }

        Long userId;
        try {
            userId = Long.valueOf(authentication.getName());
        } catch (NumberFormatException e) {
            log.error("Invalid user ID in authentication principal: {}", authentication.getName());
            throw new SecurityException("Invalid user authentication");
        }

        return userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("Token presented for deleted user: userId={}", userId);
                    return new SecurityException("Authenticated user not found");
                });
    }

    /**
     * @param authentication the caller
     * @param action description of the attempted action, used in the error message
     * @return the caller, a moderator or administrator
     * @throws UnauthorizedException if the caller is a student
     */
    public User requireModerator(Authentication authentication, String action) {
        User user = currentUser(authentication);
        if (!user.canModerate()) {
            log.warn("Moderator action refused: userId={}, role={}, action={}",
                    user.getId(), user.getRole(), action);
            throw UnauthorizedException.moderatorRequired(action);
        }
        return user;
    }

    /**
     * @param authentication the caller
     * @param action description of the attempted action, used in the error message
     * @return the caller, an administrator
     * @throws UnauthorizedException if the caller is not an administrator
     */
    public User requireAdmin(Authentication authentication, String action) {
        User user = currentUser(authentication);
        if (!user.isAdmin()) {
            log.warn("Admin action refused: userId={}, role={}, action={}",
                    user.getId(), user.getRole(), action);
            throw UnauthorizedException.adminRequired(action);
        }
        return user;
    }
}
