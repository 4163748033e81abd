package com.artgrid.controller;

import com.artgrid.dto.request.LoginRequest;
import com.artgrid.dto.request.ProfileUpdateRequest;
import com.artgrid.dto.request.RegisterRequest;
import com.artgrid.dto.response.AuthResponse;
import com.artgrid.dto.response.MessageResponse;
import com.artgrid.dto.response.RegisterResponse;
import com.artgrid.dto.response.UserProfileResponse;
import com.artgrid.entity.User;
import com.artgrid.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for registration, login and the caller's profile.
 *
 * Registration and login are public; the profile endpoints require a bearer token.
 *
 * Error Responses:
 * - 400 Bad Request: missing fields, non-institutional email, duplicate email or student ID
 * - 401 Unauthorized: wrong email or password, missing token on profile routes
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.artgrid.service.AuthService
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new account.
     *
     * Endpoint: POST /api/auth/register
     * Authentication: Not required
     *
     * Example response (201):
     * <pre>
     * {
     *   "message": "Registration successful",
     *   "user_id": 7
     * }
     * </pre>
     *
     * @param request the registration data
     * @return the new user's ID
     */
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration request received for email: {}", request.getEmail());

        try {
            User user = authService.register(request);
            return ResponseEntity
                    .status(HttpStatus.CREATED)
                    .body(new RegisterResponse("Registration successful", user.getId()));

        } catch (IllegalArgumentException e) {
            log.warn("Registration rejected: {}", e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    /**
     * Exchange email and password for a bearer token.
     *
     * Endpoint: POST /api/auth/login
     * Authentication: Not required
     *
     * @param request email and password
     * @return access token and user summary
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login request received for email: {}", request.getEmail());

        try {
            return ResponseEntity.ok(authService.login(request));

        } catch (BadCredentialsException e) {
            log.warn("Login failed for email: {}", request.getEmail());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> getProfile(Authentication authentication) {
        return ResponseEntity.ok(authService.getProfile(authentication));
    }

    @PutMapping("/profile")
    public ResponseEntity<MessageResponse> updateProfile(
            @RequestBody ProfileUpdateRequest request,
            Authentication authentication) {
        log.info("Profile update requested by user: {}", authentication.getName());

        authService.updateProfile(authentication, request);
        return ResponseEntity.ok(new MessageResponse("Profile updated successfully"));
    }
}
