package com.artgrid.dto.response;

import com.artgrid.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a successful login.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "user": {
 *     "id": 7,
 *     "full_name": "Ada Lovelace",
 *     "email": "ada@my.uopeople.edu",
 *     "role": "student",
 *     "verification_status": "pending"
 *   }
 * }
 * </pre>
 *
 * Clients send the token back as {@code Authorization: Bearer {access_token}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private String accessToken;

    private AuthenticatedUser user;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthenticatedUser {
        private Long id;
        private String fullName;
        private String email;
        private String role;
        private String verificationStatus;

        public static AuthenticatedUser from(User user) {
            return AuthenticatedUser.builder()
                    .id(user.getId())
                    .fullName(user.getFullName())
                    .email(user.getEmail())
                    .role(user.getRole().getValue())
                    .verificationStatus(user.getVerificationStatus().getValue())
                    .build();
        }
    }
}
