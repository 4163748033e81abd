package com.artgrid.dto.response;

import com.artgrid.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * The caller's own profile. Password and date-of-birth hashes are never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileResponse {

    private Long id;
    private String fullName;
    private String email;
    private String studentId;
    private String yearOfStudy;
    private String profileImageUrl;
    private String verificationStatus;
    private String role;
    private LocalDateTime createdAt;

    public static UserProfileResponse from(User user) {
        return UserProfileResponse.builder()
                .id(user.getId())
                .fullName(user.getFullName())
                .email(user.getEmail())
                .studentId(user.getStudentId())
                .yearOfStudy(user.getYearOfStudy())
                .profileImageUrl(user.getProfileImageUrl())
                .verificationStatus(user.getVerificationStatus().getValue())
                .role(user.getRole().getValue())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
