package com.artgrid.dto.response;

import com.artgrid.entity.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of an artist embedded in artwork and gallery responses.
 *
 * Email and verification status are only filled in for the moderation queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArtistSummary {

    private Long id;
    private String fullName;
    private String yearOfStudy;
    private String profileImageUrl;
    private String email;
    private String verificationStatus;

    public static ArtistSummary publicView(User user) {
        return ArtistSummary.builder()
                .id(user.getId())
                .fullName(user.getFullName())
                .yearOfStudy(user.getYearOfStudy())
                .profileImageUrl(user.getProfileImageUrl())
                .build();
    }

    public static ArtistSummary moderationView(User user) {
        return ArtistSummary.builder()
                .id(user.getId())
                .fullName(user.getFullName())
                .yearOfStudy(user.getYearOfStudy())
                .email(user.getEmail())
                .verificationStatus(user.getVerificationStatus().getValue())
                .build();
    }
}
