package com.artgrid.dto.response;

import com.artgrid.entity.Moderation;
import com.artgrid.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One moderation log entry. The moderator fields are null when the moderator's
 * account has since been deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModerationResponse {

    private Long id;
    private Long artworkId;
    private String action;
    private String feedback;
    private Long moderatorId;
    private String moderatorName;
    private LocalDateTime createdAt;

    public static ModerationResponse from(Moderation moderation) {
        User moderator = moderation.getModerator();
        return ModerationResponse.builder()
                .id(moderation.getId())
                .artworkId(moderation.getArtwork().getId())
                .action(moderation.getAction().getValue())
                .feedback(moderation.getFeedback())
                .moderatorId(moderator != null ? moderator.getId() : null)
                .moderatorName(moderator != null ? moderator.getFullName() : null)
                .createdAt(moderation.getCreatedAt())
                .build();
    }
}
