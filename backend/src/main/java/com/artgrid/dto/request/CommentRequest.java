package com.artgrid.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommentRequest {

    @NotNull(message = "Artwork ID and content are required")
    private Long artworkId;

    @NotBlank(message = "Artwork ID and content are required")
    private String content;
}
