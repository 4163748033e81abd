package com.artgrid.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of an upload. {@code status} is "approved" for verified artists and
 * "pending" otherwise.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtworkUploadResponse {

    private String message;

    private Long artworkId;

    private String status;
}
