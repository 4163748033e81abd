package com.artgrid.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of a rejection. The feedback is stored on the artwork, written to the
 * moderation log and included in the email to the artist.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RejectRequest {

    private String feedback;
}
