package com.artgrid.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A user's public profile with their approved artworks, newest first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GalleryResponse {

    private ArtistSummary user;

    private List<ArtworkResponse> artworks;
}
