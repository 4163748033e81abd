package com.artgrid.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtworkPageResponse {

    private List<ArtworkResponse> artworks;

    private PaginationInfo pagination;
}
