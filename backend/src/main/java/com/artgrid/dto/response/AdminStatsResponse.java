package com.artgrid.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Platform statistics for moderators and administrators.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "overview": { "total_users": 41, "total_artworks": 120, "pending_artworks": 6, ... },
 *   "year_stats": [ { "year": "Year 2", "count": 37 } ],
 *   "category_stats": [ { "category": "Painting", "count": 22 } ],
 *   "top_artworks": [ { "id": 12, "title": "Harbour at Dusk", "likes_count": 30, "views_count": 410, "artist_name": "Ada Lovelace" } ]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminStatsResponse {

    private Overview overview;
    private List<YearCount> yearStats;
    private List<CategoryCount> categoryStats;
    private List<TopArtwork> topArtworks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Overview {
        private long totalUsers;
        private long totalArtworks;
        private long pendingArtworks;
        private long approvedArtworks;
        private long rejectedArtworks;
        private long featuredArtworks;
        private long totalLikes;
        private long totalComments;
        private long flaggedComments;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class YearCount {
        private String year;
        private long count;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryCount {
        private String category;
        private long count;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopArtwork {
        private Long id;
        private String title;
        private Integer likesCount;
        private Integer viewsCount;
        private String artistName;
    }
}
