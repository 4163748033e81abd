package com.artgrid.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

/**
 * Pagination metadata. Pages are numbered from 1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationInfo {

    private int page;
    private int pages;
    private int perPage;
    private long total;
    private boolean hasNext;
    private boolean hasPrev;

    public static PaginationInfo from(Page<?> page) {
        return PaginationInfo.builder()
                .page(page.getNumber() + 1)
                .pages(page.getTotalPages())
                .perPage(page.getSize())
                .total(page.getTotalElements())
                .hasNext(page.hasNext())
                .hasPrev(page.hasPrevious())
                .build();
    }
}
