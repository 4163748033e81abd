package com.artgrid.repository.projection;

/**
 * One row of a grouped count, e.g. approved artworks per category.
 */
public interface CountByLabelRow {
    String getLabel();

    Long getTotal();
}
