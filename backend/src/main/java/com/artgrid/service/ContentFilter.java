package com.artgrid.service;

/**
 * Decides at creation time whether a comment is hidden from the public listing.
 */
public interface ContentFilter {

    boolean isFlagged(String content);
}
