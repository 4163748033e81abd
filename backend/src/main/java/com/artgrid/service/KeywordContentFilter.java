package com.artgrid.service;

import com.artgrid.config.ArtgridProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Flags content containing any configured word, case-insensitively.
 *
 * Matching is by substring, so "spammy" is flagged by "spam". The list comes from
 * {@code artgrid.comments.blocked-words}.
 */
@Component
@Slf4j
public class KeywordContentFilter implements ContentFilter {

    private final List<String> blockedWords;

    public KeywordContentFilter(ArtgridProperties properties) {
        this.blockedWords = properties.getComments().getBlockedWords().stream()
                .filter(Objects::nonNull)
                .map(word -> word.trim().toLowerCase(Locale.ROOT))
                .filter(word -> !word.isEmpty())
                .toList();
        log.info("Comment filter initialized with {} blocked words", blockedWords.size());
    }

    @Override
    public boolean isFlagged(String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        String normalized = content.toLowerCase(Locale.ROOT);
        return blockedWords.stream().anyMatch(normalized::contains);
    }
}
