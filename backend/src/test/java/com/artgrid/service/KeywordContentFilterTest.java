package com.artgrid.service;

import com.artgrid.config.ArtgridProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeywordContentFilter Unit Tests")
class KeywordContentFilterTest {

    @Test
    @DisplayName("default word list should flag spam and inappropriate, case-insensitively")
    void testDefaultWords() {
        KeywordContentFilter filter = new KeywordContentFilter(new ArtgridProperties());

        assertTrue(filter.isFlagged("Buy now, this is SPAM"));
        assertTrue(filter.isFlagged("Totally Inappropriate."));
        assertTrue(filter.isFlagged("spammy link"));
        assertFalse(filter.isFlagged("Lovely brushwork!"));
        assertFalse(filter.isFlagged(""));
        assertFalse(filter.isFlagged(null));
    }

    @Test
    @DisplayName("configured word list should replace the defaults")
    void testConfiguredWords() {
        ArtgridProperties properties = new ArtgridProperties();
        properties.getComments().setBlockedWords(List.of(" Scam ", ""));
        KeywordContentFilter filter = new KeywordContentFilter(properties);

        assertTrue(filter.isFlagged("what a scam"));
        assertFalse(filter.isFlagged("this is spam"));
        assertFalse(filter.isFlagged("nothing to see"));
    }
}
