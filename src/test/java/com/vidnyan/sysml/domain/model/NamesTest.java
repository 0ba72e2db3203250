package com.vidnyan.sysml.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamesTest {

    @Test
    void sanitize_ShouldUnquoteAndUnescape() {
        assertEquals("my type", Names.sanitize("'my type'"));
        assertEquals("it's", Names.sanitize("'it\\'s'"));
        assertEquals("plain", Names.sanitize("plain"));
        assertNull(Names.sanitize(null));
    }

    @Test
    void escape_ShouldQuoteOnlyWhenNeeded() {
        assertEquals("Vehicle", Names.escape("Vehicle"));
        assertEquals("'my type'", Names.escape("my type"));
        assertEquals("'+'", Names.escape("+"));
    }

    @Test
    void split_ShouldHonorQuotesAndChains() {
        // Act
        List<Names.Segment> segments = Names.split("A::'b::c'.d");

        // Assert
        assertEquals(3, segments.size());
        assertEquals(new Names.Segment("A", false), segments.get(0));
        assertEquals(new Names.Segment("b::c", false), segments.get(1));
        assertEquals(new Names.Segment("d", true), segments.get(2));
        assertTrue(Names.split("  ").isEmpty());
    }
}
