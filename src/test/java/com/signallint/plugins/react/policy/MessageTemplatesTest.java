package com.signallint.plugins.react.policy;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTemplatesTest {

    @Test
    void testRendersPlaceholders() {
        String message = MessageTemplates.render("Signal '{{ name }}' should end with '{{suffix}}'",
                Map.of("name", "count", "suffix", "Signal"));
        assertEquals("Signal 'count' should end with 'Signal'", message);
    }

    @Test
    void testKeepsUnknownPlaceholders() {
        assertEquals("Hello {{ who }}", MessageTemplates.render("Hello {{ who }}", Map.of()));
    }

    @Test
    void testValuesAreLiteral() {
        assertEquals("cost $1", MessageTemplates.render("cost {{ v }}", Map.of("v", "$1")),
                "Replacement text must not be treated as a group reference");
    }
}
