package com.browserswarm.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallParserTest {

    private final ToolCallParser parser = new ToolCallParser(new ObjectMapper());

    @Test
    void testFencedCall() {
        ToolCall call = parser.parse("I'll click it.\n```json\n{\"tool\": \"browser_click\", \"arguments\": {\"element\": \"Search\", \"ref\": \"e12\"}}\n```");
        assertNotNull(call);
        assertEquals("browser_click", call.operation());
        assertEquals(Map.of("element", "Search", "ref", "e12"), call.arguments());
    }

    @Test
    void testInlineCallWithBracesInStrings() {
        ToolCall call = parser.parse("Typing now {\"tool\": \"browser_type\", \"arguments\": {\"text\": \"a } b\"}} then done");
        assertNotNull(call);
        assertEquals("browser_type", call.operation());
        assertEquals("a } b", call.arguments().get("text"));
    }

    @Test
    void testCallWithoutArguments() {
        ToolCall call = parser.parse("{\"tool\": \"browser_snapshot\"}");
        assertNotNull(call);
        assertTrue(call.arguments().isEmpty());
    }

    @Test
    void testNoCall() {
        assertNull(parser.parse("Stripe is valued at $50B."));
        assertNull(parser.parse("```json\n{\"name\": \"not a tool\"}\n```"));
        assertNull(parser.parse(null));
    }
}
