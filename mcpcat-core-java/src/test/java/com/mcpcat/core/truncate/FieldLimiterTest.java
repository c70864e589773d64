package com.mcpcat.core.truncate;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.mcpcat.core.model.ErrorData;
import com.mcpcat.core.model.Event;
import com.mcpcat.core.model.StackFrame;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class FieldLimiterTest {

    private static List<StackFrame> frames(int n) {
        List<StackFrame> frames = new ArrayList<>();
        for (int i = 0; i < n; i++) frames.add(new StackFrame("app.js", "f" + i, i + 1, true));
        return frames;
    }

    // --- Strings ---

    @Test
    void userIntentCutAt2048() {
        Event e = new Event();
        e.userIntent = "x".repeat(3_000);
        Event result = FieldLimiter.apply(e);
        assertEquals(2_051, result.userIntent.length());
        assertTrue(result.userIntent.endsWith("..."));
    }

    @Test
    void metadataCutAt256() {
        Event e = new Event();
        e.resourceName = "r".repeat(300);
        e.serverName = "s".repeat(257);
        e.serverVersion = "1".repeat(256);
        e.clientName = "c".repeat(1_000);
        e.clientVersion = "2.0.0";

        Event result = FieldLimiter.apply(e);
        assertEquals(259, result.resourceName.length());
        assertEquals(259, result.serverName.length());
        assertEquals(256, result.serverVersion.length());
        assertEquals(259, result.clientName.length());
        assertEquals("2.0.0", result.clientVersion);
    }

    @Test
    void unlimitedFieldsUntouched() {
        Event e = new Event();
        e.sessionId = "s".repeat(5_000);
        assertEquals(5_000, FieldLimiter.apply(e).sessionId.length());
    }

    @Test
    void nullFieldsStayNull() {
        Event result = FieldLimiter.apply(new Event());
        assertNull(result.userIntent);
        assertNull(result.error);
        assertNull(result.response);
    }

    // --- Error ---

    @Test
    void errorMessageCutAt2048() {
        ErrorData error = new ErrorData();
        error.message = "m".repeat(5_000);
        Event e = new Event();
        e.error = error;

        ErrorData result = (ErrorData) FieldLimiter.apply(e).error;
        assertEquals(2_051, result.message.length());
        assertEquals(5_000, error.message.length(), "input must not change");
    }

    @Test
    void eightyFramesWindowedToFifty() {
        List<StackFrame> input = frames(80);
        ErrorData error = new ErrorData();
        error.message = "boom";
        error.frames = input;
        Event e = new Event();
        e.error = error;

        List<StackFrame> result = ((ErrorData) FieldLimiter.apply(e).error).frames;
        assertEquals(50, result.size());
        for (int i = 0; i < 25; i++) {
            assertSame(input.get(i), result.get(i));
            assertSame(input.get(55 + i), result.get(25 + i));
        }
        assertEquals(80, input.size());
    }

    @Test
    void fiftyFramesKept() {
        List<StackFrame> input = frames(50);
        assertSame(input, FieldLimiter.limitFrames(input));
    }

    @Test
    void mapErrorLimited() {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", "m".repeat(3_000));
        error.put("frames", new ArrayList<>(frames(60)));
        Event e = new Event();
        e.error = error;

        Map<?, ?> result = (Map<?, ?>) FieldLimiter.apply(e).error;
        assertEquals(2_051, ((String) result.get("message")).length());
        assertEquals(50, ((List<?>) result.get("frames")).size());
        assertEquals(60, ((List<?>) error.get("frames")).size());
    }

    @Test
    void jsonObjectErrorMessageCut() {
        JsonObject error = new JsonObject();
        error.addProperty("message", "m".repeat(5_000));
        error.addProperty("type", "TypeError");
        Event e = new Event();
        e.error = error;

        Map<?, ?> result = (Map<?, ?>) FieldLimiter.apply(e).error;
        assertEquals(2_051, ((String) result.get("message")).length());
        assertEquals(5_000, error.get("message").getAsString().length());
    }

    @Test
    void frameArrayInMapErrorWindowed() {
        StackFrame[] input = frames(80).toArray(new StackFrame[0]);
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", "boom");
        error.put("frames", input);
        Event e = new Event();
        e.error = error;

        List<?> result = (List<?>) ((Map<?, ?>) FieldLimiter.apply(e).error).get("frames");
        assertEquals(50, result.size());
        assertSame(input[0], result.get(0));
        assertSame(input[24], result.get(24));
        assertSame(input[55], result.get(25));
        assertSame(input[79], result.get(49));
    }

    // --- Response content ---

    @Test
    void jsonObjectResponseTextCut() {
        JsonObject block = new JsonObject();
        block.addProperty("type", "text");
        block.addProperty("text", "z".repeat(40_000));
        JsonArray content = new JsonArray();
        content.add(block);
        JsonObject response = new JsonObject();
        response.add("content", content);
        Event e = new Event();
        e.response = response;

        Map<?, ?> result = (Map<?, ?>) FieldLimiter.apply(e).response;
        Map<?, ?> first = (Map<?, ?>) ((List<?>) result.get("content")).get(0);
        assertEquals(32_771, ((String) first.get("text")).length());
        assertEquals(40_000, block.get("text").getAsString().length());
    }

    @Test
    void responseWithoutContentReturnedAsIs() {
        JsonObject response = new JsonObject();
        response.addProperty("isError", false);
        Event e = new Event();
        e.response = response;
        assertSame(response, FieldLimiter.apply(e).response);
    }

    @Test
    void textContentCutAt32768() {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "text");
        block.put("text", "z".repeat(40_000));
        Map<String, Object> image = new LinkedHashMap<>();
        image.put("type", "image");
        image.put("data", "q".repeat(40_000));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("content", List.of(block, image));
        response.put("isError", false);
        Event e = new Event();
        e.response = response;

        Map<?, ?> result = (Map<?, ?>) FieldLimiter.apply(e).response;
        List<?> content = (List<?>) result.get("content");
        assertEquals(32_771, ((String) ((Map<?, ?>) content.get(0)).get("text")).length());
        assertSame(image, content.get(1));
        assertEquals(false, result.get("isError"));
        assertEquals(40_000, ((String) block.get("text")).length());
    }
}
