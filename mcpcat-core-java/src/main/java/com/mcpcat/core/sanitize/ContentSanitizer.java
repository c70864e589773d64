package com.mcpcat.core.sanitize;

import com.google.gson.JsonPrimitive;
import com.mcpcat.core.json.ObjectTrees;
import com.mcpcat.core.model.ContentBlocks;
import com.mcpcat.core.model.Event;

import java.util.*;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Removes content the telemetry backend does not accept: non-text blocks in a tool
 * result's {@code content} array, and large base64 strings anywhere in
 * {@code parameters} or {@code response.structuredContent}.
 *
 * Returns a new event without mutating the input. Values that do not have the
 * expected shape are passed through.
 */
public final class ContentSanitizer {

    private ContentSanitizer() {}

    private static final Pattern BASE64_PATTERN = Pattern.compile("^[A-Za-z0-9+/\\n\\r]+=*$");

    /** Strings shorter than this are never tested against the base64 pattern. */
    static final int SIZE_GATE = 10_240;

    public static Event sanitize(Event event) {
        Event result = event.copy();
        if (result.response != null) {
            result.response = sanitizeResponse(result.response);
        }
        if (result.parameters != null) {
            result.parameters = sanitizeParameters(result.parameters);
        }
        return result;
    }

    private static Object sanitizeResponse(Object response) {
        if (!ObjectTrees.isObjectLike(response)) return response;

        Map<String, Object> result = ObjectTrees.entries(response);

        Object content = result.get("content");
        if (ObjectTrees.isArrayLike(content)) {
            List<Object> blocks = new ArrayList<>();
            for (Object block : ObjectTrees.elements(content)) {
                blocks.add(sanitizeContentBlock(block));
            }
            result.put("content", blocks);
        }

        Object structured = result.get("structuredContent");
        if (ObjectTrees.isObjectLike(structured) || ObjectTrees.isArrayLike(structured)) {
            result.put("structuredContent", sanitizeParameters(structured));
        }
        return result;
    }

    private static Object sanitizeContentBlock(Object block) {
        if (!ObjectTrees.isObjectLike(block)) return block;

        Object type = ObjectTrees.unwrapJson(ObjectTrees.entries(block).get(ContentBlocks.TYPE_KEY));
        String tag = type instanceof String s ? s : null;
        if (tag == null) return textBlock(ContentBlocks.unsupportedRedacted(type));

        return switch (tag) {
            case ContentBlocks.TEXT, ContentBlocks.RESOURCE_LINK -> block;
            case ContentBlocks.IMAGE -> textBlock(ContentBlocks.IMAGE_REDACTED);
            case ContentBlocks.AUDIO -> textBlock(ContentBlocks.AUDIO_REDACTED);
            case ContentBlocks.RESOURCE -> sanitizeResourceBlock(block);
            default -> textBlock(ContentBlocks.unsupportedRedacted(tag));
        };
    }

    /** Embedded resources carrying a {@code blob} are binary; those carrying {@code text} pass. */
    private static Object sanitizeResourceBlock(Object block) {
        Object resource = ObjectTrees.entries(block).get(ContentBlocks.RESOURCE_KEY);
        if (ObjectTrees.isObjectLike(resource)) {
            Map<String, Object> fields = ObjectTrees.entries(resource);
            if (hasValue(fields, ContentBlocks.BLOB_KEY, resource instanceof Map<?, ?>)) {
                return textBlock(ContentBlocks.BINARY_RESOURCE_REDACTED);
            }
        }
        return block;
    }

    // A map key that is present counts even with a null value; a POJO field must be set
    private static boolean hasValue(Map<String, Object> fields, String key, boolean keyed) {
        if (!fields.containsKey(key)) return false;
        Object value = fields.get(key);
        if (value instanceof Optional<?> opt && opt.isEmpty()) return false;
        return keyed || value != null;
    }

    private static Map<String, Object> textBlock(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put(ContentBlocks.TYPE_KEY, ContentBlocks.TEXT);
        block.put(ContentBlocks.TEXT_KEY, text);
        return block;
    }

    /**
     * Replaces large base64-looking strings at any depth. Unbounded in depth and breadth;
     * a node reached twice maps to the same copy, so shared subtrees and cycles keep
     * their shape for the truncator to deal with.
     */
    static Object sanitizeParameters(Object value) {
        Object[] root = new Object[1];
        Deque<Pending> work = new ArrayDeque<>();
        IdentityHashMap<Object, Object> copies = new IdentityHashMap<>();
        work.push(new Pending(value, v -> root[0] = v));
        while (!work.isEmpty()) {
            scan(work.pop(), work, copies);
        }
        return root[0];
    }

    /** A source value whose sanitized form is handed to {@code sink} once known. */
    private record Pending(Object source, Consumer<Object> sink) {}

    // Containers are handed to their sink before their children are filled in
    private static void scan(Pending next, Deque<Pending> work, IdentityHashMap<Object, Object> copies) {
        Object value = next.source();
        Consumer<Object> sink = next.sink();
        if (value == null) {
            sink.accept(null);
            return;
        }
        if (value instanceof CharSequence text) {
            sink.accept(isBinaryBlob(text) ? ContentBlocks.BINARY_DATA_REDACTED : value);
            return;
        }
        if (value instanceof JsonPrimitive p) {
            sink.accept(p.isString() && isBinaryBlob(p.getAsString()) ? ContentBlocks.BINARY_DATA_REDACTED : value);
            return;
        }
        if (value instanceof Optional<?> opt) {
            if (opt.isPresent()) {
                work.push(new Pending(opt.get(), v -> sink.accept(Optional.ofNullable(v))));
            } else {
                sink.accept(value);
            }
            return;
        }
        if (ObjectTrees.isTemporal(value)) {
            sink.accept(value);
            return;
        }

        boolean array = ObjectTrees.isArrayLike(value);
        if (!array && !ObjectTrees.isObjectLike(value)) {
            sink.accept(value);
            return;
        }
        Object seen = copies.get(value);
        if (seen != null) {
            sink.accept(seen);
            return;
        }
        if (array) {
            List<Object> elements = ObjectTrees.elements(value);
            List<Object> out = new ArrayList<>(Collections.nCopies(elements.size(), null));
            copies.put(value, out);
            sink.accept(out);
            for (int i = elements.size() - 1; i >= 0; i--) {
                int index = i;
                work.push(new Pending(elements.get(i), v -> out.set(index, v)));
            }
        } else {
            Map<String, Object> entries = ObjectTrees.entries(value);
            Map<String, Object> out = new LinkedHashMap<>();
            copies.put(value, out);
            sink.accept(out);
            for (Map.Entry<String, Object> e : entries.entrySet()) {
                String key = e.getKey();
                out.put(key, null);
                work.push(new Pending(e.getValue(), v -> out.put(key, v)));
            }
        }
    }

    static boolean isBinaryBlob(CharSequence text) {
        return text.length() >= SIZE_GATE && BASE64_PATTERN.matcher(text).matches();
    }
}
