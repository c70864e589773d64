package com.mcpcat.core.truncate;

import com.mcpcat.core.json.ObjectTrees;
import com.mcpcat.core.model.ContentBlocks;
import com.mcpcat.core.model.ErrorData;
import com.mcpcat.core.model.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.mcpcat.core.truncate.TruncationLimits.*;

/**
 * Per-field limits on known event fields. No recursion; nested trees are
 * left to the {@link Normalizer}.
 */
final class FieldLimiter {

    private FieldLimiter() {}

    static Event apply(Event event) {
        Event result = event.copy();

        result.userIntent = Strings.truncate(result.userIntent, MAX_USER_INTENT_LENGTH);
        result.resourceName = Strings.truncate(result.resourceName, MAX_RESOURCE_NAME_LENGTH);
        result.serverName = Strings.truncate(result.serverName, MAX_METADATA_LENGTH);
        result.serverVersion = Strings.truncate(result.serverVersion, MAX_METADATA_LENGTH);
        result.clientName = Strings.truncate(result.clientName, MAX_METADATA_LENGTH);
        result.clientVersion = Strings.truncate(result.clientVersion, MAX_METADATA_LENGTH);

        result.error = limitError(result.error);
        result.response = limitResponseContent(result.response);
        return result;
    }

    /** Keeps the first and last {@code MAX_STACK_FRAMES / 2} frames of an over-long list. */
    static <T> List<T> limitFrames(List<T> frames) {
        if (frames == null || frames.size() <= MAX_STACK_FRAMES) return frames;
        int half = MAX_STACK_FRAMES / 2;
        List<T> out = new ArrayList<>(MAX_STACK_FRAMES);
        out.addAll(frames.subList(0, half));
        out.addAll(frames.subList(frames.size() - half, frames.size()));
        return out;
    }

    private static Object limitError(Object error) {
        if (error instanceof ErrorData data) {
            ErrorData copy = data.copy();
            copy.message = Strings.truncate(copy.message, MAX_ERROR_MESSAGE_LENGTH);
            copy.frames = limitFrames(copy.frames);
            return copy;
        }
        if (!ObjectTrees.isObjectLike(error)) return error;

        Map<String, Object> copy = ObjectTrees.entries(error);
        if (ObjectTrees.unwrapJson(copy.get("message")) instanceof String message) {
            copy.put("message", Strings.truncate(message, MAX_ERROR_MESSAGE_LENGTH));
        }
        Object frames = copy.get("frames");
        if (ObjectTrees.isArrayLike(frames)) {
            copy.put("frames", limitFrames(ObjectTrees.elements(frames)));
        }
        return copy;
    }

    private static Object limitResponseContent(Object response) {
        if (!ObjectTrees.isObjectLike(response)) return response;
        Map<String, Object> copy = ObjectTrees.entries(response);
        Object content = copy.get("content");
        if (!ObjectTrees.isArrayLike(content)) return response;

        List<Object> blocks = new ArrayList<>();
        for (Object block : ObjectTrees.elements(content)) {
            blocks.add(limitTextBlock(block));
        }
        copy.put("content", blocks);
        return copy;
    }

    private static Object limitTextBlock(Object block) {
        if (!ObjectTrees.isObjectLike(block)) return block;
        Map<String, Object> fields = ObjectTrees.entries(block);
        if (ContentBlocks.TEXT.equals(ObjectTrees.unwrapJson(fields.get(ContentBlocks.TYPE_KEY)))
                && ObjectTrees.unwrapJson(fields.get(ContentBlocks.TEXT_KEY)) instanceof String text
                && text.length() > MAX_CONTENT_TEXT_LENGTH) {
            fields.put(ContentBlocks.TEXT_KEY, Strings.truncate(text, MAX_CONTENT_TEXT_LENGTH));
            return fields;
        }
        return block;
    }
}
