package com.mcpcat.core.redact;

import com.google.gson.JsonPrimitive;
import com.mcpcat.core.json.ObjectTrees;
import com.mcpcat.core.model.Event;

import java.util.*;
import java.util.function.Consumer;

/**
 * Applies a {@link RedactFunction} to every string of an event, except the
 * identifier and bookkeeping fields the backend needs to group events:
 * id, sessionId, projectId, eventType, resourceName, identifyActorGivenId,
 * identifyActorName and everything under identifyActorData.
 *
 * Returns a new event; nested trees are copied, never modified in place.
 * Map entries whose value is a callable or absent are dropped from the copy.
 */
public final class EventRedactor {

    private EventRedactor() {}

    public static class RedactionException extends RuntimeException {
        public RedactionException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * @throws RedactionException if {@code redactFn} throws
     */
    public static Event redact(Event event, RedactFunction redactFn) {
        Objects.requireNonNull(redactFn, "redactFn");
        Redaction r = new Redaction(redactFn);
        try {
            Event result = event.copy();
            result.ipAddress = r.string(result.ipAddress);
            result.sdkLanguage = r.string(result.sdkLanguage);
            result.mcpcatVersion = r.string(result.mcpcatVersion);
            result.serverName = r.string(result.serverName);
            result.serverVersion = r.string(result.serverVersion);
            result.clientName = r.string(result.clientName);
            result.clientVersion = r.string(result.clientVersion);
            result.userIntent = r.string(result.userIntent);
            result.parameters = r.tree(result.parameters);
            result.response = r.tree(result.response);
            result.error = r.tree(result.error);
            return result;
        } catch (RuntimeException e) {
            throw new RedactionException("Redaction function failed: " + e.getMessage(), e);
        }
    }

    /** State of one redaction pass: the copies made so far, keyed by source identity. */
    private static final class Redaction {
        private final RedactFunction fn;
        private final IdentityHashMap<Object, Object> copies = new IdentityHashMap<>();

        Redaction(RedactFunction fn) {
            this.fn = fn;
        }

        String string(String s) {
            return s == null ? null : fn.redact(s);
        }

        Object tree(Object value) {
            Object[] root = new Object[1];
            Deque<Pending> work = new ArrayDeque<>();
            work.push(new Pending(value, v -> root[0] = v));
            while (!work.isEmpty()) {
                visit(work.pop(), work);
            }
            return root[0];
        }

        // Containers are handed to their sink before their children are filled in
        private void visit(Pending next, Deque<Pending> work) {
            Object value = next.source();
            Consumer<Object> sink = next.sink();
            if (value == null) {
                sink.accept(null);
            } else if (value instanceof CharSequence text) {
                sink.accept(fn.redact(text.toString()));
            } else if (value instanceof JsonPrimitive p && p.isString()) {
                sink.accept(fn.redact(p.getAsString()));
            } else if (value instanceof Optional<?> opt) {
                if (opt.isPresent()) {
                    work.push(new Pending(opt.get(), v -> sink.accept(Optional.ofNullable(v))));
                } else {
                    sink.accept(value);
                }
            } else if (ObjectTrees.isTemporal(value)) {
                sink.accept(value);
            } else if (copies.containsKey(value)) {
                sink.accept(copies.get(value));
            } else if (ObjectTrees.isArrayLike(value)) {
                List<Object> elements = ObjectTrees.elements(value);
                List<Object> out = new ArrayList<>(Collections.nCopies(elements.size(), null));
                copies.put(value, out);
                sink.accept(out);
                for (int i = elements.size() - 1; i >= 0; i--) {
                    int index = i;
                    work.push(new Pending(elements.get(i), v -> out.set(index, v)));
                }
            } else if (ObjectTrees.isObjectLike(value)) {
                Map<String, Object> out = new LinkedHashMap<>();
                copies.put(value, out);
                sink.accept(out);
                for (Map.Entry<String, Object> e : ObjectTrees.entries(value).entrySet()) {
                    Object v = e.getValue();
                    if (ObjectTrees.isCallable(v) || (v instanceof Optional<?> opt && opt.isEmpty())) continue;
                    String key = e.getKey();
                    out.put(key, null);
                    work.push(new Pending(v, redacted -> out.put(key, redacted)));
                }
            } else {
                sink.accept(value);
            }
        }
    }

    /** A source value whose redacted form is handed to {@code sink} once known. */
    private record Pending(Object source, Consumer<Object> sink) {}
}
