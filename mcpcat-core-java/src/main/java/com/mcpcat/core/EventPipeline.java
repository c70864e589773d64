package com.mcpcat.core;

import com.mcpcat.core.model.Event;
import com.mcpcat.core.redact.EventRedactor;
import com.mcpcat.core.redact.RedactFunction;
import com.mcpcat.core.sanitize.ContentSanitizer;
import com.mcpcat.core.truncate.EventTruncator;

import java.util.Optional;

/**
 * Makes an event safe to export: optional customer redaction, then
 * {@link ContentSanitizer}, then {@link EventTruncator}.
 *
 * Stateless; safe to call from any thread on distinct events.
 */
public final class EventPipeline {

    private EventPipeline() {}

    public static Event prepare(Event event) {
        return EventTruncator.truncate(ContentSanitizer.sanitize(event));
    }

    /**
     * Same as {@link #prepare(Event)}, redacting strings first when {@code redactFn} is set.
     *
     * @return the prepared event, or empty when redaction failed and the event must not be sent
     */
    public static Optional<Event> prepare(Event event, RedactFunction redactFn) {
        if (redactFn == null) return Optional.of(prepare(event));
        Event redacted;
        try {
            redacted = EventRedactor.redact(event, redactFn);
        } catch (EventRedactor.RedactionException e) {
            System.err.println("[mcpcat] dropping event " + event.id + ": " + e.getMessage());
            return Optional.empty();
        }
        return Optional.of(prepare(redacted));
    }
}
