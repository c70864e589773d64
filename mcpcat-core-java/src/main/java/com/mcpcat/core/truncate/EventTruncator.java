package com.mcpcat.core.truncate;

import com.mcpcat.core.model.Event;

/**
 * Bounds the size of an event in three layers:
 *
 * 1. Field limits: userIntent, resourceName, server/client metadata, error message,
 *    error frames (first 25 + last 25), text content blocks.
 * 2. Normalization of parameters, response, identifyActorData and error
 *    (depth 10, breadth 100, strings 32768, cycles and non-JSON values replaced).
 * 3. Size enforcement: progressively shallower normalization, then shortening of the
 *    longest strings, until the canonical JSON fits in 100KB.
 *
 * Returns a new event; the input and everything reachable from it is left untouched.
 */
public final class EventTruncator {

    private EventTruncator() {}

    public static Event truncate(Event event) {
        Event limited = FieldLimiter.apply(event);
        Event normalized = SizeBudgetEnforcer.normalizeFields(limited, NormalizerLimits.defaults());
        return SizeBudgetEnforcer.enforce(normalized);
    }
}
