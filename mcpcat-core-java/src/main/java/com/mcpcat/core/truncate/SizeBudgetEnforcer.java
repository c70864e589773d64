package com.mcpcat.core.truncate;

import com.mcpcat.core.json.EventJson;
import com.mcpcat.core.model.Event;

import java.util.*;
import java.util.function.Consumer;

import static com.mcpcat.core.truncate.TruncationLimits.*;

/**
 * Brings a normalized event under {@link TruncationLimits#MAX_EVENT_BYTES}.
 *
 * First re-normalizes the user-controlled fields at decreasing depth (9 down to 1);
 * if even depth 1 is too large, shortens the longest strings of the depth-1 result.
 * The last step is best effort: an event with too few long strings may stay over budget.
 */
final class SizeBudgetEnforcer {

    private SizeBudgetEnforcer() {}

    private static final int MAX_SURGERY_ATTEMPTS = 10;
    private static final int MIN_CANDIDATE_LENGTH = 100;
    private static final int MIN_REDUCTION = 10;
    // Room for the added "..." suffixes and escaping
    private static final int OVERHEAD_BUFFER = 200;

    static Event enforce(Event normalized) {
        if (EventJson.byteSize(normalized) <= MAX_EVENT_BYTES) return normalized;

        NormalizerLimits defaults = NormalizerLimits.defaults();
        for (int depth = MAX_DEPTH - 1; depth >= 1; depth--) {
            Event reduced = normalizeFields(normalized, defaults.withDepth(depth));
            if (EventJson.byteSize(reduced) <= MAX_EVENT_BYTES) return reduced;
        }

        Event minimal = normalizeFields(normalized, defaults.withDepth(1));
        return truncateLargestFields(minimal, MAX_EVENT_BYTES);
    }

    static Event normalizeFields(Event event, NormalizerLimits limits) {
        Event result = event.copy();
        if (result.parameters != null) result.parameters = Normalizer.normalize(result.parameters, limits);
        if (result.response != null) result.response = Normalizer.normalize(result.response, limits);
        if (result.identifyActorData != null) {
            result.identifyActorData = Normalizer.normalize(result.identifyActorData, limits);
        }
        if (result.error != null) result.error = Normalizer.normalize(result.error, limits);
        return result;
    }

    static Event truncateLargestFields(Event event, int maxBytes) {
        Event result = deepCopy(event);

        for (int attempt = 0; attempt < MAX_SURGERY_ATTEMPTS; attempt++) {
            int currentSize = EventJson.byteSize(result);
            if (currentSize <= maxBytes) return result;

            // List.sort is stable: equal lengths keep traversal order
            List<StringSlot> slots = new ArrayList<>();
            collectStringSlots(result, slots);
            slots.sort(Comparator.comparingInt((StringSlot s) -> s.value().length()).reversed());
            if (slots.isEmpty()) break;

            int remaining = currentSize - maxBytes + OVERHEAD_BUFFER;
            boolean truncated = false;
            for (StringSlot slot : slots) {
                if (remaining <= 0) break;
                int length = slot.value().length();
                int reduction = Math.min(remaining, length / 2);
                if (reduction < MIN_REDUCTION) continue;
                slot.setter().accept(slot.value().substring(0, length - reduction) + TRUNCATION_SUFFIX);
                remaining -= reduction;
                truncated = true;
            }
            if (!truncated) break;
        }

        int finalSize = EventJson.byteSize(result);
        if (finalSize > maxBytes) {
            System.err.println("[mcpcat] event still " + finalSize + " bytes after truncation (limit "
                + maxBytes + "), sending best-effort result");
        }
        return result;
    }

    /** A string value in the event and how to replace it. */
    record StringSlot(String value, Consumer<String> setter) {}

    private static void collectStringSlots(Event e, List<StringSlot> out) {
        addSlot(e.id, v -> e.id = v, out);
        addSlot(e.sessionId, v -> e.sessionId = v, out);
        addSlot(e.projectId, v -> e.projectId = v, out);
        addSlot(e.eventType, v -> e.eventType = v, out);
        addSlot(e.ipAddress, v -> e.ipAddress = v, out);
        addSlot(e.sdkLanguage, v -> e.sdkLanguage = v, out);
        addSlot(e.mcpcatVersion, v -> e.mcpcatVersion = v, out);
        addSlot(e.serverName, v -> e.serverName = v, out);
        addSlot(e.serverVersion, v -> e.serverVersion = v, out);
        addSlot(e.clientName, v -> e.clientName = v, out);
        addSlot(e.clientVersion, v -> e.clientVersion = v, out);
        addSlot(e.identifyActorGivenId, v -> e.identifyActorGivenId = v, out);
        addSlot(e.identifyActorName, v -> e.identifyActorName = v, out);
        collectTree(e.identifyActorData, v -> e.identifyActorData = v, out);
        addSlot(e.resourceName, v -> e.resourceName = v, out);
        collectTree(e.parameters, v -> e.parameters = v, out);
        collectTree(e.response, v -> e.response = v, out);
        addSlot(e.userIntent, v -> e.userIntent = v, out);
        collectTree(e.error, v -> e.error = v, out);
    }

    private static void addSlot(String value, Consumer<String> setter, List<StringSlot> out) {
        if (value != null && value.length() > MIN_CANDIDATE_LENGTH) {
            out.add(new StringSlot(value, setter));
        }
    }

    @SuppressWarnings("unchecked")
    private static void collectTree(Object node, Consumer<String> setter, List<StringSlot> out) {
        if (node instanceof String s) {
            addSlot(s, setter, out);
        } else if (node instanceof List<?> list) {
            List<Object> mutable = (List<Object>) list;
            for (int i = 0; i < mutable.size(); i++) {
                int index = i;
                collectTree(mutable.get(i), v -> mutable.set(index, v), out);
            }
        } else if (node instanceof Map<?, ?> map) {
            Map<String, Object> mutable = (Map<String, Object>) map;
            for (Map.Entry<String, Object> entry : mutable.entrySet()) {
                collectTree(entry.getValue(), entry::setValue, out);
            }
        }
    }

    /**
     * Copies an event whose user-controlled fields are normalized trees. Normalized
     * trees are acyclic, so plain recursion terminates.
     */
    static Event deepCopy(Event event) {
        Event copy = event.copy();
        copy.parameters = copyTree(copy.parameters);
        copy.response = copyTree(copy.response);
        copy.identifyActorData = copyTree(copy.identifyActorData);
        copy.error = copyTree(copy.error);
        return copy;
    }

    private static Object copyTree(Object node) {
        if (node instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) out.add(copyTree(item));
            return out;
        }
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) out.put(String.valueOf(e.getKey()), copyTree(e.getValue()));
            return out;
        }
        return node;
    }
}
