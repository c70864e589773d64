package com.mcpcat.core.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mcpcat.core.model.Event;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical JSON form of an {@link Event}: absent fields omitted, nested nulls kept,
 * no HTML escaping, timestamp as an ISO-8601 instant with milliseconds. Size limits
 * are measured on this form.
 */
public final class EventJson {

    private EventJson() {}

    private static final Gson GSON = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    public static class EventJsonException extends RuntimeException {
        public EventJsonException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Serializes the event. Events that came out of the truncator always serialize;
     * raw events may not (NaN, cycles, platform objects).
     *
     * @throws EventJsonException if Gson cannot serialize one of the user-controlled trees
     */
    public static String toJson(Event event) {
        try {
            return GSON.toJson(toTree(event));
        } catch (RuntimeException e) {
            throw new EventJsonException("Event is not serializable: " + e.getMessage(), e);
        }
    }

    /** UTF-8 byte length of {@link #toJson(Event)}. */
    public static int byteSize(Event event) {
        return toJson(event).getBytes(StandardCharsets.UTF_8).length;
    }

    /** Field order follows {@link Event}'s declaration order. */
    static Map<String, Object> toTree(Event e) {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "id", e.id);
        putIfPresent(out, "sessionId", e.sessionId);
        putIfPresent(out, "projectId", e.projectId);
        putIfPresent(out, "eventType", e.eventType);
        if (e.timestamp != null) out.put("timestamp", ObjectTrees.ISO_MILLIS.format(e.timestamp));
        putIfPresent(out, "duration", e.duration);
        putIfPresent(out, "ipAddress", e.ipAddress);
        putIfPresent(out, "sdkLanguage", e.sdkLanguage);
        putIfPresent(out, "mcpcatVersion", e.mcpcatVersion);
        putIfPresent(out, "serverName", e.serverName);
        putIfPresent(out, "serverVersion", e.serverVersion);
        putIfPresent(out, "clientName", e.clientName);
        putIfPresent(out, "clientVersion", e.clientVersion);
        putIfPresent(out, "identifyActorGivenId", e.identifyActorGivenId);
        putIfPresent(out, "identifyActorName", e.identifyActorName);
        putIfPresent(out, "identifyActorData", e.identifyActorData);
        putIfPresent(out, "resourceName", e.resourceName);
        putIfPresent(out, "parameters", e.parameters);
        putIfPresent(out, "response", e.response);
        putIfPresent(out, "userIntent", e.userIntent);
        putIfPresent(out, "isError", e.isError);
        putIfPresent(out, "error", e.error);
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) out.put(key, value);
    }
}
