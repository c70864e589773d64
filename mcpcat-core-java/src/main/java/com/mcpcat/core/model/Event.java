package com.mcpcat.core.model;

import java.time.Instant;

/**
 * One recorded MCP interaction, as built by the tracing layer and handed to
 * the dispatch layer after {@code EventPipeline.prepare}.
 *
 * Metadata fields are plain scalars. {@code parameters}, {@code response},
 * {@code identifyActorData} and {@code error} are user-controlled and may hold
 * arbitrary object graphs (maps, lists, arrays, POJOs, cycles, values JSON
 * cannot represent). Absent fields are {@code null} and are omitted on the wire.
 */
public class Event {

    // Core identification
    public String id;
    public String sessionId;
    public String projectId;

    // Event metadata
    public String eventType;
    public Instant timestamp;
    public Long duration;

    // Session context
    public String ipAddress;
    public String sdkLanguage;
    public String mcpcatVersion;
    public String serverName;
    public String serverVersion;
    public String clientName;
    public String clientVersion;

    // Actor / identity
    public String identifyActorGivenId;
    public String identifyActorName;
    public Object identifyActorData;

    // Event-specific data
    public String resourceName;
    public Object parameters;
    public Object response;
    public String userIntent;

    // Error tracking
    public Boolean isError;
    public Object error;

    /** Shallow copy: nested trees are shared with this event. */
    public Event copy() {
        Event e = new Event();
        e.id = id;
        e.sessionId = sessionId;
        e.projectId = projectId;
        e.eventType = eventType;
        e.timestamp = timestamp;
        e.duration = duration;
        e.ipAddress = ipAddress;
        e.sdkLanguage = sdkLanguage;
        e.mcpcatVersion = mcpcatVersion;
        e.serverName = serverName;
        e.serverVersion = serverVersion;
        e.clientName = clientName;
        e.clientVersion = clientVersion;
        e.identifyActorGivenId = identifyActorGivenId;
        e.identifyActorName = identifyActorName;
        e.identifyActorData = identifyActorData;
        e.resourceName = resourceName;
        e.parameters = parameters;
        e.response = response;
        e.userIntent = userIntent;
        e.isError = isError;
        e.error = error;
        return e;
    }
}
