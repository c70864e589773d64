package com.mcpcat.core.model;

/**
 * Tags of the content blocks found in a tool result's {@code content} array,
 * and the texts substituted for blocks that are not forwarded.
 */
public final class ContentBlocks {

    private ContentBlocks() {}

    public static final String TYPE_KEY = "type";
    public static final String TEXT_KEY = "text";
    public static final String RESOURCE_KEY = "resource";
    public static final String BLOB_KEY = "blob";

    public static final String TEXT = "text";
    public static final String IMAGE = "image";
    public static final String AUDIO = "audio";
    public static final String RESOURCE = "resource";
    public static final String RESOURCE_LINK = "resource_link";

    public static final String IMAGE_REDACTED = "[image content redacted - not supported by MCPcat]";
    public static final String AUDIO_REDACTED = "[audio content redacted - not supported by MCPcat]";
    public static final String BINARY_RESOURCE_REDACTED =
        "[binary resource content redacted - not supported by MCPcat]";
    public static final String BINARY_DATA_REDACTED = "[binary data redacted - not supported by MCPcat]";

    public static String unsupportedRedacted(Object type) {
        return "[unsupported content type \"" + type + "\" redacted - not supported by MCPcat]";
    }
}
