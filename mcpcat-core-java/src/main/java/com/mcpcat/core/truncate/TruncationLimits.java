package com.mcpcat.core.truncate;

/**
 * Fixed size limits applied to every event before it leaves the process.
 */
public final class TruncationLimits {

    private TruncationLimits() {}

    // Normalization
    public static final int MAX_DEPTH = 10;
    public static final int MAX_BREADTH = 100;
    public static final int MAX_STRING_LENGTH = 32_768;

    /** Ceiling on the UTF-8 size of the canonical JSON form. */
    public static final int MAX_EVENT_BYTES = 102_400;

    // Field level
    public static final int MAX_USER_INTENT_LENGTH = 2_048;
    public static final int MAX_ERROR_MESSAGE_LENGTH = 2_048;
    public static final int MAX_RESOURCE_NAME_LENGTH = 256;
    public static final int MAX_METADATA_LENGTH = 256;
    public static final int MAX_STACK_FRAMES = 50;
    public static final int MAX_CONTENT_TEXT_LENGTH = 32_768;

    public static final String TRUNCATION_SUFFIX = "...";
}
