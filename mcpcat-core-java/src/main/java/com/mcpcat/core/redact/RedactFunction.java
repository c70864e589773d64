package com.mcpcat.core.redact;

/**
 * Caller-supplied scrubber applied to each redactable string of an event,
 * e.g. to mask API keys or e-mail addresses before export.
 */
@FunctionalInterface
public interface RedactFunction {

    String redact(String text);
}
