package com.mcpcat.core.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Structured failure info attached to an event.
 * Field names use @SerializedName for the snake_case wire form.
 */
public class ErrorData {

    @SerializedName("message")        public String message;
    @SerializedName("type")           public String type;       // nullable
    @SerializedName("stack")          public String stack;      // nullable
    @SerializedName("frames")         public List<StackFrame> frames;
    @SerializedName("chained_errors") public List<ChainedErrorData> chainedErrors;
    @SerializedName("platform")       public String platform;

    /** Copy whose lists are new but whose frames are shared. */
    public ErrorData copy() {
        ErrorData d = new ErrorData();
        d.message = message;
        d.type = type;
        d.stack = stack;
        d.frames = frames != null ? new java.util.ArrayList<>(frames) : null;
        d.chainedErrors = chainedErrors != null ? new java.util.ArrayList<>(chainedErrors) : null;
        d.platform = platform;
        return d;
    }
}
