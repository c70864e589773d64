package com.mcpcat.core.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * One link of a cause chain, see {@link ErrorData#chainedErrors}.
 */
public class ChainedErrorData {

    @SerializedName("message") public String message;
    @SerializedName("type")    public String type;
    @SerializedName("stack")   public String stack;
    @SerializedName("frames")  public List<StackFrame> frames;
}
