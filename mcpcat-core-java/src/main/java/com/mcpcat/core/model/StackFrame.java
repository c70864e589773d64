package com.mcpcat.core.model;

import com.google.gson.annotations.SerializedName;

/**
 * A single frame of a captured stack trace. Frame lists are ordered oldest call first.
 */
public class StackFrame {

    @SerializedName("filename") public String filename;
    @SerializedName("abs_path") public String absPath;
    @SerializedName("function") public String function;
    @SerializedName("module")   public String module;
    @SerializedName("lineno")   public Integer lineno;     // nullable
    @SerializedName("colno")    public Integer colno;      // nullable, not known on the JVM
    @SerializedName("in_app")   public boolean inApp;

    public StackFrame() {}

    public StackFrame(String filename, String function, Integer lineno, boolean inApp) {
        this.filename = filename;
        this.function = function;
        this.lineno = lineno;
        this.inApp = inApp;
    }
}
