package com.mcpcat.core.error;

import com.mcpcat.core.model.ChainedErrorData;
import com.mcpcat.core.model.ErrorData;
import com.mcpcat.core.model.StackFrame;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.*;

/**
 * Turns a Throwable (or any value thrown by a tool handler) into {@link ErrorData}.
 *
 * Frames are ordered oldest call first and limited to the {@value #MAX_STACK_FRAMES}
 * most recent calls. The cause chain is followed for at most
 * {@value #MAX_EXCEPTION_CHAIN_DEPTH} links and stops at a cause seen before.
 */
public final class ExceptionCapture {

    private ExceptionCapture() {}

    static final int MAX_EXCEPTION_CHAIN_DEPTH = 10;
    static final int MAX_STACK_FRAMES = 50;
    static final String PLATFORM = "java";

    // Frames from these packages are library code (in_app = false)
    private static final String[] LIBRARY_PACKAGES = {
        "java.", "javax.", "jdk.", "sun.", "com.sun.",
        "org.junit.", "org.gradle.", "org.apache.maven."
    };

    public static ErrorData capture(Object thrown) {
        if (!(thrown instanceof Throwable t)) {
            ErrorData data = new ErrorData();
            data.message = String.valueOf(thrown);
            data.platform = PLATFORM;
            return data;
        }

        ErrorData data = new ErrorData();
        data.message = t.getMessage() != null ? t.getMessage() : "";
        data.type = t.getClass().getName();
        data.platform = PLATFORM;
        data.stack = printStack(t);
        data.frames = frames(t);

        List<ChainedErrorData> chain = unwrapCauses(t);
        if (!chain.isEmpty()) data.chainedErrors = chain;
        return data;
    }

    static List<ChainedErrorData> unwrapCauses(Throwable t) {
        List<ChainedErrorData> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(t);
        Throwable cause = t.getCause();
        while (cause != null && chain.size() < MAX_EXCEPTION_CHAIN_DEPTH && seen.add(cause)) {
            ChainedErrorData link = new ChainedErrorData();
            link.message = cause.getMessage() != null ? cause.getMessage() : "";
            link.type = cause.getClass().getName();
            link.stack = printStack(cause);
            link.frames = frames(cause);
            chain.add(link);
            cause = cause.getCause();
        }
        return chain;
    }

    static List<StackFrame> frames(Throwable t) {
        StackTraceElement[] trace = t.getStackTrace();
        int count = Math.min(trace.length, MAX_STACK_FRAMES);
        List<StackFrame> frames = new ArrayList<>(count);
        // getStackTrace() is most recent first
        for (int i = count - 1; i >= 0; i--) {
            frames.add(toFrame(trace[i]));
        }
        return frames;
    }

    static StackFrame toFrame(StackTraceElement el) {
        StackFrame f = new StackFrame();
        String className = el.getClassName();
        f.filename = el.getFileName() != null ? el.getFileName() : "<unknown>";
        f.absPath = absPath(className, el.getFileName());
        f.function = simpleName(className) + "." + el.getMethodName();
        f.module = className;
        f.lineno = el.getLineNumber() > 0 ? el.getLineNumber() : null;
        f.inApp = !el.isNativeMethod() && isInApp(className);
        return f;
    }

    static boolean isInApp(String className) {
        for (String prefix : LIBRARY_PACKAGES) {
            if (className.startsWith(prefix)) return false;
        }
        return true;
    }

    private static String absPath(String className, String fileName) {
        if (fileName == null) return "<unknown>";
        int dot = className.lastIndexOf('.');
        return dot < 0 ? fileName : className.substring(0, dot).replace('.', '/') + "/" + fileName;
    }

    private static String simpleName(String className) {
        return className.substring(className.lastIndexOf('.') + 1);
    }

    private static String printStack(Throwable t) {
        StringWriter out = new StringWriter();
        try (PrintWriter w = new PrintWriter(out)) {
            t.printStackTrace(w);
        }
        return out.toString();
    }
}
