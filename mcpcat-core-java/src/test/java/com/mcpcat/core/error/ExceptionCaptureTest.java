package com.mcpcat.core.error;

import com.mcpcat.core.model.ChainedErrorData;
import com.mcpcat.core.model.ErrorData;
import com.mcpcat.core.model.StackFrame;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionCaptureTest {

    /** trace[0] is the most recent call, as in getStackTrace(). */
    private static StackTraceElement[] trace(int n) {
        StackTraceElement[] trace = new StackTraceElement[n];
        for (int i = 0; i < n; i++) {
            trace[i] = new StackTraceElement("com.acme.tools.Handler", "m" + i, "Handler.java", i + 1);
        }
        return trace;
    }

    @Test
    void messageTypeAndPlatform() {
        ErrorData data = ExceptionCapture.capture(new IllegalStateException("boom"));
        assertEquals("boom", data.message);
        assertEquals("java.lang.IllegalStateException", data.type);
        assertEquals("java", data.platform);
        assertTrue(data.stack.startsWith("java.lang.IllegalStateException: boom"));
        assertNull(data.chainedErrors);
    }

    @Test
    void nullMessageBecomesEmpty() {
        assertEquals("", ExceptionCapture.capture(new RuntimeException()).message);
    }

    @Test
    void framesOrderedOldestFirst() {
        Exception e = new Exception("x");
        e.setStackTrace(trace(3));

        List<StackFrame> frames = ExceptionCapture.capture(e).frames;
        assertEquals(3, frames.size());
        assertEquals("Handler.m2", frames.get(0).function);
        assertEquals("Handler.m0", frames.get(2).function);
        assertEquals(1, frames.get(2).lineno);
    }

    @Test
    void framesCappedAtFiftyMostRecent() {
        Exception e = new Exception("deep");
        e.setStackTrace(trace(80));

        List<StackFrame> frames = ExceptionCapture.capture(e).frames;
        assertEquals(50, frames.size());
        assertEquals("Handler.m49", frames.get(0).function);
        assertEquals("Handler.m0", frames.get(49).function);
    }

    @Test
    void frameFields() {
        StackFrame f = ExceptionCapture.toFrame(
            new StackTraceElement("com.acme.tools.Handler", "call", "Handler.java", 42));
        assertEquals("Handler.java", f.filename);
        assertEquals("com/acme/tools/Handler.java", f.absPath);
        assertEquals("Handler.call", f.function);
        assertEquals("com.acme.tools.Handler", f.module);
        assertEquals(42, f.lineno);
        assertTrue(f.inApp);
    }

    @Test
    void libraryAndNativeFramesNotInApp() {
        assertFalse(ExceptionCapture.toFrame(
            new StackTraceElement("java.util.ArrayList", "forEach", "ArrayList.java", 1511)).inApp);
        assertFalse(ExceptionCapture.toFrame(
            new StackTraceElement("org.junit.platform.Launcher", "run", "Launcher.java", 10)).inApp);

        StackFrame nativeFrame = ExceptionCapture.toFrame(
            new StackTraceElement("com.acme.Native", "invoke0", null, -2));
        assertFalse(nativeFrame.inApp);
        assertEquals("<unknown>", nativeFrame.filename);
        assertNull(nativeFrame.lineno);
    }

    @Test
    void causeChainCaptured() {
        Exception e = new RuntimeException("outer", new IOException("inner", new IllegalArgumentException()));
        List<ChainedErrorData> chain = ExceptionCapture.capture(e).chainedErrors;
        assertEquals(2, chain.size());
        assertEquals("java.io.IOException", chain.get(0).type);
        assertEquals("inner", chain.get(0).message);
        assertEquals("java.lang.IllegalArgumentException", chain.get(1).type);
        assertEquals("", chain.get(1).message);
    }

    @Test
    void causeChainCappedAtTen() {
        Throwable t = new Exception("root");
        for (int i = 0; i < 15; i++) t = new Exception("wrap" + i, t);
        assertEquals(10, ExceptionCapture.capture(t).chainedErrors.size());
    }

    @Test
    void causeCycleTerminates() {
        Exception a = new Exception("a");
        Exception b = new Exception("b", a);
        a.initCause(b);

        ErrorData data = assertDoesNotThrow(() -> ExceptionCapture.capture(a));
        assertEquals(1, data.chainedErrors.size());
        assertEquals("b", data.chainedErrors.get(0).message);
    }

    @Test
    void nonThrowableValue() {
        ErrorData data = ExceptionCapture.capture("tool failed");
        assertEquals("tool failed", data.message);
        assertNull(data.type);
        assertNull(data.frames);
        assertEquals("null", ExceptionCapture.capture(null).message);
    }
}
