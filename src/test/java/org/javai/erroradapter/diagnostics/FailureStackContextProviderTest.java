package org.javai.erroradapter.diagnostics;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.*;

class FailureStackContextProviderTest {

    @Test
    void capture_listsFailureFramesThenCauses() {
        IOException root = new IOException("disk error");
        root.setStackTrace(new StackTraceElement[] {
                new StackTraceElement("com.acme.Disk", "read", "Disk.java", 7)
        });
        UncheckedIOException wrapper = new UncheckedIOException("read failed", root);
        wrapper.setStackTrace(new StackTraceElement[] {
                new StackTraceElement("com.acme.Config", "load", "Config.java", 42),
                new StackTraceElement("com.acme.App", "main", "App.java", 9)
        });

        DiagnosticContext context = DiagnosticContextProvider.failureStack().capture(wrapper);

        assertThat(context.source()).isEqualTo("failure-stack");
        assertThat(context.frames()).containsExactly(
                "com.acme.Config.load(Config.java:42)",
                "com.acme.App.main(App.java:9)",
                "Caused by: java.io.IOException: disk error",
                "com.acme.Disk.read(Disk.java:7)"
        );
    }

    @Test
    void capture_truncatesAtMaxDepth() {
        IOException error = new IOException("x");
        error.setStackTrace(new StackTraceElement[] {
                new StackTraceElement("a.A", "one", "A.java", 1),
                new StackTraceElement("a.A", "two", "A.java", 2),
                new StackTraceElement("a.A", "three", "A.java", 3)
        });

        DiagnosticContext context = new FailureStackContextProvider(2).capture(error);

        assertThat(context.frames()).containsExactly("a.A.one(A.java:1)", "a.A.two(A.java:2)");
    }

    @Test
    void capture_stopsOnCauseCycle() {
        IllegalStateException first = new IllegalStateException("first");
        IllegalArgumentException second = new IllegalArgumentException("second", first);
        first.initCause(second);
        first.setStackTrace(new StackTraceElement[0]);
        second.setStackTrace(new StackTraceElement[0]);

        DiagnosticContext context = DiagnosticContextProvider.failureStack().capture(first);

        assertThat(context.frames()).containsExactly("Caused by: java.lang.IllegalArgumentException: second");
    }
}
