package org.javai.erroradapter;

import org.javai.erroradapter.diagnostics.DiagnosticContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FailureRecordTest {

    private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");

    @Test
    void of_describesErrorByTypeAndMessage() {
        FailureRecord failure = FailureRecord.of("Op", new IOException("file not found"), null, NOW);

        assertThat(failure.description()).isEqualTo("java.io.IOException: file not found");
        assertThat(failure.context()).isEqualTo(DiagnosticContext.empty());
    }

    @Test
    void message_isNullWhenErrorHasNone() {
        FailureRecord failure = FailureRecord.of("Op", new IllegalStateException(), null, NOW);

        assertThat(failure.message()).isNull();
        assertThat(failure.description()).isEqualTo("java.lang.IllegalStateException");
    }

    @Test
    void fingerprint_usesThrowSite() {
        IOException error = new IOException("boom");
        error.setStackTrace(new StackTraceElement[] {
                new StackTraceElement("com.acme.Config", "load", "Config.java", 42)
        });

        FailureRecord failure = FailureRecord.of("Config.load", error, null, NOW);

        assertThat(failure.fingerprint()).isEqualTo("IOException@com.acme.Config:42");
    }

    @Test
    void fingerprint_withoutStack_usesTypeName() {
        IOException error = new IOException("boom");
        error.setStackTrace(new StackTraceElement[0]);

        FailureRecord failure = FailureRecord.of("Op", error, null, NOW);

        assertThat(failure.fingerprint()).isEqualTo("java.io.IOException");
    }

    @Test
    void constructor_keepsExplicitDescriptionAndContext() {
        DiagnosticContext context = new DiagnosticContext("call-stack", List.of("a.B.c(B.java:1)"));

        FailureRecord failure = new FailureRecord("Op", new IOException("x"), "custom", context, NOW);

        assertThat(failure.description()).isEqualTo("custom");
        assertThat(failure.context().frames()).containsExactly("a.B.c(B.java:1)");
    }

    @Test
    void constructor_requiresOperationErrorAndTimestamp() {
        IOException error = new IOException("x");

        assertThatThrownBy(() -> FailureRecord.of(null, error, null, NOW))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("operation");
        assertThatThrownBy(() -> FailureRecord.of("Op", null, null, NOW))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("error");
        assertThatThrownBy(() -> FailureRecord.of("Op", error, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("occurredAt");
    }

    @Test
    void fingerprint_skipsJdkFramesToReachCallSite() {
        NumberFormatException error = new NumberFormatException("For input string: \"three\"");
        error.setStackTrace(new StackTraceElement[] {
                new StackTraceElement("java.lang.NumberFormatException", "forInputString", "NumberFormatException.java", 67),
                new StackTraceElement("java.lang.Integer", "parseInt", "Integer.java", 668),
                new StackTraceElement("com.acme.Cart", "quantity", "Cart.java", 31)
        });

        FailureRecord failure = FailureRecord.of("Cart.quantity", error, null, NOW);

        assertThat(failure.fingerprint()).isEqualTo("NumberFormatException@com.acme.Cart:31");
    }

    @Test
    void fingerprint_allJdkFrames_usesTopFrame() {
        IOException error = new IOException("boom");
        error.setStackTrace(new StackTraceElement[] {
                new StackTraceElement("java.io.FileInputStream", "open0", "FileInputStream.java", 10),
                new StackTraceElement("java.lang.Thread", "run", "Thread.java", 20)
        });

        FailureRecord failure = FailureRecord.of("Op", error, null, NOW);

        assertThat(failure.fingerprint()).isEqualTo("IOException@java.io.FileInputStream:10");
    }

    @Test
    void of_brokenToString_describesByClassName() {
        Exception error = new IllegalStateException() {
            @Override
            public String toString() {
                throw new UnsupportedOperationException("no description");
            }
        };

        FailureRecord failure = FailureRecord.of("Op", error, null, NOW);

        assertThat(failure.description()).isEqualTo(error.getClass().getName());
    }
}
