package org.javai.erroradapter.diagnostics;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class CallStackContextProviderTest {

    @Test
    void capture_startsAtCaller() {
        DiagnosticContext context = new CallStackContextProvider(64).capture(new IOException("x"));

        assertThat(context.source()).isEqualTo("call-stack");
        assertThat(context.frames().get(0))
                .contains(CallStackContextProviderTest.class.getName())
                .contains("capture_startsAtCaller");
        assertThat(context.frames())
                .noneMatch(frame -> frame.contains(CallStackContextProvider.class.getName() + "."));
    }

    @Test
    void capture_respectsMaxDepth() {
        DiagnosticContext context = DiagnosticContextProvider.callStack(2).capture(new IOException("x"));

        assertThat(context.depth()).isEqualTo(2);
    }

    @Test
    void capture_isIndependentOfFailureStack() {
        IOException error = new IOException("x");
        error.setStackTrace(new StackTraceElement[0]);

        DiagnosticContext context = DiagnosticContextProvider.callStack().capture(error);

        assertThat(context.isEmpty()).isFalse();
    }

    @Test
    void constructor_rejectsNonPositiveDepth() {
        assertThatThrownBy(() -> new CallStackContextProvider(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
    }

    @Test
    void none_alwaysEmpty() {
        DiagnosticContext context = DiagnosticContextProvider.none().capture(new IOException("x"));

        assertThat(context.isEmpty()).isTrue();
        assertThat(context.source()).isEqualTo("none");
    }
}
