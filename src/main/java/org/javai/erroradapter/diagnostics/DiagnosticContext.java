package org.javai.erroradapter.diagnostics;

import java.util.List;
import java.util.Objects;

/**
 * A diagnostic snapshot taken when an operation fails.
 *
 * @param source The kind of provider that produced it (e.g., "call-stack", "failure-stack")
 * @param frames Textual stack frames in the order the provider produced them. Call-stack
 *               contexts start at the caller of the adapter; failure-stack contexts list the
 *               throw site first, followed by a {@code Caused by:} line and frames per cause
 */
public record DiagnosticContext(String source, List<String> frames) {

    private static final DiagnosticContext EMPTY = new DiagnosticContext("none", List.of());

    public DiagnosticContext {
        Objects.requireNonNull(source, "source must not be null");
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    public static DiagnosticContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }
}
