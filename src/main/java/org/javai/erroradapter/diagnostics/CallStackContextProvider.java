package org.javai.erroradapter.diagnostics;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.erroradapter.ErrorAdapter;

/**
 * Captures the current thread's call stack at the moment a failure is handled.
 *
 * <p>Frames belonging to the adapter itself are dropped, so the first frame is the code
 * that called {@link ErrorAdapter#wrap}.
 */
public final class CallStackContextProvider implements DiagnosticContextProvider {

    static final String SOURCE = "call-stack";

    private static final Set<String> ADAPTER_CLASSES = Set.of(
            CallStackContextProvider.class.getName(),
            ErrorAdapter.class.getName()
    );

    private final StackWalker walker = StackWalker.getInstance();
    private final int maxDepth;

    public CallStackContextProvider(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public DiagnosticContext capture(Throwable failure) {
        List<String> frames = walker.walk(stream -> stream
                .dropWhile(frame -> ADAPTER_CLASSES.contains(frame.getClassName()))
                .limit(maxDepth)
                .map(StackWalker.StackFrame::toString)
                .collect(Collectors.toList()));
        return new DiagnosticContext(SOURCE, frames);
    }

    public int maxDepth() {
        return maxDepth;
    }
}
