package org.javai.erroradapter.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Captures the failure's own stack trace, followed by a {@code Caused by:} section for
 * each throwable in its cause chain.
 */
public final class FailureStackContextProvider implements DiagnosticContextProvider {

    static final String SOURCE = "failure-stack";

    private final int maxDepth;

    public FailureStackContextProvider(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public DiagnosticContext capture(Throwable failure) {
        List<String> frames = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        Throwable current = failure;
        while (current != null && seen.add(current) && frames.size() < maxDepth) {
            if (current != failure) {
                frames.add("Caused by: " + current);
            }
            for (StackTraceElement element : current.getStackTrace()) {
                if (frames.size() >= maxDepth) {
                    break;
                }
                frames.add(element.toString());
            }
            current = current.getCause();
        }
        return new DiagnosticContext(SOURCE, frames);
    }

    public int maxDepth() {
        return maxDepth;
    }
}
