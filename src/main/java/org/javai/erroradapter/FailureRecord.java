package org.javai.erroradapter;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.javai.erroradapter.diagnostics.DiagnosticContext;

/**
 * A suppressed failure together with the diagnostic context captured when it happened.
 * Built by {@link ErrorAdapter} on the failure path only and handed straight to a sink.
 *
 * @param operation The name of the wrapped operation
 * @param error The throwable raised by the operation
 * @param description Human-readable description (exception type and message)
 * @param context Diagnostic snapshot taken at failure time (may be empty)
 * @param occurredAt When the failure was captured
 */
public record FailureRecord(
        String operation,
        Throwable error,
        String description,
        DiagnosticContext context,
        Instant occurredAt
) {

    private static final List<String> JDK_PACKAGES = List.of("java.", "javax.", "jdk.", "sun.", "com.sun.");

    public FailureRecord {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        description = description == null ? describe(error) : description;
        context = context == null ? DiagnosticContext.empty() : context;
    }

    /**
     * Creates a record describing the given error by its {@code toString()}, or by its
     * class name when {@code toString()} itself throws.
     */
    public static FailureRecord of(String operation, Throwable error, DiagnosticContext context, Instant occurredAt) {
        return new FailureRecord(operation, error, null, context, occurredAt);
    }

    /**
     * The fully qualified class name of the error.
     */
    public String errorType() {
        return error.getClass().getName();
    }

    /**
     * The error's own message, or {@code null} if it has none.
     */
    public String message() {
        return error.getMessage();
    }

    /**
     * A stable key for grouping identical failures: the error's simple name and the
     * class and line of the first frame outside the JDK and the error's own class.
     * Falls back to the top frame when the whole stack is JDK code.
     */
    public String fingerprint() {
        StackTraceElement[] stack = error.getStackTrace();
        if (stack.length == 0) {
            return error.getClass().getName();
        }
        StackTraceElement site = stack[0];
        for (StackTraceElement element : stack) {
            if (!isJdkFrame(element) && !element.getClassName().equals(error.getClass().getName())) {
                site = element;
                break;
            }
        }
        return error.getClass().getSimpleName() + "@" + site.getClassName() + ":" + site.getLineNumber();
    }

    private static boolean isJdkFrame(StackTraceElement element) {
        String className = element.getClassName();
        for (String prefix : JDK_PACKAGES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        try {
            return String.valueOf(error);
        } catch (RuntimeException e) {
            // toString() itself failed
            return error.getClass().getName();
        }
    }
}
