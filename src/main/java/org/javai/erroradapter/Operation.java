package org.javai.erroradapter;

/**
 * A deferred, argument-less computation that may fail instead of producing its result.
 * Invoked exactly once per {@link ErrorAdapter#wrap(Operation)} call.
 *
 * @param <T> The type of value produced; {@code null} stands for "no value"
 */
@FunctionalInterface
public interface Operation<T> {

    T run() throws Exception;
}
