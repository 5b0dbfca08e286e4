package org.javai.erroradapter.sink;

import org.javai.erroradapter.FailureRecord;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints each failure and its stack snapshot to a console stream.
 *
 * <p>Output format:
 * <pre>
 * Error: java.io.FileNotFoundException: doesNotExist
 *  Stack Symbols: [com.acme.Reader.load(Reader.java:12), ...]
 * </pre>
 */
public class ConsoleFailureSink implements FailureSink {

	private final PrintStream out;

	/**
	 * Creates a sink that writes to standard output.
	 */
	public ConsoleFailureSink() {
		this(System.out);
	}

	public ConsoleFailureSink(PrintStream out) {
		this.out = Objects.requireNonNull(out, "out must not be null");
	}

	@Override
	public void record(FailureRecord failure) {
		out.println(format(failure));
	}

	static String format(FailureRecord failure) {
		return "Error: " + failure.description() + " \n Stack Symbols: " + failure.context().frames();
	}
}
