package block;

/**
 * Exception thrown when a Block program cannot be transpiled.
 *
 * There is a single error kind; conditions are told apart by message only.
 */
public class TranspileException extends RuntimeException {
	private final int line;

	public TranspileException(String message) {
		this(message, -1);
	}

	public TranspileException(String message, int line) {
		super(line > 0 ? message + " (line " + line + ")" : message);
		this.line = line;
	}

	public TranspileException(String message, Throwable cause) {
		super(message, cause);
		this.line = -1;
	}

	/**
	 * @return the 1-based source line the error refers to, or {@code -1} when
	 *         unknown
	 */
	public int line() {
		return line;
	}
}
