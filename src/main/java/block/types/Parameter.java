package block.types;

/**
 * A declared function parameter. {@code defaultText} is the raw source text of
 * the default expression, or {@code null} when the parameter is required.
 */
public record Parameter(String name, String type, String defaultText) {
	public boolean hasDefault() {
		return defaultText != null;
	}
}
