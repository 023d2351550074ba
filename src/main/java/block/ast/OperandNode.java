package block.ast;

/**
 * An identifier, or one of the punctuation characters {@code [ ] , :} that
 * take part in bracket disambiguation.
 */
public record OperandNode(String value, SourceSpan span) implements Node {

	public boolean isIdentifier() {
		final char first = value.charAt(0);
		return Character.isLetter(first) || first == '_';
	}

	public boolean is(String punctuation) {
		return value.equals(punctuation);
	}

	@Override
	public String raw() {
		return value;
	}

	@Override
	public String rendered() {
		return value;
	}
}
