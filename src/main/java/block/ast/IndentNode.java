package block.ast;

/**
 * Leading whitespace of a line, reproduced verbatim. It has no structural
 * meaning.
 */
public record IndentNode(String whitespace, SourceSpan span) implements Node {
	@Override
	public String raw() {
		return whitespace;
	}

	@Override
	public String rendered() {
		return whitespace;
	}
}
