package block.ast;

/**
 * A double-quoted string literal. {@code text} is the content between the
 * quotes, escapes kept as written.
 */
public record StringNode(String text, SourceSpan span) implements Node {
	@Override
	public String raw() {
		return "\"" + text + "\"";
	}

	@Override
	public String rendered() {
		return raw();
	}
}
