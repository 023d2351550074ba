package block.ast;

/**
 * A folded {@code : type} annotation. It only feeds the type system and
 * renders to nothing.
 */
public record TypeAnnotationNode(String type, SourceSpan span) implements Node {
	@Override
	public String raw() {
		return ":" + type;
	}

	@Override
	public String rendered() {
		return "";
	}
}
