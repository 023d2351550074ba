package block.ast;

public record LineEndNode(SourceSpan span) implements Node {
	@Override
	public String raw() {
		return "\n";
	}

	@Override
	public String rendered() {
		return "\n";
	}
}
