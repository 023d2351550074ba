package block.ast;

public record KeywordNode(Keyword keyword, SourceSpan span) implements Node {

	public boolean is(Keyword other) {
		return keyword == other;
	}

	@Override
	public String raw() {
		return keyword.word();
	}

	@Override
	public String rendered() {
		return keyword.target();
	}
}
