package block.ast;

public record OperatorNode(Operator operator, SourceSpan span) implements Node {

	public boolean is(Operator other) {
		return operator == other;
	}

	@Override
	public String raw() {
		return operator.symbol();
	}

	@Override
	public String rendered() {
		return operator.target();
	}
}
