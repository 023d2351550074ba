package block.ast;

/**
 * One element of the flat node sequence a Block program is assembled into.
 *
 * Every node keeps its raw lexical value and the form it renders to in the
 * generated Python. Identifiers and brackets are re-rendered by the emitter
 * because their output depends on context.
 */
public sealed interface Node permits StringNode, NumberNode, OperandNode, OperatorNode, KeywordNode,
		TypeAnnotationNode, IndentNode, LineEndNode {
	String raw();

	String rendered();

	SourceSpan span();
}
