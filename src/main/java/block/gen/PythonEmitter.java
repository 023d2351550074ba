package block.gen;

import block.TranspileException;
import block.TranspilerOptions;
import block.ast.IndentNode;
import block.ast.Keyword;
import block.ast.KeywordNode;
import block.ast.LineEndNode;
import block.ast.Node;
import block.ast.OperandNode;
import block.ast.Operator;
import block.ast.OperatorNode;
import block.ast.TypeAnnotationNode;
import block.types.Builtins;
import block.types.TypeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static block.gen.DiscoveryPass.at;
import static block.gen.DiscoveryPass.isIdentifier;
import static block.gen.DiscoveryPass.isPunct;

/**
 * Second pass: streams the flat node sequence into Python text, one output
 * line per line end.
 *
 * Brackets are resolved from local context only. A {@code [} becomes a call
 * paren after a plain name, a subscript, slice or copy after a collection
 * variable, and a map or list literal anywhere else depending on whether its
 * contents hold a top-level colon.
 */
public final class PythonEmitter {
	private static final Logger log = LoggerFactory.getLogger(PythonEmitter.class);

	private final Discovery discovery;
	private final TypeSystem types;
	private final TranspilerOptions options;
	private List<Node> nodes;
	private boolean headerOpen;

	public PythonEmitter(Discovery discovery, TranspilerOptions options) {
		this.discovery = discovery;
		this.types = discovery.types();
		this.options = options;
	}

	public String emit(List<Node> nodes) {
		this.nodes = nodes;
		List<String> lines = new ArrayList<>();
		if (options.runtimeImport()) {
			lines.add("from " + options.runtimeModule() + " import *");
		}

		int start = 0;
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i) instanceof LineEndNode) {
				lines.add(emitLine(start, i));
				start = i + 1;
			}
		}
		if (start < nodes.size()) {
			lines.add(emitLine(start, nodes.size()));
		}

		log.debug("Emitted {} lines", lines.size());
		return String.join("\n", lines);
	}

	private String emitLine(int from, int to) {
		StringBuilder out = new StringBuilder();
		BracketStack brackets = new BracketStack();
		int i = from;
		if (i < to && nodes.get(i) instanceof IndentNode indent) {
			out.append(indent.whitespace());
			i++;
		}
		Node first = i < to ? nodes.get(i) : null;
		headerOpen = first instanceof KeywordNode kw && kw.keyword().opensBlock();
		renderRange(i, to, out, brackets);

		if (headerOpen && !out.toString().stripTrailing().endsWith(":")) {
			out.append(':');
		}
		return out.toString();
	}

	private void renderRange(int from, int to, StringBuilder out, BracketStack brackets) {
		int i = from;
		while (i < to) {
			i = renderNode(i, to, out, brackets);
		}
	}

	private String render(int from, int to) {
		StringBuilder out = new StringBuilder();
		renderRange(from, to, out, new BracketStack());
		return out.toString();
	}

	/** Renders the node at {@code i} and returns the index of the next one. */
	private int renderNode(int i, int to, StringBuilder out, BracketStack brackets) {
		Node node = nodes.get(i);

		if (node instanceof TypeAnnotationNode) {
			return i + 1;
		}

		if (node instanceof KeywordNode kw) {
			switch (kw.keyword()) {
				case FN -> {
					return renderFunctionHeader(i, to, out, brackets);
				}
				case FOR -> {
					return renderForHeader(i, to, out, brackets);
				}
				case RETURN -> {
					// one-line body: close the header first
					if (headerOpen && !out.toString().stripTrailing().endsWith(":")) {
						out.append(':');
					}
					headerOpen = false;
					out.append("return ");
				}
				case IF, ELIF, WHILE -> out.append(kw.keyword().target()).append(' ');
				case ELSE -> out.append("else");
				case IN -> out.append(" in ");
			}
			return i + 1;
		}

		if (node instanceof OperandNode operand) {
			if (operand.is("[")) {
				return openBracket(i, to, out, brackets);
			}
			if (operand.is("]")) {
				out.append(brackets.close());
				return i + 1;
			}
			if (operand.isIdentifier()) {
				out.append(renderIdentifier(i));
				return i + 1;
			}
		}

		out.append(node.rendered());
		return i + 1;
	}

	/**
	 * Constants become their Python literal and runtime functions stay as they
	 * are. Anything else must be declared and gets the namespace prefix.
	 */
	private String renderIdentifier(int i) {
		String name = nodes.get(i).raw();
		if (Builtins.isConstant(name)) {
			return Builtins.constant(name).target();
		}
		if (Builtins.isFunction(name)) {
			return name;
		}
		boolean declared = types.isDefinedVariable(name) || types.isDefinedFunction(name);
		if (!declared) {
			Node next = at(nodes, i + 1);
			boolean call = (next instanceof OperatorNode op && op.is(Operator.LPAREN))
					|| (isPunct(next, "[") && !discovery.isCollectionVariable(name));
			int line = nodes.get(i).span().line();
			throw new TranspileException(
					(call ? "Undefined function '" : "Undefined identifier '") + name + "'", line);
		}
		return options.namespacePrefix() + name;
	}

	private int openBracket(int i, int to, StringBuilder out, BracketStack brackets) {
		BracketContent content = BracketContent.scan(nodes, i, to);
		int after = content.matched() ? content.close() + 1 : content.close();
		Node prev = at(nodes, i - 1);

		if (isIdentifier(prev) && !Builtins.isConstant(prev.raw())) {
			if (!discovery.isCollectionVariable(prev.raw())) {
				out.append('(');
				brackets.open(')');
				return i + 1;
			}
			if (content.isEmpty()) {
				out.append("[:]");
				return after;
			}
			if (!content.commas().isEmpty() && content.colons() == 0) {
				List<int[]> parts = content.parts();
				if (parts.size() == 2) {
					// inclusive end
					out.append('[')
							.append(render(parts.get(0)[0], parts.get(0)[1]))
							.append(':')
							.append(render(parts.get(1)[0], parts.get(1)[1]))
							.append("+1]");
					return after;
				}
			}
			out.append('[');
			brackets.open(']');
			return i + 1;
		}

		if (content.colons() > 0) {
			if (isSetElement(i)) {
				throw new TranspileException("Cannot use map (unhashable) type in set literal",
						nodes.get(i).span().line());
			}
			out.append('{');
			brackets.open('}');
			return i + 1;
		}
		if (content.containsMapLiteral(nodes)) {
			throw new TranspileException("Cannot use map (unhashable) type in list literal",
					nodes.get(i).span().line());
		}
		out.append('[');
		brackets.open(']');
		return i + 1;
	}

	/** Whether the bracket at {@code i} is an element written directly inside a brace set. */
	private boolean isSetElement(int i) {
		Node prev = at(nodes, i - 1);
		if (isBrace(prev, Operator.LBRACE)) {
			return true;
		}
		if (!isPunct(prev, ",")) {
			return false;
		}
		int depth = 0;
		for (int j = i - 2; j >= 0 && !(nodes.get(j) instanceof LineEndNode); j--) {
			Node node = nodes.get(j);
			if (isPunct(node, "]") || isBrace(node, Operator.RPAREN) || isBrace(node, Operator.RBRACE)) {
				depth++;
			} else if (isPunct(node, "[") || isBrace(node, Operator.LPAREN) || isBrace(node, Operator.LBRACE)) {
				if (depth == 0) {
					return isBrace(node, Operator.LBRACE);
				}
				depth--;
			}
		}
		return false;
	}

	private static boolean isBrace(Node node, Operator operator) {
		return node instanceof OperatorNode op && op.is(operator);
	}

	/**
	 * {@code fn NAME [a:num, b=1] : ret} becomes {@code def NAME(a,b=1)}. The
	 * annotations are dropped and defaults rendered like any other expression.
	 */
	private int renderFunctionHeader(int i, int to, StringBuilder out, BracketStack brackets) {
		out.append("def ");
		i++;
		if (i < to && isIdentifier(nodes.get(i))) {
			out.append(options.namespacePrefix()).append(nodes.get(i).raw());
			i++;
		}
		if (i >= to || !isPunct(nodes.get(i), "[")) {
			out.append("()");
			return i;
		}

		BracketContent params = BracketContent.scan(nodes, i, to);
		out.append('(');
		for (int[] part : paramParts(params)) {
			int k = part[0];
			while (k < part[1]) {
				Node node = nodes.get(k);
				if (isIdentifier(node)) {
					out.append(options.namespacePrefix()).append(node.raw());
					k++;
				} else if (node instanceof OperatorNode op && op.is(Operator.ASSIGN)) {
					out.append('=');
					renderRange(k + 1, part[1], out, brackets);
					k = part[1];
				} else {
					k++;
				}
			}
			if (part[1] < params.close()) {
				out.append(',');
			}
		}
		if (params.matched()) {
			out.append(')');
			return params.close() + 1;
		}
		return params.close();
	}

	private static List<int[]> paramParts(BracketContent params) {
		List<int[]> parts = new ArrayList<>();
		int from = params.open() + 1;
		for (int comma : params.commas()) {
			parts.add(new int[] { from, comma });
			from = comma + 1;
		}
		parts.add(new int[] { from, params.close() });
		return parts;
	}

	/**
	 * {@code for x in A..B} iterates the closed interval, so the end bound is
	 * raised by one for Python's half-open {@code range}. Without a range
	 * operator the iterable is rendered as written.
	 */
	private int renderForHeader(int i, int to, StringBuilder out, BracketStack brackets) {
		out.append("for ");
		i++;
		while (i < to) {
			Node node = nodes.get(i);
			if (!(node instanceof KeywordNode kw && kw.is(Keyword.IN))) {
				i = renderNode(i, to, out, brackets);
				continue;
			}
			out.append(" in ");
			i++;

			int end = iterableEnd(i, to);
			int range = rangeOperator(i, end);
			if (range > i && range + 1 < end) {
				out.append("range(")
						.append(render(i, range))
						.append(", ")
						.append(render(range + 1, end))
						.append(" + 1)");
			} else {
				renderRange(i, end, out, brackets);
			}
			i = end;
		}
		return i;
	}

	/** The iterable runs to the header's trailing colon, or to the end of the line. */
	private int iterableEnd(int from, int to) {
		int depth = 0;
		for (int j = from; j < to; j++) {
			Node node = nodes.get(j);
			if (isPunct(node, "[")) {
				depth++;
			} else if (isPunct(node, "]")) {
				depth--;
			} else if (depth == 0 && isPunct(node, ":")) {
				return j;
			}
		}
		return to;
	}

	private int rangeOperator(int from, int to) {
		int depth = 0;
		for (int j = from; j < to; j++) {
			Node node = nodes.get(j);
			if (isPunct(node, "[")) {
				depth++;
			} else if (isPunct(node, "]")) {
				depth--;
			} else if (depth == 0 && node instanceof OperatorNode op && op.is(Operator.RANGE)) {
				return j;
			}
		}
		return -1;
	}
}
