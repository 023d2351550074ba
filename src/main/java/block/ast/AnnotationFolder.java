package block.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces {@code : type} runs on one line with a single
 * {@link TypeAnnotationNode}.
 *
 * Only three positions carry annotations: after the identifier that starts a
 * declaration ({@code x:num = 1}), after a parameter name inside a {@code fn}
 * header list, and after the header list itself (the return type). Every
 * other colon is left alone, since it belongs to a map literal.
 */
final class AnnotationFolder {

	List<Node> fold(List<Node> tokens) {
		List<Node> out = new ArrayList<>(tokens);
		if (out.isEmpty()) {
			return out;
		}
		if (out.get(0) instanceof KeywordNode kw && kw.is(Keyword.FN)) {
			foldFunctionHeader(out);
		} else if (isIdentifier(out.get(0)) && out.size() > 2 && isPunct(out.get(1), ":")) {
			int end = typeEnd(out, 2);
			if (end > 0 && (end == out.size()
					|| (out.get(end) instanceof OperatorNode op && op.is(Operator.ASSIGN)))) {
				replace(out, 1, end);
			}
		}
		return out;
	}

	private void foldFunctionHeader(List<Node> out) {
		if (out.size() < 2 || !isIdentifier(out.get(1))) {
			return;
		}
		int i = 2;
		if (i < out.size() && isPunct(out.get(i), "[")) {
			i++;
			int depth = 1;
			boolean expectParam = true;
			while (i < out.size() && depth > 0) {
				Node node = out.get(i);
				if (isPunct(node, "[")) {
					depth++;
				} else if (isPunct(node, "]")) {
					depth--;
				} else if (depth == 1 && isPunct(node, ",")) {
					expectParam = true;
					i++;
					continue;
				} else if (depth == 1 && expectParam && isIdentifier(node)) {
					expectParam = false;
					if (i + 2 < out.size() && isPunct(out.get(i + 1), ":")) {
						int end = typeEnd(out, i + 2);
						if (end > 0) {
							replace(out, i + 1, end);
						}
					}
				}
				i++;
			}
		}
		// return type
		if (i + 1 < out.size() && isPunct(out.get(i), ":")) {
			int end = typeEnd(out, i + 1);
			if (end > 0) {
				replace(out, i, end);
			}
		}
	}

	/** @return the exclusive end of a type starting at {@code start}, or -1 */
	private static int typeEnd(List<Node> tokens, int start) {
		if (start >= tokens.size()) {
			return -1;
		}
		Node first = tokens.get(start);
		if (isIdentifier(first)) {
			return start + 1;
		}
		String open;
		String close;
		if (isPunct(first, "[")) {
			open = "[";
			close = "]";
		} else if (first instanceof OperatorNode op && op.is(Operator.LPAREN)) {
			open = "(";
			close = ")";
		} else if (first instanceof OperatorNode op && op.is(Operator.LBRACE)) {
			open = "{";
			close = "}";
		} else {
			return -1;
		}
		int depth = 0;
		for (int i = start; i < tokens.size(); i++) {
			String raw = tokens.get(i).raw();
			if (raw.equals(open)) {
				depth++;
			} else if (raw.equals(close)) {
				depth--;
				if (depth == 0) {
					return i + 1;
				}
			}
		}
		return -1;
	}

	/** Collapses {@code tokens[colon, end)} into one annotation node. */
	private static void replace(List<Node> tokens, int colon, int end) {
		StringBuilder type = new StringBuilder();
		for (int i = colon + 1; i < end; i++) {
			type.append(tokens.get(i).raw());
		}
		SourceSpan span = tokens.get(colon).span();
		tokens.subList(colon, end).clear();
		tokens.add(colon, new TypeAnnotationNode(type.toString(), span));
	}

	private static boolean isIdentifier(Node node) {
		return node instanceof OperandNode operand && operand.isIdentifier();
	}

	private static boolean isPunct(Node node, String punctuation) {
		return node instanceof OperandNode operand && operand.is(punctuation);
	}
}
