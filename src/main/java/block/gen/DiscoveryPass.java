package block.gen;

import block.TranspileException;
import block.ast.Keyword;
import block.ast.KeywordNode;
import block.ast.LineEndNode;
import block.ast.Node;
import block.ast.OperandNode;
import block.ast.Operator;
import block.ast.OperatorNode;
import block.ast.TypeAnnotationNode;
import block.types.Parameter;
import block.types.TypeInference;
import block.types.TypeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * First pass over the flat node sequence. Registers loop variables, functions
 * with their parameters, and declarations, and records which names hold a
 * collection literal.
 */
public final class DiscoveryPass {
	private static final Logger log = LoggerFactory.getLogger(DiscoveryPass.class);

	public Discovery run(List<Node> nodes) {
		TypeSystem types = new TypeSystem();
		Set<String> collections = new HashSet<>();

		for (int i = 0; i < nodes.size(); i++) {
			Node node = nodes.get(i);
			int line = node.span().line();

			if (node instanceof KeywordNode kw && kw.is(Keyword.FOR)) {
				if (isIdentifier(at(nodes, i + 1))) {
					String loopVariable = nodes.get(i + 1).raw();
					define(line, () -> types.defineVariable(loopVariable, "num"));
				}
				continue;
			}

			if (node instanceof KeywordNode kw && kw.is(Keyword.FN)) {
				discoverFunction(nodes, i, types, collections);
				continue;
			}

			if (!isIdentifier(node)) {
				continue;
			}
			String name = node.raw();
			Node next = at(nodes, i + 1);
			int valueIndex;
			if (next instanceof TypeAnnotationNode annotation) {
				define(line, () -> types.defineVariable(name, annotation.type()));
				if (!isAssign(at(nodes, i + 2))) {
					continue;
				}
				valueIndex = i + 3;
			} else if (isAssign(next)) {
				valueIndex = i + 2;
				Node value = at(nodes, valueIndex);
				if (value == null || value instanceof LineEndNode) {
					continue;
				}
				define(line, () -> types.defineVariable(name, TypeInference.infer(value, types)));
			} else {
				continue;
			}

			if (opensCollection(at(nodes, valueIndex))) {
				collections.add(name);
			} else {
				collections.remove(name);
			}
		}

		log.debug("Discovered {} variables, {} functions, {} collection variables",
				types.variables().size(), types.functions().size(), collections.size());
		return new Discovery(types, collections);
	}

	/**
	 * Reads {@code fn NAME [params] : ret}. Each parameter is an identifier, an
	 * optional annotation and an optional {@code = default} running to the next
	 * top-level comma or the closing bracket.
	 */
	private void discoverFunction(List<Node> nodes, int fnIndex, TypeSystem types, Set<String> collections) {
		Node nameNode = at(nodes, fnIndex + 1);
		if (!isIdentifier(nameNode)) {
			return;
		}
		int line = nameNode.span().line();
		List<Parameter> params = new ArrayList<>();
		List<List<Node>> defaults = new ArrayList<>();

		int i = fnIndex + 2;
		if (isPunct(at(nodes, i), "[")) {
			i++;
			while (i < nodes.size() && !(nodes.get(i) instanceof LineEndNode) && !isPunct(nodes.get(i), "]")) {
				if (!isIdentifier(nodes.get(i))) {
					i++;
					continue;
				}
				String paramName = nodes.get(i).raw();
				String paramType = "num";
				i++;
				if (at(nodes, i) instanceof TypeAnnotationNode annotation) {
					paramType = annotation.type();
					i++;
				}
				String defaultText = null;
				List<Node> defaultNodes = List.of();
				if (isAssign(at(nodes, i))) {
					i++;
					int start = i;
					int depth = 0;
					while (i < nodes.size() && !(nodes.get(i) instanceof LineEndNode)) {
						Node n = nodes.get(i);
						if (isPunct(n, "[")) {
							depth++;
						} else if (isPunct(n, "]")) {
							if (depth == 0) {
								break;
							}
							depth--;
						} else if (depth == 0 && isPunct(n, ",")) {
							break;
						}
						i++;
					}
					defaultNodes = nodes.subList(start, i);
					defaultText = rawText(defaultNodes);
					if (opensCollection(at(nodes, start))) {
						collections.add(paramName);
					}
				}
				params.add(new Parameter(paramName, paramType, defaultText));
				defaults.add(defaultNodes);
			}
			i++;
		}

		checkDefaults(params, defaults, line);

		String returnType = at(nodes, i) instanceof TypeAnnotationNode annotation ? annotation.type() : "num";
		define(line, () -> types.defineFunction(nameNode.raw(), returnType, params));
		for (Parameter param : params) {
			define(line, () -> types.defineVariable(param.name(), param.type()));
		}
	}

	/** A default is evaluated where the function is defined, so it cannot see sibling parameters. */
	private static void checkDefaults(List<Parameter> params, List<List<Node>> defaults, int line) {
		Set<String> names = new HashSet<>();
		params.forEach(p -> names.add(p.name()));
		for (int p = 0; p < params.size(); p++) {
			for (Node node : defaults.get(p)) {
				if (isIdentifier(node) && names.contains(node.raw())) {
					throw new TranspileException("Default value for parameter '" + params.get(p).name()
							+ "' cannot reference parameter '" + node.raw() + "'", line);
				}
			}
		}
	}

	private static void define(int line, Runnable definition) {
		try {
			definition.run();
		} catch (TranspileException ex) {
			throw new TranspileException(ex.getMessage(), line);
		}
	}

	private static String rawText(List<Node> nodes) {
		StringBuilder sb = new StringBuilder();
		nodes.forEach(n -> sb.append(n.raw()));
		return sb.toString().strip();
	}

	private static boolean opensCollection(Node node) {
		return isPunct(node, "[")
				|| (node instanceof OperatorNode op && (op.is(Operator.LPAREN) || op.is(Operator.LBRACE)));
	}

	private static boolean isAssign(Node node) {
		return node instanceof OperatorNode op && op.is(Operator.ASSIGN);
	}

	static boolean isIdentifier(Node node) {
		return node instanceof OperandNode operand && operand.isIdentifier();
	}

	static boolean isPunct(Node node, String punctuation) {
		return node instanceof OperandNode operand && operand.is(punctuation);
	}

	static Node at(List<Node> nodes, int index) {
		return index >= 0 && index < nodes.size() ? nodes.get(index) : null;
	}
}
