package block.types;

import block.ast.Node;
import block.ast.NumberNode;
import block.ast.OperandNode;
import block.ast.Operator;
import block.ast.OperatorNode;
import block.ast.StringNode;

/**
 * Shallow inference for an untyped declaration {@code name = <rhs>}: only the
 * first node of the right-hand side is looked at.
 *
 * A leading brace is reported as a set; a map written with braces is only
 * told apart structurally by the emitter.
 */
public final class TypeInference {
	private TypeInference() {
	}

	public static String infer(Node first, TypeSystem types) {
		if (first instanceof StringNode) {
			return "str";
		}
		if (first instanceof NumberNode) {
			return "num";
		}
		if (first instanceof OperandNode operand) {
			if (Builtins.isConstant(operand.value())) {
				return Builtins.constant(operand.value()).type();
			}
			if (operand.is("[")) {
				return "list";
			}
			if (operand.isIdentifier() && types.isDefinedFunction(operand.value())) {
				return "func";
			}
		}
		if (first instanceof OperatorNode op) {
			if (op.is(Operator.LPAREN)) {
				return "tuple";
			}
			if (op.is(Operator.LBRACE)) {
				return "set";
			}
		}
		return "num";
	}
}
