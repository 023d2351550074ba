package block.types;

import block.ast.Node;
import block.ast.NumberNode;
import block.ast.OperandNode;
import block.ast.Operator;
import block.ast.OperatorNode;
import block.ast.SourceSpan;
import block.ast.StringNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TypeInferenceTest {
	private final TypeSystem types = new TypeSystem();

	@Test
	void literals() {
		assertEquals("str", infer(new StringNode("hi", SourceSpan.NONE)));
		assertEquals("num", infer(NumberNode.of("4", SourceSpan.NONE)));
		assertEquals("num", infer(NumberNode.of("4.5", SourceSpan.NONE)));
	}

	@Test
	void constants() {
		assertEquals("boolean", infer(operand("true")));
		assertEquals("boolean", infer(operand("false")));
		assertEquals("none", infer(operand("none")));
	}

	@Test
	void collectionsByOpeningDelimiter() {
		assertEquals("list", infer(operand("[")));
		assertEquals("tuple", infer(new OperatorNode(Operator.LPAREN, SourceSpan.NONE)));
		assertEquals("set", infer(new OperatorNode(Operator.LBRACE, SourceSpan.NONE)));
	}

	@Test
	void declaredFunctionName() {
		types.defineFunction("f", "num", List.of());

		assertEquals("func", infer(operand("f")));
	}

	@Test
	void anythingElseIsNum() {
		types.defineVariable("s", "str");

		assertEquals("num", infer(operand("s")));
		assertEquals("num", infer(operand("unknown")));
		assertEquals("num", infer(new OperatorNode(Operator.MINUS, SourceSpan.NONE)));
	}

	private String infer(Node node) {
		return TypeInference.infer(node, types);
	}

	private static OperandNode operand(String value) {
		return new OperandNode(value, SourceSpan.NONE);
	}
}
