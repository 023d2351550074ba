package block.gen;

import block.TranspileException;
import block.ast.AstAssembler;
import block.lex.Lexer;
import block.types.FunctionSignature;
import block.types.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiscoveryPassTest {

	@Test
	void loopVariablesAreNumbers() {
		Discovery discovery = discover("for i in 1..3\n    echo[i]");

		assertEquals(Optional.of("num"), discovery.types().getVariableType("i"));
	}

	@Test
	void annotatedAndInferredDeclarations() {
		Discovery discovery = discover("a:str = \"x\"\nb = 2\nc = true\nd = [1]\ne = (1, 2)\nf = {1}\ng:bool");

		assertEquals(Optional.of("str"), discovery.types().getVariableType("a"));
		assertEquals(Optional.of("num"), discovery.types().getVariableType("b"));
		assertEquals(Optional.of("boolean"), discovery.types().getVariableType("c"));
		assertEquals(Optional.of("list"), discovery.types().getVariableType("d"));
		assertEquals(Optional.of("tuple"), discovery.types().getVariableType("e"));
		assertEquals(Optional.of("set"), discovery.types().getVariableType("f"));
		assertEquals(Optional.of("bool"), discovery.types().getVariableType("g"));
	}

	@Test
	void collectionVariablesFollowLatestDeclaration() {
		Discovery discovery = discover("xs = [1, 2]\nys = [3]\nys = 4\nt = (1, 2)\nm = [\"a\": 1]");

		assertTrue(discovery.isCollectionVariable("xs"));
		assertFalse(discovery.isCollectionVariable("ys"));
		assertTrue(discovery.isCollectionVariable("t"));
		assertTrue(discovery.isCollectionVariable("m"));
	}

	@Test
	void functionsRegisterSignatureAndParameters() {
		Discovery discovery = discover("fn add[a:num, b:str=\"x\", c]:str\n    -> b");

		FunctionSignature add = discovery.types().getFunction("add").orElseThrow();
		assertEquals("str", add.returnType());
		assertEquals(List.of(
				new Parameter("a", "num", null),
				new Parameter("b", "str", "\"x\""),
				new Parameter("c", "num", null)), add.params());
		assertTrue(discovery.types().isDefinedVariable("a"));
		assertEquals(Optional.of("str"), discovery.types().getVariableType("b"));
	}

	@Test
	void functionWithoutAnnotationsReturnsNum() {
		Discovery discovery = discover("fn tick\n    -> 1");

		assertEquals(Optional.of("num"), discovery.types().getFunctionType("tick"));
		assertTrue(discovery.types().getFunction("tick").orElseThrow().params().isEmpty());
	}

	@Test
	void collectionDefaultMakesParameterACollection() {
		Discovery discovery = discover("fn first[xs=[1, 2], n=0]\n    -> xs[n]");

		assertEquals("[1,2]", discovery.types().getFunction("first").orElseThrow().params().get(0).defaultText());
		assertTrue(discovery.isCollectionVariable("xs"));
		assertFalse(discovery.isCollectionVariable("n"));
	}

	@Test
	void defaultMayNotReferenceASiblingParameter() {
		TranspileException ex = assertThrows(TranspileException.class, () -> discover("x = 1\nfn f[a, b=a + 1]"));

		assertEquals("Default value for parameter 'b' cannot reference parameter 'a' (line 2)", ex.getMessage());
	}

	@Test
	void undefinedTypesCarryTheLine() {
		TranspileException variable = assertThrows(TranspileException.class, () -> discover("x = 1\ny:foo = 2"));
		assertEquals("Undefined type 'foo' (line 2)", variable.getMessage());
		assertEquals(2, variable.line());

		TranspileException ret = assertThrows(TranspileException.class, () -> discover("fn f[]:foo"));
		assertEquals("Undefined return type 'foo' (line 1)", ret.getMessage());

		TranspileException param = assertThrows(TranspileException.class, () -> discover("fn f[a:foo]"));
		assertEquals("Undefined parameter type 'foo' (line 1)", param.getMessage());
	}

	private static Discovery discover(String source) {
		return new DiscoveryPass().run(new AstAssembler().assemble(new Lexer().lex(source)));
	}
}
