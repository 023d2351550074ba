package block.ast;

import block.lex.SourceLine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstAssemblerTest {
	private final AstAssembler assembler = new AstAssembler();

	@Test
	void everyLineEndsWithALineEnd() {
		List<Node> nodes = assemble("x = 1", "y = 2");

		assertEquals(8, nodes.size());
		assertInstanceOf(LineEndNode.class, nodes.get(3));
		assertInstanceOf(LineEndNode.class, nodes.get(7));
		assertEquals(2, nodes.get(7).span().line());
	}

	@Test
	void indentationIsKeptVerbatim() {
		List<Node> nodes = assemble("if x", " \t echo[x]");

		IndentNode indent = (IndentNode) nodes.get(3);
		assertEquals(" \t ", indent.whitespace());
		assertEquals(" \t ", indent.rendered());
	}

	@Test
	void foldsDeclarationAnnotation() {
		assertEquals("count|:num|=|3|;", describe(assemble("count:num = 3")));
		assertEquals("xs|:[num]|=|[|1|]|;", describe(assemble("xs:[num] = [1]")));
		assertEquals("flag|:bool|;", describe(assemble("flag:bool")));
	}

	@Test
	void leavesMapLiteralColonsAlone() {
		assertEquals("m|=|[|\"a\"|:|1|]|;", describe(assemble("m = [\"a\": 1]")));
	}

	@Test
	void colonAfterIdentifierNotFollowedByAssignmentIsNotAnAnnotation() {
		List<Node> nodes = assemble("x:num + 1");

		assertTrue(nodes.stream().noneMatch(n -> n instanceof TypeAnnotationNode));
	}

	@Test
	void foldsParameterAndReturnAnnotations() {
		List<Node> nodes = assemble("fn add[a:num, b:[str]=[\"x\"], c]:str");

		assertEquals("fn|add|[|a|:num|,|b|:[str]|=|[|\"x\"|]|,|c|]|:str|;", describe(nodes));
	}

	@Test
	void foldsReturnAnnotationWithoutParameterList() {
		assertEquals("fn|main|:none|;", describe(assemble("fn main:none")));
	}

	@Test
	void annotationRendersToNothing() {
		TypeAnnotationNode annotation = (TypeAnnotationNode) assemble("x:num = 1").get(1);

		assertEquals("num", annotation.type());
		assertEquals("", annotation.rendered());
	}

	@Test
	void operatorsAndKeywordsMapToPython() {
		String rendered = assemble("while a ^ 2 >= b & !c").stream()
				.filter(n -> !(n instanceof LineEndNode))
				.map(Node::rendered)
				.collect(Collectors.joining("|"));

		assertEquals("while|a|**|2|>=|b| and |not |c", rendered);
	}

	private List<Node> assemble(String... lines) {
		List<SourceLine> source = new ArrayList<>();
		for (int i = 0; i < lines.length; i++) {
			source.add(new SourceLine(i + 1, lines[i]));
		}
		return assembler.assemble(source);
	}

	private static String describe(List<Node> nodes) {
		return nodes.stream()
				.map(n -> n instanceof LineEndNode ? ";" : n.raw())
				.collect(Collectors.joining("|"));
	}
}
