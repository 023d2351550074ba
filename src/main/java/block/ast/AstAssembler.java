package block.ast;

import block.lex.SourceLine;
import block.lex.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles logical lines into one flat node sequence: per line an optional
 * indentation node, the line's tokens and a line end.
 */
public final class AstAssembler {
	private static final Logger log = LoggerFactory.getLogger(AstAssembler.class);

	private final Tokenizer tokenizer = new Tokenizer();
	private final AnnotationFolder folder = new AnnotationFolder();

	public List<Node> assemble(List<SourceLine> lines) {
		List<Node> nodes = new ArrayList<>();
		for (SourceLine line : lines) {
			String text = line.text();
			if (text.isEmpty()) {
				nodes.add(new LineEndNode(new SourceSpan(line.number(), 0)));
				continue;
			}

			int width = 0;
			while (width < text.length() && Character.isWhitespace(text.charAt(width))) {
				width++;
			}
			if (width > 0) {
				nodes.add(new IndentNode(text.substring(0, width), new SourceSpan(line.number(), 0)));
			}

			List<Node> tokens = tokenizer.tokenize(text.substring(width), line.number(), width);
			nodes.addAll(folder.fold(tokens));
			nodes.add(new LineEndNode(new SourceSpan(line.number(), text.length())));
		}
		log.debug("Assembled {} lines into {} nodes", lines.size(), nodes.size());
		return nodes;
	}
}
