package block.lex;

import block.ast.Keyword;
import block.ast.KeywordNode;
import block.ast.Node;
import block.ast.NumberNode;
import block.ast.OperandNode;
import block.ast.Operator;
import block.ast.OperatorNode;
import block.ast.SourceSpan;
import block.ast.StringNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns the text of one logical line (leading indentation already removed)
 * into tokens, longest match first.
 *
 * Unrecognized characters are skipped.
 */
public final class Tokenizer {
	private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

	private static final Set<String> TWO_CHAR_OPERATORS = Set.of("..", "==", "!=", ">=", "<=", "//", "->");
	private static final String SINGLE_CHAR_OPERATORS = "+-*/^%=!&|()<>{}";
	private static final String PUNCTUATION = "[],:";

	/**
	 * @param content    line text without its leading whitespace
	 * @param lineNumber physical line the logical line starts on
	 * @param indent     width of the removed indentation, added to columns
	 */
	public List<Node> tokenize(String content, int lineNumber, int indent) {
		List<Node> tokens = new ArrayList<>();
		int i = 0;
		while (i < content.length()) {
			char c = content.charAt(i);
			SourceSpan span = new SourceSpan(lineNumber, indent + i);

			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			// string literal
			if (c == '"') {
				int end = consumeQuoted(content, i);
				tokens.add(new StringNode(content.substring(i + 1, end), span));
				i = end + 1;
				continue;
			}

			// number, optionally negative
			if (Character.isDigit(c) || (c == '-' && i + 1 < content.length()
					&& Character.isDigit(content.charAt(i + 1)))) {
				int end = consumeNumber(content, i);
				tokens.add(NumberNode.of(content.substring(i, end), span));
				i = end;
				continue;
			}

			// multi-char operators; -> is the return keyword
			String two = i + 1 < content.length() ? content.substring(i, i + 2) : "";
			if (TWO_CHAR_OPERATORS.contains(two)) {
				if (two.equals("->")) {
					tokens.add(new KeywordNode(Keyword.RETURN, span));
				} else {
					tokens.add(new OperatorNode(Operator.fromSymbol(two), span));
				}
				i += 2;
				continue;
			}

			if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
				tokens.add(new OperatorNode(Operator.fromSymbol(String.valueOf(c)), span));
				i++;
				continue;
			}

			if (PUNCTUATION.indexOf(c) >= 0) {
				tokens.add(new OperandNode(String.valueOf(c), span));
				i++;
				continue;
			}

			// identifier or keyword
			if (Character.isLetter(c) || c == '_') {
				int end = i + 1;
				while (end < content.length()
						&& (Character.isLetterOrDigit(content.charAt(end)) || content.charAt(end) == '_')) {
					end++;
				}
				String word = content.substring(i, end);
				Keyword keyword = Keyword.fromWord(word);
				tokens.add(keyword != null ? new KeywordNode(keyword, span) : new OperandNode(word, span));
				i = end;
				continue;
			}

			log.warn("Skipping unrecognized character '{}' on line {}", c, lineNumber);
			i++;
		}
		return tokens;
	}

	/** @return index of the closing quote, or the content length when unterminated */
	private static int consumeQuoted(String content, int start) {
		int end = start + 1;
		while (end < content.length()) {
			if (content.charAt(end) == '"' && content.charAt(end - 1) != '\\') {
				break;
			}
			end++;
		}
		return end;
	}

	private static int consumeNumber(String content, int start) {
		int end = start + 1;
		boolean hasDot = false;
		while (end < content.length()) {
			char ch = content.charAt(end);
			if (ch == '.' && !hasDot) {
				// leave ".." to the range operator
				if (end + 1 < content.length() && content.charAt(end + 1) == '.') {
					break;
				}
				hasDot = true;
			} else if (!Character.isDigit(ch)) {
				break;
			}
			end++;
		}
		return end;
	}
}
