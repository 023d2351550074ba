package block.lex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Block source text into logical lines.
 *
 * Notes:
 * - Lines whose trimmed text starts with {@code >>}, {@code #} or {@code //}
 * are dropped, as is a stray {@code *}{@code /} line.
 * - Block comments may start anywhere outside a string and run across lines.
 * - A string literal spanning several physical lines is folded into one
 * logical line, its raw newlines written as {@code \n} / {@code \r}.
 * - An unterminated string or block comment swallows the rest of the input.
 * This is logged, not rejected.
 */
public final class Lexer {
	private static final Logger log = LoggerFactory.getLogger(Lexer.class);

	private static final String[] LINE_COMMENT_MARKERS = { ">>", "#", "//", "*/" };

	public List<SourceLine> lex(String source) {
		List<SourceLine> lines = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		int line = 1;
		int lineStart = 1;
		boolean inBlockComment = false;
		int blockCommentLine = -1;
		boolean inString = false;
		int stringStart = -1;
		int stringLine = -1;

		int i = 0;
		while (i < source.length()) {
			char c = source.charAt(i);

			if (inBlockComment) {
				if (source.startsWith("*/", i)) {
					inBlockComment = false;
					i += 2;
					continue;
				}
				if (c == '\n') {
					line++;
				}
				i++;
				continue;
			}

			if (c == '"' && (i == 0 || source.charAt(i - 1) != '\\')) {
				if (!inString) {
					inString = true;
					stringStart = i;
					stringLine = line;
				} else {
					if (current.length() == 0) {
						lineStart = stringLine;
					}
					String content = source.substring(stringStart + 1, i)
							.replace("\n", "\\n")
							.replace("\r", "\\r");
					current.append('"').append(content).append('"');
					inString = false;
				}
				i++;
				continue;
			}

			if (inString) {
				if (c == '\n') {
					line++;
				}
				i++;
				continue;
			}

			if (c == '/' && i + 1 < source.length() && source.charAt(i + 1) == '*'
					&& !isLineComment(current.toString().strip())) {
				inBlockComment = true;
				blockCommentLine = line;
				i += 2;
				continue;
			}

			if (c == '\n') {
				finishLine(lines, current, lineStart);
				current.setLength(0);
				line++;
				i++;
				continue;
			}

			if (current.length() == 0) {
				lineStart = line;
			}
			current.append(c);
			i++;
		}

		if (inString) {
			log.warn("Unterminated string literal starting on line {} absorbed to end of input", stringLine);
		}
		if (inBlockComment) {
			log.warn("Unterminated block comment starting on line {} absorbed to end of input", blockCommentLine);
		}
		finishLine(lines, current, lineStart);

		log.debug("Lexed {} physical lines into {} logical lines", line, lines.size());
		return lines;
	}

	private static void finishLine(List<SourceLine> lines, StringBuilder current, int lineStart) {
		String trimmed = current.toString().strip();
		if (trimmed.isEmpty() || isLineComment(trimmed)) {
			return;
		}
		lines.add(new SourceLine(lineStart, current.toString().stripTrailing()));
	}

	private static boolean isLineComment(String trimmed) {
		for (String marker : LINE_COMMENT_MARKERS) {
			if (trimmed.startsWith(marker)) {
				return true;
			}
		}
		return false;
	}
}
