package block.lex;

/**
 * One logical line: comments removed, multi-line strings folded, trailing
 * whitespace trimmed. {@code number} is the 1-based physical line it starts on.
 */
public record SourceLine(int number, String text) {
}
