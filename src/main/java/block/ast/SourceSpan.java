package block.ast;

/**
 * Source position for diagnostics.
 *
 * Line is the 1-based physical line on which a logical line starts; column is
 * the 0-based offset inside that logical line.
 */
public record SourceSpan(int line, int column) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);
}
