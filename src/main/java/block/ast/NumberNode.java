package block.ast;

import block.TranspileException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric literal. The integer or float flavor is fixed by whether the lexeme
 * contains a decimal point.
 */
public record NumberNode(String lexeme, boolean floating, String rendered, SourceSpan span) implements Node {

	public static NumberNode of(String lexeme, SourceSpan span) {
		final boolean floating = lexeme.indexOf('.') >= 0;
		try {
			return new NumberNode(lexeme, floating, floating ? renderFloat(lexeme) : new BigInteger(lexeme).toString(),
					span);
		} catch (NumberFormatException ex) {
			throw new TranspileException("Malformed number '" + lexeme + "'", span.line());
		}
	}

	private static String renderFloat(String lexeme) {
		var plain = new BigDecimal(lexeme).stripTrailingZeros().toPlainString();
		if (plain.indexOf('.') < 0) {
			plain = plain + ".0";
		}
		return plain;
	}

	@Override
	public String raw() {
		return lexeme;
	}
}
