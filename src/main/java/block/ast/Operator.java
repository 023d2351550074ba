package block.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Source operators and the Python text each one is emitted as.
 */
public enum Operator {
	POWER("^", "**"),
	NOT("!", "not "),
	AND("&", " and "),
	OR("|", " or "),
	PLUS("+", "+"),
	MINUS("-", "-"),
	STAR("*", "*"),
	SLASH("/", "/"),
	FLOOR_DIV("//", "//"),
	PERCENT("%", "%"),
	ASSIGN("=", "="),
	EQ("==", "=="),
	NEQ("!=", "!="),
	GE(">=", ">="),
	LE("<=", "<="),
	GT(">", ">"),
	LT("<", "<"),
	LPAREN("(", "("),
	RPAREN(")", ")"),
	LBRACE("{", "{"),
	RBRACE("}", "}"),
	RANGE("..", "..");

	private static final Map<String, Operator> BY_SYMBOL = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

	private final String symbol;
	private final String target;

	Operator(String symbol, String target) {
		this.symbol = symbol;
		this.target = target;
	}

	public String symbol() {
		return symbol;
	}

	public String target() {
		return target;
	}

	/**
	 * @return the operator for a source symbol, or {@code null} when the symbol
	 *         is not an operator
	 */
	public static Operator fromSymbol(String symbol) {
		return BY_SYMBOL.get(symbol);
	}
}
