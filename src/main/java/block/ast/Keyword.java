package block.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed keyword set. {@code fn} marks a function definition and
 * {@code ->} a return.
 */
public enum Keyword {
	FOR("for", "for"),
	WHILE("while", "while"),
	IF("if", "if"),
	ELIF("elif", "elif"),
	ELSE("else", "else"),
	IN("in", "in"),
	FN("fn", "def"),
	RETURN("->", "return");

	private static final Map<String, Keyword> BY_WORD = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(Keyword::word, Function.identity()));

	private final String word;
	private final String target;

	Keyword(String word, String target) {
		this.word = word;
		this.target = target;
	}

	public String word() {
		return word;
	}

	public String target() {
		return target;
	}

	public static Keyword fromWord(String word) {
		return BY_WORD.get(word);
	}

	/** @return whether the keyword opens a block whose header needs a trailing colon */
	public boolean opensBlock() {
		return this == FOR || this == WHILE || this == IF || this == ELIF || this == ELSE || this == FN;
	}
}
