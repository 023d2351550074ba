package block.gen;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Remembers, per output line, which closer each {@code [} was rendered with so
 * the matching {@code ]} can emit a paren, a bracket or a brace.
 */
final class BracketStack {
	private final Deque<Character> closers = new ArrayDeque<>();

	void open(char closer) {
		closers.push(closer);
	}

	/** @return the closer for the innermost open bracket; {@code ]} when none is open */
	char close() {
		return closers.isEmpty() ? ']' : closers.pop();
	}
}
