package block.gen;

import block.ast.Node;

import java.util.ArrayList;
import java.util.List;

import static block.gen.DiscoveryPass.isIdentifier;
import static block.gen.DiscoveryPass.isPunct;

/**
 * Single-level view of the contents of one {@code [ ... ]} run: where the
 * matching {@code ]} is and which commas and colons sit directly inside it.
 */
record BracketContent(int open, int close, boolean matched, List<Integer> commas, int colons) {

	/**
	 * Scans from the opening bracket at {@code open} up to {@code limit}. When
	 * no matching bracket exists before the limit, {@code close} is the limit.
	 */
	static BracketContent scan(List<Node> nodes, int open, int limit) {
		List<Integer> commas = new ArrayList<>();
		int colons = 0;
		int depth = 1;
		int j = open + 1;
		for (; j < limit; j++) {
			Node node = nodes.get(j);
			if (isPunct(node, "[")) {
				depth++;
			} else if (isPunct(node, "]")) {
				depth--;
				if (depth == 0) {
					break;
				}
			} else if (depth == 1 && isPunct(node, ",")) {
				commas.add(j);
			} else if (depth == 1 && isPunct(node, ":")) {
				colons++;
			}
		}
		return new BracketContent(open, j, j < limit, List.copyOf(commas), colons);
	}

	boolean isEmpty() {
		return close == open + 1;
	}

	/**
	 * Comma-separated parts as {@code [from, to)} index pairs. A trailing empty
	 * part is not counted.
	 */
	List<int[]> parts() {
		List<int[]> parts = new ArrayList<>();
		int from = open + 1;
		for (int comma : commas) {
			parts.add(new int[] { from, comma });
			from = comma + 1;
		}
		if (from < close) {
			parts.add(new int[] { from, close });
		}
		return parts;
	}

	/** Whether a bracket literal written directly inside this one is a map. */
	boolean containsMapLiteral(List<Node> nodes) {
		for (int k = open + 1; k < close; k++) {
			if (!isPunct(nodes.get(k), "[")) {
				continue;
			}
			BracketContent inner = scan(nodes, k, close);
			if (!isIdentifier(nodes.get(k - 1)) && inner.colons() > 0) {
				return true;
			}
			k = inner.close();
		}
		return false;
	}
}
