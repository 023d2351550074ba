package block.gen;

import block.types.TypeSystem;

import java.util.Set;

/**
 * Result of the discovery pass: the populated symbol table and the names
 * whose latest declaration starts with a collection literal.
 */
public record Discovery(TypeSystem types, Set<String> collectionVariables) {
	public Discovery {
		collectionVariables = Set.copyOf(collectionVariables);
	}

	public boolean isCollectionVariable(String name) {
		return collectionVariables.contains(name);
	}
}
