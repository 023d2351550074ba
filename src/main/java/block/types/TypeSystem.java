package block.types;

import block.TranspileException;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol table for one transpilation: declared variables with their type
 * descriptors and declared functions with their signatures.
 *
 * A type descriptor is either a scalar tag or a collection shape
 * ({@code [..]}, {@code (..)}, {@code {..}}). Shapes are checked by their
 * delimiters only. Redefinition always overwrites.
 */
public final class TypeSystem {
	public static final Set<String> SCALAR_TYPES = Set.of(
			"str", "num", "bool", "boolean", "list", "tuple", "set", "map", "func", "none");

	private final Map<String, String> variables = new HashMap<>();
	private final Map<String, FunctionSignature> functions = new HashMap<>();

	public void defineVariable(String name, String type) {
		if (!isKnownType(type)) {
			throw new TranspileException("Undefined type '" + type + "'");
		}
		variables.put(name, type);
	}

	public void defineFunction(String name, String returnType, List<Parameter> params) {
		if (!isKnownType(returnType)) {
			throw new TranspileException("Undefined return type '" + returnType + "'");
		}
		for (Parameter param : params) {
			if (!isKnownType(param.type())) {
				throw new TranspileException("Undefined parameter type '" + param.type() + "'");
			}
		}
		functions.put(name, new FunctionSignature(name, returnType, params));
	}

	public boolean isDefinedVariable(String name) {
		return variables.containsKey(name);
	}

	public boolean isDefinedFunction(String name) {
		return functions.containsKey(name);
	}

	public Optional<String> getVariableType(String name) {
		return Optional.ofNullable(variables.get(name));
	}

	public Optional<String> getFunctionType(String name) {
		return getFunction(name).map(FunctionSignature::returnType);
	}

	public Optional<FunctionSignature> getFunction(String name) {
		return Optional.ofNullable(functions.get(name));
	}

	public Map<String, String> variables() {
		return Collections.unmodifiableMap(variables);
	}

	public Map<String, FunctionSignature> functions() {
		return Collections.unmodifiableMap(functions);
	}

	public static boolean isKnownType(String type) {
		return type != null && (SCALAR_TYPES.contains(type) || isCollectionShape(type));
	}

	static boolean isCollectionShape(String type) {
		if (type.length() < 2) {
			return false;
		}
		char first = type.charAt(0);
		char last = type.charAt(type.length() - 1);
		return (first == '[' && last == ']') || (first == '(' && last == ')') || (first == '{' && last == '}');
	}
}
