package block.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names the generated code may use without declaring them: the builtin
 * constants and the functions of the {@code block_builtins} runtime module.
 *
 * Function names, parameter order and default values are the contract with
 * the runtime module. Generated code calls them verbatim, so changing any
 * entry breaks previously generated programs.
 */
public final class Builtins {

	/** A builtin constant, its type tag and the Python text it is emitted as. */
	public record Constant(String name, String type, String target) {
	}

	/** A runtime function parameter; {@code defaultValue} is Python text or null. */
	public record Param(String name, String defaultValue, boolean variadic) {
	}

	public record Function(String name, List<Param> params) {
		public Function {
			params = List.copyOf(params);
		}
	}

	private static final Map<String, Constant> CONSTANTS;
	private static final Map<String, Function> FUNCTIONS;

	static {
		final var constants = new LinkedHashMap<String, Constant>();
		constants.put("true", new Constant("true", "boolean", "boolean(True)"));
		constants.put("false", new Constant("false", "boolean", "boolean()"));
		constants.put("none", new Constant("none", "none", "NONE"));
		CONSTANTS = Collections.unmodifiableMap(constants);

		final var functions = new LinkedHashMap<String, Function>();
		// core
		add(functions, "echo", "*args");
		add(functions, "typeOf", "obj");
		add(functions, "toStr", "obj");
		add(functions, "toNum", "obj");
		add(functions, "toList", "obj");
		add(functions, "toTuple", "obj");
		add(functions, "toSet", "obj");
		add(functions, "toMap", "obj");
		add(functions, "toBool", "obj");
		add(functions, "len", "obj");
		// string
		add(functions, "strToUpper", "obj");
		add(functions, "strToLower", "obj");
		add(functions, "strToTitle", "obj");
		add(functions, "strToCapital", "obj");
		add(functions, "strSwapCase", "obj");
		add(functions, "strSplit", "obj", "sep=None");
		add(functions, "strCount", "obj", "sub");
		add(functions, "strEncode", "obj", "encoding='utf-8'");
		add(functions, "strStrip", "obj");
		add(functions, "strLStrip", "obj");
		add(functions, "strRStrip", "obj");
		add(functions, "strReplace", "obj", "old", "new");
		add(functions, "strStartsWith", "obj", "prefix");
		add(functions, "strEndsWith", "obj", "suffix");
		add(functions, "strFind", "obj", "substring");
		add(functions, "strLen", "obj");
		// number
		add(functions, "numAbs", "x");
		add(functions, "numRound", "x", "ndigits=0");
		add(functions, "numFloor", "x");
		add(functions, "numCeil", "x");
		add(functions, "numTrunc", "x");
		add(functions, "numPow", "a", "b");
		add(functions, "numSqrt", "x");
		add(functions, "numClamp", "x", "lo", "hi");
		add(functions, "numSign", "x");
		add(functions, "numToBin", "x");
		add(functions, "numToOct", "x");
		add(functions, "numToHex", "x");
		add(functions, "numFromBase", "text", "base=10");
		// list
		add(functions, "listAppend", "lst", "value");
		add(functions, "listPop", "lst", "index=-1");
		add(functions, "listLen", "lst");
		add(functions, "listExtend", "lst", "items");
		add(functions, "listContains", "lst", "value");
		// tuple
		add(functions, "tupleLen", "t");
		add(functions, "tupleContains", "t", "value");
		// set
		add(functions, "setAdd", "s", "value");
		add(functions, "setRemove", "s", "value");
		add(functions, "setContains", "s", "value");
		// map
		add(functions, "mapGet", "m", "key", "default=None");
		add(functions, "mapSet", "m", "key", "value");
		add(functions, "mapKeys", "m");
		add(functions, "mapValues", "m");
		add(functions, "mapItems", "m");
		// generic collections
		add(functions, "collFilter", "coll", "fn");
		add(functions, "collMap", "coll", "fn");
		add(functions, "collContains", "coll", "value");
		add(functions, "collJoin", "coll", "sep=''");
		add(functions, "collIndexOf", "coll", "value");
		FUNCTIONS = Collections.unmodifiableMap(functions);
	}

	private Builtins() {
	}

	private static void add(Map<String, Function> functions, String name, String... params) {
		List<Param> parsed = new ArrayList<>();
		for (String param : params) {
			if (param.startsWith("*")) {
				parsed.add(new Param(param.substring(1), null, true));
				continue;
			}
			int eq = param.indexOf('=');
			parsed.add(eq < 0
					? new Param(param, null, false)
					: new Param(param.substring(0, eq), param.substring(eq + 1), false));
		}
		functions.put(name, new Function(name, parsed));
	}

	public static boolean isConstant(String name) {
		return CONSTANTS.containsKey(name);
	}

	public static boolean isFunction(String name) {
		return FUNCTIONS.containsKey(name);
	}

	public static Constant constant(String name) {
		return CONSTANTS.get(name);
	}

	public static Function function(String name) {
		return FUNCTIONS.get(name);
	}

	public static Map<String, Constant> constants() {
		return CONSTANTS;
	}

	public static Map<String, Function> functions() {
		return FUNCTIONS;
	}
}
