package block.types;

import java.util.List;

public record FunctionSignature(String name, String returnType, List<Parameter> params) {
	public FunctionSignature {
		params = List.copyOf(params);
	}

	public int requiredCount() {
		return (int) params.stream().filter(p -> !p.hasDefault()).count();
	}
}
