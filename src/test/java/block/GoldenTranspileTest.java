package block;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenTranspileTest {
	@Test
	void transpilesSampleBlockToExpectedPython() throws Exception {
		Path blockSourcePath = Path.of("src", "test", "resources", "golden", "sample.block");
		Path expectedPythonPath = Path.of("src", "test", "resources", "golden", "sample.py");

		String blockSource = Files.readString(blockSourcePath);
		String expected = Files.readString(expectedPythonPath);
		String actual = new Transpiler().transpile(blockSource);

		assertEquals(normalize(expected), normalize(actual));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
