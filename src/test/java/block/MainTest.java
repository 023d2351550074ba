package block;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@Test
	void inlineCodeGoesToStdout() {
		assertEquals(Main.OK, run("-c", "x = 1\necho[x]"));
		assertEquals("block_x=1\necho(block_x)", stdout().strip());
	}

	@Test
	void flagsAdjustTheOutput() {
		assertEquals(Main.OK, run("--runtime-import", "--prefix", "p_", "-c", "x = 1"));
		assertEquals("from block_builtins import *\np_x=1", stdout().strip());
	}

	@Test
	void fileNextToInputByDefault(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("hello.block");
		Files.writeString(input, "msg = \"hi\"\necho[msg]\n");

		assertEquals(Main.OK, run(input.toString()));

		Path output = dir.resolve("hello.py");
		assertEquals("block_msg=\"hi\"\necho(block_msg)", Files.readString(output));
		assertTrue(stdout().contains("Successfully transpiled"));
	}

	@Test
	void explicitOutputPath(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("in.block");
		Path output = dir.resolve("out.py");
		Files.writeString(input, "x = 2\n");

		assertEquals(Main.OK, run(input.toString(), output.toString()));
		assertEquals("block_x=2", Files.readString(output));
	}

	@Test
	void directoryMode(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Files.createDirectories(src);
		Files.writeString(src.resolve("a.block"), "a = 1\n");
		Files.writeString(src.resolve("b.block"), "b = 2\n");

		assertEquals(Main.OK, run("-r", src.toString(), dir.resolve("out").toString()));
		assertTrue(stdout().startsWith("Successfully transpiled 2 files"));
		assertEquals("block_b=2", Files.readString(dir.resolve("out").resolve("b.py")));
	}

	@Test
	void missingFileFails(@TempDir Path dir) {
		Path missing = dir.resolve("nope.block");

		assertEquals(Main.FAILED, run(missing.toString()));
		assertEquals("Error: File '" + missing + "' not found", stderr().strip());
	}

	@Test
	void transpileErrorFails() {
		assertEquals(Main.FAILED, run("-c", "echo[y]"));
		assertEquals("Error: Undefined identifier 'y' (line 1)", stderr().strip());
	}

	@Test
	void usageErrors() {
		assertEquals(Main.USAGE, run());
		assertTrue(stderr().startsWith("Usage:"));

		assertEquals(Main.USAGE, run("-c"));
		assertEquals(Main.USAGE, run("-r", "only-one"));
		assertEquals(Main.USAGE, run("--bogus", "x.block"));
	}

	private int run(String... args) {
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String stdout() {
		return out.toString(StandardCharsets.UTF_8);
	}

	private String stderr() {
		return err.toString(StandardCharsets.UTF_8);
	}
}
