package block;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line front end.
 *
 * <pre>
 * block [--runtime-import] [--prefix P] input.block [output.py]
 * block [--runtime-import] [--prefix P] -c "code"
 * block [--runtime-import] [--prefix P] -r source-dir output-dir
 * </pre>
 */
public final class Main {
	private static final Logger log = LoggerFactory.getLogger(Main.class);

	static final int OK = 0;
	static final int FAILED = 1;
	static final int USAGE = 2;

	private Main() {
	}

	public static void main(String[] args) {
		int code = run(args, System.out, System.err);
		if (code != OK) {
			System.exit(code);
		}
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		List<String> rest = new ArrayList<>(Arrays.asList(args));
		TranspilerOptions options = TranspilerOptions.defaults();

		while (!rest.isEmpty() && rest.get(0).startsWith("--")) {
			String flag = rest.remove(0);
			if (flag.equals("--runtime-import")) {
				options = options.withRuntimeImport(true);
			} else if (flag.equals("--prefix") && !rest.isEmpty()) {
				options = options.withNamespacePrefix(rest.remove(0));
			} else {
				err.println("Error: unknown option " + flag);
				return usage(err);
			}
		}
		if (rest.isEmpty()) {
			return usage(err);
		}

		Transpiler transpiler = new Transpiler(options);
		try {
			switch (rest.get(0)) {
				case "-c" -> {
					if (rest.size() < 2) {
						err.println("Error: -c requires code argument");
						return USAGE;
					}
					out.println(transpiler.transpile(rest.get(1)));
				}
				case "-r" -> {
					if (rest.size() < 3) {
						err.println("Error: -r requires a source and an output directory");
						return USAGE;
					}
					int count = new ProjectTranspiler(transpiler).transpileTree(Path.of(rest.get(1)), Path.of(rest.get(2)));
					out.println("Successfully transpiled " + count + " files into " + rest.get(2));
				}
				default -> transpileFile(transpiler, rest, out);
			}
			return OK;
		} catch (NoSuchFileException e) {
			err.println("Error: File '" + e.getFile() + "' not found");
			return FAILED;
		} catch (TranspileException e) {
			err.println("Error: " + e.getMessage());
			return FAILED;
		} catch (IOException e) {
			err.println("Error: " + e.getMessage());
			return FAILED;
		}
	}

	private static void transpileFile(Transpiler transpiler, List<String> rest, PrintStream out) throws IOException {
		Path input = Path.of(rest.get(0));
		Path output = rest.size() >= 2
				? Path.of(rest.get(1))
				: Path.of(transpiler.options().targetFileName(input.toString()));

		String source = Files.readString(input);
		Files.writeString(output, transpiler.transpile(source));
		log.info("Wrote {}", output);
		out.println("Successfully transpiled " + input + " -> " + output);
	}

	private static int usage(PrintStream err) {
		err.println("Usage: block <input.block> [output.py]");
		err.println("   or: block -c '<block code>'");
		err.println("   or: block -r <source-dir> <output-dir>");
		err.println("Options: --runtime-import, --prefix <prefix>");
		return USAGE;
	}
}
