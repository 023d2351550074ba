package block;

import block.ast.AstAssembler;
import block.ast.Node;
import block.gen.Discovery;
import block.gen.DiscoveryPass;
import block.gen.PythonEmitter;
import block.lex.Lexer;
import block.lex.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Public entrypoint for Block -> Python transpilation.
 *
 * Every call builds its own symbol table, so one instance can be shared and
 * reused freely. A call either returns the complete program or throws.
 */
public final class Transpiler {
	private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

	private final TranspilerOptions options;

	public Transpiler() {
		this(TranspilerOptions.defaults());
	}

	public Transpiler(TranspilerOptions options) {
		this.options = options;
	}

	public TranspilerOptions options() {
		return options;
	}

	public String transpile(String source) {
		return guarded(() -> {
			List<Node> nodes = assemble(source);
			Discovery discovery = new DiscoveryPass().run(nodes);
			return new PythonEmitter(discovery, options).emit(nodes);
		});
	}

	/** Runs only the discovery pass and returns what it found. */
	public Discovery discover(String source) {
		return guarded(() -> new DiscoveryPass().run(assemble(source)));
	}

	private static List<Node> assemble(String source) {
		if (source == null) {
			throw new TranspileException("Cannot transpile null source");
		}
		List<SourceLine> lines = new Lexer().lex(source);
		return new AstAssembler().assemble(lines);
	}

	private static <T> T guarded(Step<T> step) {
		try {
			return step.run();
		} catch (TranspileException ex) {
			log.debug("Transpilation failed: {}", ex.getMessage());
			throw ex;
		} catch (RuntimeException ex) {
			throw new TranspileException("Transpilation error: " + ex.getMessage(), ex);
		}
	}

	@FunctionalInterface
	private interface Step<T> {
		T run();
	}
}
