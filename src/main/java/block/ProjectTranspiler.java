package block;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transpiles a tree of Block source files to a parallel tree of Python files.
 *
 * Each input file produces exactly one output file; nothing is merged.
 */
public final class ProjectTranspiler {
	private static final Logger log = LoggerFactory.getLogger(ProjectTranspiler.class);

	private final Transpiler transpiler;

	public ProjectTranspiler() {
		this(new Transpiler());
	}

	public ProjectTranspiler(Transpiler transpiler) {
		this.transpiler = transpiler;
	}

	/** @return the number of files written */
	public int transpileTree(Path sourceRoot, Path outputRoot) throws IOException {
		String extension = transpiler.options().sourceExtension();
		List<Path> sources;
		try (Stream<Path> paths = Files.walk(sourceRoot)) {
			sources = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(extension))
					.sorted()
					.collect(Collectors.toList());
		}
		try {
			sources.forEach(p -> {
				try {
					transpileOne(sourceRoot, outputRoot, p);
				} catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			});
		} catch (UncheckedIOException ex) {
			throw ex.getCause();
		}
		log.info("Transpiled {} files from {} to {}", sources.size(), sourceRoot, outputRoot);
		return sources.size();
	}

	private void transpileOne(Path sourceRoot, Path outputRoot, Path sourceFile) throws IOException {
		Path rel = sourceRoot.relativize(sourceFile);
		String outName = transpiler.options().targetFileName(rel.getFileName().toString());
		Path outRel = rel.getParent() == null ? Path.of(outName) : rel.getParent().resolve(outName);
		Path outFile = outputRoot.resolve(outRel);

		if (outFile.getParent() != null) {
			Files.createDirectories(outFile.getParent());
		}
		String source = Files.readString(sourceFile);
		try {
			Files.writeString(outFile, transpiler.transpile(source));
		} catch (TranspileException ex) {
			throw new TranspileException(rel + ": " + ex.getMessage(), ex);
		}
		log.debug("Wrote {}", outFile);
	}
}
