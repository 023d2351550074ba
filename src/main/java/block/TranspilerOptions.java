package block;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings for one {@link Transpiler}.
 *
 * Defaults come from the classpath resource {@code block-transpiler.properties};
 * keys missing there fall back to the values below.
 */
public record TranspilerOptions(String namespacePrefix, String sourceExtension, String targetExtension,
		boolean runtimeImport, String runtimeModule) {

	public static final String RESOURCE = "/block-transpiler.properties";

	public TranspilerOptions {
		if (namespacePrefix == null || namespacePrefix.isEmpty()) {
			throw new IllegalArgumentException("namespace prefix must not be empty");
		}
	}

	public static TranspilerOptions defaults() {
		Properties props = new Properties();
		try (InputStream in = TranspilerOptions.class.getResourceAsStream(RESOURCE)) {
			if (in != null) {
				props.load(in);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read " + RESOURCE, e);
		}
		return fromProperties(props);
	}

	public static TranspilerOptions fromProperties(Properties props) {
		return new TranspilerOptions(
				props.getProperty("namespace.prefix", "block_"),
				props.getProperty("source.extension", ".block"),
				props.getProperty("target.extension", ".py"),
				Boolean.parseBoolean(props.getProperty("runtime.import", "false")),
				props.getProperty("runtime.module", "block_builtins"));
	}

	public TranspilerOptions withNamespacePrefix(String prefix) {
		return new TranspilerOptions(prefix, sourceExtension, targetExtension, runtimeImport, runtimeModule);
	}

	public TranspilerOptions withRuntimeImport(boolean enabled) {
		return new TranspilerOptions(namespacePrefix, sourceExtension, targetExtension, enabled, runtimeModule);
	}

	/** Output file name for a source file name: the source extension is replaced, or the target one appended. */
	public String targetFileName(String sourceFileName) {
		if (sourceFileName.endsWith(sourceExtension)) {
			return sourceFileName.substring(0, sourceFileName.length() - sourceExtension.length()) + targetExtension;
		}
		return sourceFileName + targetExtension;
	}
}
