package io.cgmes.eqflat.config.loader;

import static io.cgmes.eqflat.config.loader.FileResolver.resolveFile;

import io.cgmes.eqflat.config.model.FlattenConfig;
import io.cgmes.eqflat.config.model.OutputFormat;
import io.cgmes.eqflat.mapping.ReferenceResolver;
import io.cgmes.eqflat.parse.ArchiveReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public final class FlattenConfigLoader {
    public static final String SYS_PROP = "cgmes.eqflat.config";

    private FlattenConfigLoader() {}

    /**
     * Load the config from the location given in the system property, relative to the working
     * directory, the user home or the classpath.
     *
     * @return FlattenConfig
     * @throws IOException when loading fails
     */
    public static FlattenConfig load() throws IOException {
        String location = System.getProperty(SYS_PROP);
        if (location == null || location.trim().isEmpty()) {
            throw new IllegalArgumentException(
                    "System property '"
                            + SYS_PROP
                            + "' not set; please provide a path to an eqflat properties file");
        }
        return load(location);
    }

    public static FlattenConfig load(String location) throws IOException {
        FileResolver.ResolvedFile resolved = resolveFile(null, location);
        Properties properties = new Properties();
        try (InputStream closeMe = resolved.in()) {
            properties.load(closeMe);
        }
        // relative paths in the file are relative to the file itself
        Path baseDir = resolved.baseDir();
        return parse(properties, baseDir);
    }

    static FlattenConfig parse(Properties properties, Path baseDir) {
        Path input = path(properties, "input.path", baseDir, null);
        if (input == null) {
            throw new IllegalArgumentException("'input.path' is required");
        }
        Path enrichedDir = path(properties, "output.enriched.dir", baseDir, "eq_enriched");
        Path cleanDir = path(properties, "output.clean.dir", baseDir, "eq_clean");
        Path diagnostics = path(properties, "output.diagnostics.file", baseDir, null);

        OutputFormat enrichedFormat =
                OutputFormat.parse(properties.getProperty("output.enriched.format", "csv"));
        OutputFormat cleanFormat =
                OutputFormat.parse(properties.getProperty("output.clean.format", "xlsx"));

        int maxDepth =
                safeInt(
                        properties.getProperty("resolver.maxDepth"),
                        ReferenceResolver.DEFAULT_MAX_DEPTH);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("'resolver.maxDepth' must be >= 0");
        }
        boolean parallel = safeBoolean(properties.getProperty("resolver.parallel"), false);

        String entryPattern =
                properties
                        .getProperty("input.entryPattern", ArchiveReader.DEFAULT_ENTRY_PATTERN)
                        .trim();

        return new FlattenConfig(
                input,
                entryPattern,
                enrichedDir,
                cleanDir,
                enrichedFormat,
                cleanFormat,
                diagnostics,
                maxDepth,
                parallel);
    }

    private static Path path(Properties properties, String key, Path baseDir, String fallback) {
        String raw = properties.getProperty(key, fallback);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Path path = Paths.get(raw.trim());
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path).normalize();
    }

    /**
     * Robust boolean parsing: - null -> defaultValue - trims whitespace - ignores a trailing
     * semicolon (e.g., "true;") - uses Boolean.parseBoolean on the cleaned token
     */
    private static boolean safeBoolean(String raw, boolean defaultValue) {
        if (raw == null) return defaultValue;
        String cleaned = raw.trim();
        if (cleaned.endsWith(";")) cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        return Boolean.parseBoolean(cleaned);
    }

    private static int safeInt(String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: '" + raw + "'", e);
        }
    }
}
