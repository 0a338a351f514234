package io.cgmes.eqflat.config.loader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates a file given as an absolute path, a path relative to a base directory or the working
 * directory, a path relative to the user home, or a classpath resource, in that order.
 */
public final class FileResolver {

    private FileResolver() {}

    /**
     * @param in open stream, to be closed by the caller
     * @param baseDir directory of the resolved file, null when it came from the classpath
     */
    public record ResolvedFile(InputStream in, Path baseDir) {}

    public static ResolvedFile resolveFile(Path baseDir, String location) throws IOException {
        String trimmed = location.trim();
        Path path = Paths.get(trimmed);
        if (path.isAbsolute()) {
            return open(path);
        }
        if (baseDir != null && Files.isRegularFile(baseDir.resolve(path))) {
            return open(baseDir.resolve(path));
        }
        if (Files.isRegularFile(path)) {
            return open(path);
        }
        Path inHome = Paths.get(System.getProperty("user.home")).resolve(path);
        if (Files.isRegularFile(inHome)) {
            return open(inHome);
        }
        String resource = trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
        InputStream in = FileResolver.class.getClassLoader().getResourceAsStream(resource);
        if (in != null) {
            return new ResolvedFile(in, null);
        }
        throw new IOException("Cannot find '" + location + "' on disk or on the classpath");
    }

    private static ResolvedFile open(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        return new ResolvedFile(Files.newInputStream(absolute), absolute.getParent());
    }
}
