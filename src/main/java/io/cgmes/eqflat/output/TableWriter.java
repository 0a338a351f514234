package io.cgmes.eqflat.output;

import io.cgmes.eqflat.mapping.ClassTable;
import java.io.IOException;
import java.nio.file.Path;

/** Persists a class table under {@code <directory>/<baseName>.<extension>}. */
public interface TableWriter {

    String extension();

    /**
     * @return the written file
     */
    Path write(ClassTable table, Path directory, String baseName) throws IOException;

    /** Makes a class name safe to use as a file name. */
    static String fileSafe(String name) {
        String safe = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return safe.isEmpty() ? "_" : safe;
    }
}
