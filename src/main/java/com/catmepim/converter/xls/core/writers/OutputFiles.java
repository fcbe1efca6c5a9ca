package com.catmepim.converter.xls.core.writers;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File checks shared by the writers.
 */
final class OutputFiles {

    private OutputFiles() {
    }

    /**
     * Creates the parent directory and refuses to replace an existing file unless allowed.
     */
    static void prepare(Path file, boolean overwrite) throws IOException {
        if (Files.exists(file) && !overwrite) {
            throw new FileAlreadyExistsException(file.toString(), null, "output file exists and overwrite is false");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
