package com.productdata.etl;

import java.nio.file.Path;

/**
 * Thrown by a stage when a required input file is absent and the configured
 * {@link MissingInputPolicy} is {@link MissingInputPolicy#FAIL}.
 */
public class MissingInputException extends Exception {
    private final Path path;

    public MissingInputException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
