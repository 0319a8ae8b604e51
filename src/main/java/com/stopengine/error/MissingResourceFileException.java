package com.stopengine.error;

import java.nio.file.Path;

public class MissingResourceFileException extends StopwordException {
    private final Path path;

    public MissingResourceFileException(String reference, Path baseDir, Path path) {
        super(ErrorKind.MISSING_FILE,
            "Stopword resource file '" + reference + "' not found under '" + baseDir + "'.");
        this.path = path;
    }

    public MissingResourceFileException(Path path) {
        super(ErrorKind.MISSING_FILE, "Stopword file not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
