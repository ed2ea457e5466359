package com.localedata.assembler.exception;

import java.nio.file.Path;

/**
 * An output artifact could not be written.
 */
public class EmissionException extends LocaleAssemblyException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public EmissionException(Path path, Throwable cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
