package com.localedata.assembler.exception;

import java.nio.file.Path;

/**
 * A repository document exists but could not be read or parsed.
 */
public class RepositoryReadException extends LocaleAssemblyException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public RepositoryReadException(Path path, Throwable cause) {
        super("Unable to read locale data document " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
