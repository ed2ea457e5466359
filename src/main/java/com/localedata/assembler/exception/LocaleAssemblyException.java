package com.localedata.assembler.exception;

/**
 * Base type of every failure raised while assembling locale data.
 */
public class LocaleAssemblyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LocaleAssemblyException(String message) {
        super(message);
    }

    public LocaleAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
