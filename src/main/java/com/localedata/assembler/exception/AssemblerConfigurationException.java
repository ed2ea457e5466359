package com.localedata.assembler.exception;

/**
 * A required collaborator or setting is missing. Fatal for the build step that hit it.
 */
public class AssemblerConfigurationException extends LocaleAssemblyException {

    private static final long serialVersionUID = 1L;

    public AssemblerConfigurationException(String message) {
        super(message);
    }
}
