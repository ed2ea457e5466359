package com.localedata.assembler.cli.exception;

import java.util.List;

import com.localedata.assembler.exception.AssemblerConfigurationException;

/**
 * Every problem found in the command line options of one invocation.
 */
public class OptionsValidationException extends AssemblerConfigurationException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid options:" + System.lineSeparator() + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
