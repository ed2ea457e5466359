package com.localedata.assembler.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AssembleCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAssembleOptions {
    Path normalizedSourceDir;
    Path normalizedOutputDir;
    Path localeDataDir;
    List<String> locales;
}
