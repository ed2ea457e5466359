package com.localedata.assembler.pipeline;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one assembly build.
 */
@Data
@Builder
public class AssemblyResult {
    private boolean success;
    private String errorMessage;
    private String failingUnit;
    private Path outputPath;
    private Path manifestPath;

    private int unitsProcessed;
    private int triggerUnits;
    private int categoriesRequested;
    private int partsEmitted;
    private int entriesPlanned;
    private List<String> manifestEntries;

    public static AssemblyResult failure(String errorMessage) {
        return AssemblyResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static AssemblyResult unitFailure(String unitName, String errorMessage) {
        return AssemblyResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failingUnit(unitName)
                .build();
    }
}
