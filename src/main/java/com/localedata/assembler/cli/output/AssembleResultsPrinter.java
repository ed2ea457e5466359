package com.localedata.assembler.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.cli.model.AssembleOptions;
import com.localedata.assembler.cli.model.ValidatedAssembleOptions;
import com.localedata.assembler.pipeline.AssemblyResult;

/**
 * Responsible only for printing CLI output for the "assemble" command.
 * No validation, no execution.
 */
public class AssembleResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AssembleResultsPrinter.class);

    public void printBanner(AssembleOptions o, ValidatedAssembleOptions v) {
        log.info("=================================================");
        log.info("Locale Bundle Assembler");
        log.info("=================================================");
        log.info("Source Directory: {}", v.getNormalizedSourceDir());
        log.info("Locale Data: {}", v.getLocaleDataDir());
        log.info("Locales: {}", String.join(", ", v.getLocales()));
        log.info("Assembly: {}", o.getAssembly());
        log.info("Target: {}", o.getTarget());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        if (o.getQuiescenceMs() != null) {
            log.info("Barrier: best effort, {} ms", o.getQuiescenceMs());
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedAssembleOptions v, AssemblyResult result) {
        log.info("");
        log.info("=================================================");
        log.info("ASSEMBLY SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Units Processed: {}", result.getUnitsProcessed());
        log.info("Trigger Units: {}", result.getTriggerUnits());
        log.info("Categories Requested: {}", result.getCategoriesRequested());
        log.info("Entries Planned: {}", result.getEntriesPlanned());
        log.info("Parts Emitted: {}", result.getPartsEmitted());

        if (result.getManifestPath() != null) {
            log.info("");
            log.info("Manifest: {}", result.getManifestPath());
            log.info("  Files: {}", String.join(", ", result.getManifestEntries()));
        }
        log.info("=================================================");
    }

    public void printFailure(AssemblyResult result) {
        log.error("Assembly failed: {}", result.getErrorMessage());
        if (result.getFailingUnit() != null) {
            log.error("Failing unit: {}", result.getFailingUnit());
        }
    }
}
