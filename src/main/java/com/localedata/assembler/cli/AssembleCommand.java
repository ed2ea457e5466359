package com.localedata.assembler.cli;

import java.nio.file.Files;
import java.time.Duration;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.cli.exception.OptionsValidationException;
import com.localedata.assembler.cli.model.AssembleOptions;
import com.localedata.assembler.cli.model.ValidatedAssembleOptions;
import com.localedata.assembler.cli.output.AssembleResultsPrinter;
import com.localedata.assembler.cli.validation.AssembleOptionsValidator;
import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.pipeline.AssemblyPipeline;
import com.localedata.assembler.pipeline.AssemblyResult;
import com.localedata.assembler.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that rewrites a source tree and assembles its locale data bundles.
 */
@Command(
        name = "assemble",
        mixinStandardHelpOptions = true,
        version = "locale-bundle-assembler 1.0.0",
        description = "Rewrites locale directives in a source tree and emits per-locale data bundles with a manifest."
)
public class AssembleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AssembleCommand.class);

    @Mixin
    private AssembleOptions options = new AssembleOptions();

    private final AssembleOptionsValidator validator = new AssembleOptionsValidator();
    private final AssembleResultsPrinter printer = new AssembleResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedAssembleOptions validated;
            try {
                validated = validator.validate(options);
            } catch (OptionsValidationException e) {
                e.getErrors().forEach(log::error);
                return 1;
            }

            AssemblerConfig config = toConfig(validated);

            if (Files.exists(config.getLocalesOutputDir())) {
                log.warn("Force mode enabled, will overwrite: {}", config.getLocalesOutputDir());
                FileWriteUtil.deleteDirectory(config.getLocalesOutputDir());
            }

            printer.printBanner(options, validated);

            AssemblyResult result = new AssemblyPipeline(config).run(validated.getNormalizedSourceDir());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(validated, result);
            return 0;

        } catch (Exception e) {
            log.error("Assembly failed with exception", e);
            return 1;
        }
    }

    AssemblerConfig toConfig(ValidatedAssembleOptions v) {
        AssemblerConfig.AssemblerConfigBuilder builder = AssemblerConfig.builder()
                .locales(v.getLocales())
                .assembly(options.getAssembly())
                .compilation(options.getCompilation())
                .size(options.getSize())
                .target(options.getTarget())
                .runtimeRoot(options.getRuntimeRoot())
                .repositoryRoot(options.getRepositoryRoot().toAbsolutePath().normalize())
                .outputRoot(v.getNormalizedOutputDir())
                .debug(options.isDebug());
        if (options.getQuiescenceMs() != null) {
            builder.bestEffortBarrier(true)
                    .quiescenceDelay(Duration.ofMillis(options.getQuiescenceMs()));
        }
        return builder.build();
    }
}
