package com.localedata.assembler.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.emit.EmissionReport;
import com.localedata.assembler.plan.BundlePlan;
import com.localedata.assembler.rewrite.DirectiveRewriter;
import com.localedata.assembler.rewrite.SourceUnit;
import com.localedata.assembler.util.FileWriteUtil;

/**
 * Drives a whole build the way a host bundler would: every source unit is
 * rewritten on a worker pool in no particular order, the barrier is released
 * once every unit has been handed to the rewriter, and rewritten units are
 * written under the output root mirroring their source paths.
 */
public class AssemblyPipeline {
    private static final Logger log = LoggerFactory.getLogger(AssemblyPipeline.class);

    private final AssemblerConfig config;
    private final int workers;

    public AssemblyPipeline(AssemblerConfig config) {
        this(config, Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    public AssemblyPipeline(AssemblerConfig config, int workers) {
        this.config = config;
        this.workers = workers;
    }

    public AssemblyResult run(Path sourceDir) {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            log.info("Starting locale data assembly...");

            log.info("Step 1: Discovering source units...");
            List<Path> files = discoverUnits(sourceDir);
            if (files.isEmpty()) {
                return AssemblyResult.failure("No source units found in " + sourceDir);
            }

            SignalBarrier signal = new SignalBarrier();
            CompletionBarrier barrier = config.isBestEffortBarrier()
                    ? new QuiescenceBarrier(config.getQuiescenceDelay())
                    : signal;
            BuildContext context = BuildContext.create(config, barrier, pool);
            DirectiveRewriter rewriter = new DirectiveRewriter(context);

            log.info("Step 2: Scanning {} units...", files.size());
            Map<Path, Future<CompletableFuture<String>>> submitted = new LinkedHashMap<>();
            for (Path file : files) {
                submitted.put(file, pool.submit(() -> rewriter.rewrite(new SourceUnit(
                        sourceDir.relativize(file).toString(),
                        Files.readString(file, StandardCharsets.UTF_8)))));
            }

            Map<Path, CompletableFuture<String>> rewrites = new LinkedHashMap<>();
            for (Map.Entry<Path, Future<CompletableFuture<String>>> entry : submitted.entrySet()) {
                try {
                    rewrites.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    return unitFailure(sourceDir, entry.getKey(), e.getCause());
                }
            }

            int triggerUnits = rewriter.getTriggerUnits();
            if (triggerUnits == 0) {
                log.warn("No unit contains a locale data trigger; no locale data will be emitted");
            }

            log.info("Step 3: All units scanned, {} categories requested", context.getAggregator().size());
            signal.signalAllUnitsEnumerated();

            log.info("Step 4: Writing rewritten units...");
            for (Map.Entry<Path, CompletableFuture<String>> entry : rewrites.entrySet()) {
                String output;
                try {
                    output = entry.getValue().join();
                } catch (CompletionException e) {
                    return unitFailure(sourceDir, entry.getKey(), e.getCause());
                }
                FileWriteUtil.safeWriteString(config.getOutputRoot().resolve(sourceDir.relativize(entry.getKey())), output);
            }

            EmissionReport report = context.getEmittedSet().isManifestWritten()
                    ? context.finalizeBuild()
                    : null;

            log.info("Locale data assembly complete!");

            return AssemblyResult.builder()
                    .success(true)
                    .outputPath(config.getOutputRoot())
                    .manifestPath(report != null ? report.getManifestPath() : null)
                    .unitsProcessed(files.size())
                    .triggerUnits(triggerUnits)
                    .categoriesRequested(context.getAggregator().size())
                    .partsEmitted(context.getEmittedSet().size())
                    .entriesPlanned(context.getPlan().map(BundlePlan::getEntryCount).orElse(0))
                    .manifestEntries(report != null ? report.getManifestEntries() : List.of())
                    .build();

        } catch (Exception e) {
            log.error("Assembly failed", e);
            return AssemblyResult.failure(e.getMessage());
        } finally {
            pool.shutdown();
        }
    }

    private AssemblyResult unitFailure(Path sourceDir, Path file, Throwable cause) {
        String unit = sourceDir.relativize(file).toString();
        log.error("Unit {} failed", unit, cause);
        return AssemblyResult.unitFailure(unit, cause.getMessage());
    }

    List<Path> discoverUnits(Path sourceDir) throws IOException {
        try (Stream<Path> stream = Files.walk(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".js"))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        }
    }
}
