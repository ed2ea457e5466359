package com.localedata.assembler.pipeline;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.aggregate.RequestAggregator;
import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.emit.ArtifactWriter;
import com.localedata.assembler.emit.BundleEmitter;
import com.localedata.assembler.emit.EmissionReport;
import com.localedata.assembler.emit.EmittedSet;
import com.localedata.assembler.emit.PartEncoder;
import com.localedata.assembler.exception.AssemblerConfigurationException;
import com.localedata.assembler.locale.LocaleDecomposer;
import com.localedata.assembler.plan.BundlePlan;
import com.localedata.assembler.plan.BundlePlanner;
import com.localedata.assembler.repository.LocaleDataRepository;
import com.localedata.assembler.resolve.CategoryResolver;

import lombok.Getter;

/**
 * State scoped to one build: the request set, the memoized plan and the
 * emitted set. Passed explicitly to every unit so independent builds can run
 * side by side in one process.
 */
@Getter
public class BuildContext {
    private static final Logger log = LoggerFactory.getLogger(BuildContext.class);

    private final AssemblerConfig config;
    private final RequestAggregator aggregator;
    private final CompletionBarrier barrier;
    private final BundlePlanner planner;
    private final BundleEmitter emitter;
    private final EmittedSet emittedSet = new EmittedSet();
    private final Executor executor;

    private BundlePlan plan;
    private volatile boolean planned;

    public BuildContext(AssemblerConfig config, RequestAggregator aggregator, CompletionBarrier barrier,
                        BundlePlanner planner, BundleEmitter emitter, Executor executor) {
        this.config = require(config, "assembler configuration");
        this.aggregator = require(aggregator, "request aggregator");
        this.barrier = require(barrier, "completion barrier");
        this.planner = require(planner, "bundle planner");
        this.emitter = require(emitter, "bundle emitter");
        this.executor = executor == null ? ForkJoinPool.commonPool() : executor;
    }

    /**
     * Wires a context over the configured repository and output root.
     */
    public static BuildContext create(AssemblerConfig config, CompletionBarrier barrier, Executor executor) {
        require(config, "assembler configuration");
        if (config.getOutputRoot() == null) {
            throw new AssemblerConfigurationException("No output root configured");
        }
        LocaleDataRepository repository = LocaleDataRepository.open(config);
        BundlePlanner planner = new BundlePlanner(new LocaleDecomposer(), new CategoryResolver(repository, config.isDebug()));
        BundleEmitter emitter = new BundleEmitter(config.getLocalesOutputDir(), config.getAssembly(),
                new PartEncoder(config.getRuntimeRoot()), ArtifactWriter.FILE_SYSTEM);
        return new BuildContext(config, new RequestAggregator(config.isDebug()), barrier, planner, emitter, executor);
    }

    private static <T> T require(T collaborator, String name) {
        if (collaborator == null) {
            throw new AssemblerConfigurationException("Locale data assembly requires a " + name);
        }
        return collaborator;
    }

    public void record(String category) {
        if (aggregator.record(category) && planned) {
            log.warn("Category {} requested after locale data was planned; it is not included", category);
        }
    }

    /**
     * Plans on first call, then emits whatever has not been emitted yet.
     * Later calls reuse the plan and write nothing new.
     */
    public synchronized EmissionReport finalizeBuild() {
        if (plan == null) {
            plan = planner.plan(aggregator.snapshot(), config.getLocaleTags());
            planned = true;
        }
        return emitter.emit(plan, emittedSet);
    }

    public synchronized Optional<BundlePlan> getPlan() {
        return Optional.ofNullable(plan);
    }
}
