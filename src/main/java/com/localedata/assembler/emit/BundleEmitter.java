package com.localedata.assembler.emit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localedata.assembler.exception.EmissionException;
import com.localedata.assembler.model.AssemblyMode;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.plan.BundlePlan;
import com.localedata.assembler.plan.PlanEntry;

/**
 * Writes one artifact per planned part, and the manifest, at most once per build.
 *
 * The emitted set is the guard: the check and the write happen while holding
 * its monitor, so concurrent or repeated attempts never rewrite an artifact.
 */
public class BundleEmitter {
    private static final Logger log = LoggerFactory.getLogger(BundleEmitter.class);

    public static final String MANIFEST_NAME = "ilibmanifest";
    public static final String PART_EXTENSION = ".js";
    public static final String MANIFEST_EXTENSION = ".json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path localesDir;
    private final AssemblyMode mode;
    private final PartEncoder encoder;
    private final ArtifactWriter writer;

    public BundleEmitter(Path localesDir, AssemblyMode mode, PartEncoder encoder, ArtifactWriter writer) {
        this.localesDir = localesDir;
        this.mode = mode;
        this.encoder = encoder;
        this.writer = writer;
    }

    public EmissionReport emit(BundlePlan plan, EmittedSet emitted) {
        EmissionReport.EmissionReportBuilder report = EmissionReport.builder()
                .manifestPath(manifestPath());

        synchronized (emitted) {
            for (PartKey part : plan.getParts()) {
                if (emitted.isEmitted(part)) {
                    continue;
                }
                Path path = partPath(part.getValue());
                try {
                    List<PlanEntry> partEntries = plan.getEntries(part);
                    partEntries.forEach(e -> log.debug("{} <- {}", e.getTarget(), e.getSource()));
                    String content = encoder.encode(part, partEntries, mode);
                    log.info("Emitting {} ({} chars)", path.getFileName(), content.length());
                    writer.write(path, content);
                } catch (IOException e) {
                    log.error("Could not write locale part {} to {}", part, path);
                    throw new EmissionException(path, e);
                }
                emitted.markEmitted(part);
                report.writtenPart(part);
            }

            List<String> entries = new ArrayList<>(plan.getPartNames());
            entries.add(MANIFEST_NAME);

            if (!emitted.isManifestWritten()) {
                Path path = manifestPath();
                try {
                    writer.write(path, MAPPER.writerWithDefaultPrettyPrinter()
                            .writeValueAsString(Map.of("files", entries)));
                } catch (IOException e) {
                    log.error("Could not write manifest to {}", path);
                    throw new EmissionException(path, e);
                }
                emitted.markManifestWritten();
                log.info("Wrote manifest with {} entries to {}", entries.size(), path);
            }

            return report.manifestEntries(entries).build();
        }
    }

    public Path partPath(String partName) {
        return localesDir.resolve(partName + PART_EXTENSION);
    }

    public Path manifestPath() {
        return localesDir.resolve(MANIFEST_NAME + MANIFEST_EXTENSION);
    }

    public Path getLocalesDir() {
        return localesDir;
    }
}
