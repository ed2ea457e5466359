package com.localedata.assembler.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.DataDocument;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.plan.PlanEntry;
import com.localedata.assembler.plan.ResolvedEntry;
import com.localedata.assembler.util.DataNames;

/**
 * Resolves "zoneinfo" into root.
 *
 * Includes the region to zone table, the zones listed for the regions of the
 * target locales, and every generic zone document directly inside the zone
 * directory or its Etc/ subdirectory whatever regions were requested.
 */
public class ZoneInfoResolver implements SpecialCategoryResolver {
    private static final Logger log = LoggerFactory.getLogger(ZoneInfoResolver.class);

    static final String ZONE_DIR = CategoryToken.ZONEINFO;
    static final String ZONE_TABLE = "zonetab";
    static final String GENERIC_SUBDIR = "Etc";

    private final DocumentLoader loader;

    ZoneInfoResolver(DocumentLoader loader) {
        this.loader = loader;
    }

    @Override
    public boolean supports(CategoryToken.Kind kind) {
        return kind == CategoryToken.Kind.ZONEINFO;
    }

    @Override
    public List<ResolvedEntry> resolve(Collection<CategoryToken> tokens, List<LocaleTag> locales) {
        CategoryToken token = tokens.iterator().next();
        List<ResolvedEntry> resolved = new ArrayList<>();

        String tableDocument = ZONE_DIR + "/" + ZONE_TABLE;
        Optional<DataDocument> table = loader.load(tableDocument);
        if (table.isPresent()) {
            resolved.add(new ResolvedEntry(PartKey.ROOT, PlanEntry.builder()
                    .key(ZONE_TABLE)
                    .category(token)
                    .target(DataNames.DATA_NAMESPACE + ".zoneinfo." + ZONE_TABLE)
                    .payload(table.get())
                    .source(loader.getRepository().resolve(tableDocument))
                    .build()));

            for (String zone : zonesForRegions(table.get(), locales)) {
                zoneEntry(token, zone).ifPresent(resolved::add);
            }
        } else {
            log.warn("No zone table found at {}", loader.getRepository().resolve(tableDocument));
        }

        for (String zone : genericZones()) {
            zoneEntry(token, zone).ifPresent(resolved::add);
        }

        return resolved;
    }

    private static Set<String> zonesForRegions(DataDocument table, List<LocaleTag> locales) {
        Set<String> zones = new LinkedHashSet<>();
        for (LocaleTag locale : locales) {
            locale.getRegion().ifPresent(region -> {
                JsonNode regionZones = table.get(region);
                if (regionZones != null && regionZones.isArray()) {
                    regionZones.forEach(z -> zones.add(z.asText()));
                }
            });
        }
        return zones;
    }

    private List<String> genericZones() {
        List<String> zones = new ArrayList<>();
        for (String name : loader.list(ZONE_DIR)) {
            if (!ZONE_TABLE.equals(name)) {
                zones.add(name);
            }
        }
        for (String name : loader.list(ZONE_DIR + "/" + GENERIC_SUBDIR)) {
            zones.add(GENERIC_SUBDIR + "/" + name);
        }
        return zones;
    }

    private Optional<ResolvedEntry> zoneEntry(CategoryToken token, String zone) {
        String document = ZONE_DIR + "/" + zone;
        return loader.load(document).map(doc -> new ResolvedEntry(PartKey.ROOT, PlanEntry.builder()
                .key(document)
                .category(token)
                .target(DataNames.zoneTarget(zone))
                .payload(doc)
                .source(loader.getRepository().resolve(document))
                .build()));
    }
}
