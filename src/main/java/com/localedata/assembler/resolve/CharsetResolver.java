package com.localedata.assembler.resolve;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ArrayList;
import java.util.Map;
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
 * Resolves "charset" and "charmaps" requests.
 *
 * Charsets are looked up in the lang2charset table by language or
 * language-script; the "*" row applies to every locale. Every resolved
 * charset, and the alias table, goes to root. Charmaps are bucketed under the
 * language(-script) part that asked for them, or root for the "*" row, and are
 * skipped for charsets marked optional.
 */
public class CharsetResolver implements SpecialCategoryResolver {
    private static final Logger log = LoggerFactory.getLogger(CharsetResolver.class);

    static final String LANG_TO_CHARSET = "lang2charset";
    static final String CHARSET_ALIASES = "charsetaliases";
    static final String GLOBAL = "*";

    private final DocumentLoader loader;

    CharsetResolver(DocumentLoader loader) {
        this.loader = loader;
    }

    @Override
    public boolean supports(CategoryToken.Kind kind) {
        return kind == CategoryToken.Kind.CHARSET || kind == CategoryToken.Kind.CHARMAPS;
    }

    @Override
    public List<ResolvedEntry> resolve(Collection<CategoryToken> tokens, List<LocaleTag> locales) {
        Optional<DataDocument> table = loader.load(LANG_TO_CHARSET);
        if (table.isEmpty()) {
            log.warn("No {} table in repository; charset data not included", LANG_TO_CHARSET);
            return List.of();
        }

        boolean charmapsRequested = tokens.stream().anyMatch(t -> t.getKind() == CategoryToken.Kind.CHARMAPS);

        Set<String> charsets = new LinkedHashSet<>();
        Map<String, Set<String>> charmaps = new LinkedHashMap<>();

        for (LocaleTag locale : locales) {
            if (locale.isEmpty()) {
                continue;
            }
            for (String row : List.of(locale.getLanguageScript(), GLOBAL)) {
                List<String> names = charsetNames(table.get(), row);
                charsets.addAll(names);
                if (charmapsRequested && !names.isEmpty()) {
                    charmaps.computeIfAbsent(row, r -> new LinkedHashSet<>()).addAll(names);
                }
            }
        }

        if (charsets.isEmpty()) {
            return List.of();
        }

        CategoryToken charsetToken = CategoryToken.of(CategoryToken.CHARSET);
        List<ResolvedEntry> resolved = new ArrayList<>();
        Set<String> optional = new LinkedHashSet<>();

        loader.load(CHARSET_ALIASES).ifPresent(aliases -> resolved.add(new ResolvedEntry(PartKey.ROOT,
                PlanEntry.builder()
                        .key(CHARSET_ALIASES)
                        .category(charsetToken)
                        .target(DataNames.DATA_NAMESPACE + "." + CHARSET_ALIASES)
                        .payload(aliases)
                        .source(loader.getRepository().resolve(CHARSET_ALIASES))
                        .build())));

        for (String charset : charsets) {
            String document = CategoryToken.CHARSET + "/" + charset;
            loader.load(document).ifPresent(doc -> {
                if (doc.isFlagSet("optional")) {
                    optional.add(charset);
                }
                resolved.add(new ResolvedEntry(PartKey.ROOT, PlanEntry.builder()
                        .key(document)
                        .category(charsetToken)
                        .target(DataNames.DATA_NAMESPACE + ".charset_" + DataNames.toDataName(charset))
                        .payload(doc)
                        .source(loader.getRepository().resolve(document))
                        .build()));
            });
        }

        CategoryToken charmapToken = CategoryToken.of(CategoryToken.CHARMAPS);
        charmaps.forEach((row, names) -> {
            PartKey part = GLOBAL.equals(row) ? PartKey.ROOT : PartKey.of(row);
            for (String charset : names) {
                if (optional.contains(charset)) {
                    log.debug("Charmap {} skipped, charset is optional", charset);
                    continue;
                }
                String document = CategoryToken.CHARMAPS + "/" + charset;
                loader.load(document).ifPresent(doc -> resolved.add(new ResolvedEntry(part, PlanEntry.builder()
                        .key(document)
                        .category(charmapToken)
                        .target(DataNames.DATA_NAMESPACE + ".charmaps_" + DataNames.toDataName(charset))
                        .payload(doc)
                        .source(loader.getRepository().resolve(document))
                        .build())));
            }
        });

        return resolved;
    }

    private static List<String> charsetNames(DataDocument table, String row) {
        JsonNode names = table.get(row);
        if (names == null || !names.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(names.size());
        names.forEach(n -> {
            if (n.isTextual()) {
                result.add(n.asText());
            }
        });
        return result;
    }
}
