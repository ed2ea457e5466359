package com.localedata.assembler.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.locale.LikelyScripts;
import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.plan.PlanEntry;
import com.localedata.assembler.plan.ResolvedEntry;
import com.localedata.assembler.repository.LocaleDataRepository;
import com.localedata.assembler.util.DataNames;

/**
 * Looks up category data in the repository.
 *
 * Ordinary categories are resolved one part at a time; every part that holds
 * the document is a hit, since parts are layered from general to specific at
 * runtime. Special categories are delegated to their own resolvers.
 * A miss is never an error; an unreadable document is logged and skipped.
 */
public class CategoryResolver {
    private static final Logger log = LoggerFactory.getLogger(CategoryResolver.class);

    private final DocumentLoader loader;
    private final List<SpecialCategoryResolver> specialResolvers;
    private final boolean debug;

    public CategoryResolver(LocaleDataRepository repository) {
        this(repository, false);
    }

    /**
     * @param debug report misses at INFO instead of TRACE
     */
    public CategoryResolver(LocaleDataRepository repository, boolean debug) {
        this.debug = debug;
        this.loader = new DocumentLoader(repository);
        this.specialResolvers = List.of(
                new CharsetResolver(loader),
                new ZoneInfoResolver(loader),
                new NormalizationResolver(loader, new LikelyScripts(repository)));
    }

    public Optional<PlanEntry> resolve(PartKey part, CategoryToken token) {
        if (token.isSpecial()) {
            throw new IllegalArgumentException(token + " is not resolved per part");
        }

        String prefix = part.toRepositoryPath();
        String document = prefix.isEmpty() ? token.getName() : prefix + "/" + token.getName();

        Optional<PlanEntry> entry = loader.load(document).map(doc -> PlanEntry.builder()
                .key(token.getName())
                .category(token)
                .target(DataNames.categoryTarget(token.getName(), part))
                .payload(doc)
                .source(loader.getRepository().resolve(document))
                .build());

        if (entry.isEmpty()) {
            if (debug) {
                log.info("No {} at part {}", token, part);
            } else {
                log.trace("No {} at part {}", token, part);
            }
        }
        return entry;
    }

    public List<ResolvedEntry> resolveSpecial(Collection<CategoryToken> tokens, List<LocaleTag> locales) {
        List<ResolvedEntry> resolved = new ArrayList<>();
        for (SpecialCategoryResolver resolver : specialResolvers) {
            List<CategoryToken> supported = tokens.stream()
                    .filter(t -> resolver.supports(t.getKind()))
                    .toList();
            if (!supported.isEmpty()) {
                resolved.addAll(resolver.resolve(supported, locales));
            }
        }
        return resolved;
    }
}
