package com.localedata.assembler.plan;

import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.locale.LocaleDecomposer;
import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.resolve.CategoryResolver;

/**
 * Builds the bundle plan from a request snapshot and the target locales.
 *
 * Parts shared by several locales (root, "en" for en-US and en-GB) are
 * resolved once; a (part, category) pair already in the plan is not looked
 * up again.
 */
public class BundlePlanner {
    private static final Logger log = LoggerFactory.getLogger(BundlePlanner.class);

    private final LocaleDecomposer decomposer;
    private final CategoryResolver resolver;

    public BundlePlanner(LocaleDecomposer decomposer, CategoryResolver resolver) {
        this.decomposer = decomposer;
        this.resolver = resolver;
    }

    public BundlePlan plan(Collection<CategoryToken> requests, List<LocaleTag> locales) {
        BundlePlan plan = new BundlePlan();

        List<CategoryToken> ordinary = requests.stream().filter(t -> !t.isSpecial()).toList();
        List<CategoryToken> special = requests.stream().filter(CategoryToken::isSpecial).toList();

        int skipped = 0;
        for (LocaleTag locale : locales) {
            for (PartKey part : decomposer.decompose(locale)) {
                for (CategoryToken token : ordinary) {
                    if (plan.contains(part, token.getName())) {
                        skipped++;
                        continue;
                    }
                    resolver.resolve(part, token).ifPresent(entry -> plan.addIfAbsent(part, entry));
                }
            }
        }

        if (!special.isEmpty()) {
            for (ResolvedEntry resolved : resolver.resolveSpecial(special, locales)) {
                if (!plan.addIfAbsent(resolved)) {
                    skipped++;
                }
            }
        }

        log.info("Planned {} entries in {} parts for {} categories and {} locales ({} shared lookups skipped)",
                plan.getEntryCount(), plan.getParts().size(), requests.size(), locales.size(), skipped);
        return plan;
    }
}
