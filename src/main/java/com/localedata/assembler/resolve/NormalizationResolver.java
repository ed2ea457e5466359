package com.localedata.assembler.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.locale.LikelyScripts;
import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.plan.EntryKind;
import com.localedata.assembler.plan.PlanEntry;
import com.localedata.assembler.plan.ResolvedEntry;
import com.localedata.assembler.util.DataNames;

/**
 * Resolves normalization forms (nfc, nfd, nfkc, nfkd) into root.
 *
 * A form qualified with "all" resolves only the aggregate document. An
 * unqualified form resolves one document per script likely used by the target
 * locales; a script-qualified form resolves that script's document.
 */
public class NormalizationResolver implements SpecialCategoryResolver {
    private static final Logger log = LoggerFactory.getLogger(NormalizationResolver.class);

    private final DocumentLoader loader;
    private final LikelyScripts likelyScripts;

    NormalizationResolver(DocumentLoader loader, LikelyScripts likelyScripts) {
        this.loader = loader;
        this.likelyScripts = likelyScripts;
    }

    @Override
    public boolean supports(CategoryToken.Kind kind) {
        return kind == CategoryToken.Kind.NORMALIZATION;
    }

    @Override
    public List<ResolvedEntry> resolve(Collection<CategoryToken> tokens, List<LocaleTag> locales) {
        // form -> qualifiers, "" for an unqualified request
        Map<String, Set<String>> forms = new TreeMap<>();
        for (CategoryToken token : tokens) {
            String form = token.getForm().orElseThrow();
            forms.computeIfAbsent(form, f -> new LinkedHashSet<>()).add(token.getQualifier().orElse(""));
        }

        Set<String> implied = likelyScripts.likelyScripts(locales);
        List<ResolvedEntry> resolved = new ArrayList<>();

        forms.forEach((form, qualifiers) -> {
            Set<String> scripts = new LinkedHashSet<>();
            if (qualifiers.stream().anyMatch(CategoryToken.ALL_SCRIPTS::equalsIgnoreCase)) {
                scripts.add(CategoryToken.ALL_SCRIPTS);
            } else {
                for (String qualifier : qualifiers) {
                    if (qualifier.isEmpty()) {
                        scripts.addAll(implied);
                    } else {
                        scripts.add(qualifier);
                    }
                }
            }

            for (String script : scripts) {
                log.debug("Including {} for script {}", form, script);
                addForm(form, script, resolved);
            }
        });

        return resolved;
    }

    private void addForm(String form, String script, List<ResolvedEntry> resolved) {
        String document = form + "/" + script;
        loader.load(document).ifPresent(doc -> resolved.add(new ResolvedEntry(PartKey.ROOT, PlanEntry.builder()
                .key(document)
                .category(CategoryToken.of(document))
                .target(DataNames.DATA_NAMESPACE + ".norm." + form)
                .kind(EntryKind.EXTEND)
                .payload(doc)
                .source(loader.getRepository().resolve(document))
                .build())));
    }
}
