package com.localedata.assembler.locale;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.model.PartKey;

/**
 * Splits a locale into the hierarchy parts that may carry data for it,
 * most general first.
 *
 * For "zh-Hant-TW" the result is root, zh, zh-Hant, zh-Hant-TW, zh-TW, und-TW.
 * Pure and stateless; an empty or unparsable identifier yields root alone.
 */
public class LocaleDecomposer {

    public static final String UNDETERMINED = "und";

    public List<PartKey> decompose(String identifier) {
        return decompose(LocaleTag.parse(identifier));
    }

    public List<PartKey> decompose(LocaleTag tag) {
        Set<PartKey> parts = new LinkedHashSet<>();
        parts.add(PartKey.ROOT);
        if (tag.isEmpty()) {
            return List.copyOf(parts);
        }

        String language = tag.getLanguage();
        parts.add(PartKey.of(language));

        tag.getScript().ifPresent(script -> {
            parts.add(PartKey.of(language, script));
            tag.getRegion().ifPresent(region -> parts.add(PartKey.of(language, script, region)));
        });

        tag.getRegion().ifPresent(region -> {
            parts.add(PartKey.of(language, region));
            parts.add(PartKey.of(UNDETERMINED, region));
        });

        // "und-US" would otherwise list und-US twice
        return List.copyOf(parts);
    }
}
