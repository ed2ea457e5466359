package com.localedata.assembler.locale;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.localedata.assembler.exception.RepositoryReadException;
import com.localedata.assembler.model.DataDocument;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.repository.LocaleDataRepository;

/**
 * Expands locales to the writing scripts they are most likely written in.
 *
 * An explicit script subtag wins. Otherwise the repository's likely-locales
 * table ("en" -> "en-Latn-US") is consulted, then a built-in table.
 */
public class LikelyScripts {
    private static final Logger log = LoggerFactory.getLogger(LikelyScripts.class);

    static final String LIKELY_LOCALES = "likelylocales";

    private static final Map<String, String> BUILT_IN = Map.ofEntries(
            Map.entry("ar", "Arab"), Map.entry("bg", "Cyrl"), Map.entry("bn", "Beng"),
            Map.entry("cs", "Latn"), Map.entry("da", "Latn"), Map.entry("de", "Latn"),
            Map.entry("el", "Grek"), Map.entry("en", "Latn"), Map.entry("es", "Latn"),
            Map.entry("fa", "Arab"), Map.entry("fi", "Latn"), Map.entry("fr", "Latn"),
            Map.entry("he", "Hebr"), Map.entry("hi", "Deva"), Map.entry("hu", "Latn"),
            Map.entry("id", "Latn"), Map.entry("it", "Latn"), Map.entry("ja", "Jpan"),
            Map.entry("ka", "Geor"), Map.entry("km", "Khmr"), Map.entry("ko", "Kore"),
            Map.entry("nl", "Latn"), Map.entry("no", "Latn"), Map.entry("pl", "Latn"),
            Map.entry("pt", "Latn"), Map.entry("ro", "Latn"), Map.entry("ru", "Cyrl"),
            Map.entry("sr", "Cyrl"), Map.entry("sv", "Latn"), Map.entry("ta", "Taml"),
            Map.entry("th", "Thai"), Map.entry("tr", "Latn"), Map.entry("uk", "Cyrl"),
            Map.entry("vi", "Latn"), Map.entry("zh", "Hans"));

    private final LocaleDataRepository repository;

    public LikelyScripts(LocaleDataRepository repository) {
        this.repository = repository;
    }

    public Optional<String> likelyScript(LocaleTag tag) {
        if (tag.isEmpty()) {
            return Optional.empty();
        }
        if (tag.getScript().isPresent()) {
            return tag.getScript();
        }
        return fromRepository(tag).or(() -> Optional.ofNullable(BUILT_IN.get(tag.getLanguage())));
    }

    /**
     * Distinct likely scripts of all locales, in locale order.
     */
    public Set<String> likelyScripts(Collection<LocaleTag> tags) {
        Set<String> scripts = new LinkedHashSet<>();
        for (LocaleTag tag : tags) {
            likelyScript(tag).ifPresent(scripts::add);
        }
        return scripts;
    }

    private Optional<String> fromRepository(LocaleTag tag) {
        Optional<DataDocument> table;
        try {
            table = repository.find(LIKELY_LOCALES);
        } catch (RepositoryReadException e) {
            log.warn("Ignoring likely locales table: {}", e.getMessage());
            return Optional.empty();
        }
        if (table.isEmpty()) {
            return Optional.empty();
        }

        String[] keys = tag.getRegion().isPresent()
                ? new String[] { tag.getLanguage() + "-" + tag.getRegion().get(), tag.getLanguage() }
                : new String[] { tag.getLanguage() };
        for (String key : keys) {
            JsonNode likely = table.get().get(key);
            if (likely != null && likely.isTextual()) {
                Optional<String> script = LocaleTag.parse(likely.asText()).getScript();
                if (script.isPresent()) {
                    return script;
                }
            }
        }
        return Optional.empty();
    }
}
