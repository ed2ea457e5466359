package com.localedata.assembler.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;

/**
 * Structured locale identifier: language, optional script, optional region.
 *
 * Parsed leniently from hyphen or underscore separated identifiers such as
 * "en-US", "zh_Hant_TW" or "sr-Latn". Unrecognised subtags (variants,
 * extensions) are ignored. An identifier without a usable language subtag
 * produces the empty tag, which decomposes to the root part only.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LocaleTag {

    private static final Pattern LANGUAGE = Pattern.compile("[A-Za-z]{2,3}");
    private static final Pattern SCRIPT = Pattern.compile("[A-Za-z]{4}");
    private static final Pattern REGION = Pattern.compile("[A-Za-z]{2}|[0-9]{3}");

    private static final LocaleTag EMPTY = new LocaleTag(null, null, null);

    private final String language;
    private final String script;
    private final String region;

    public static LocaleTag parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return EMPTY;
        }

        String[] subtags = identifier.trim().split("[-_]");
        if (!LANGUAGE.matcher(subtags[0]).matches()) {
            return EMPTY;
        }

        String language = subtags[0].toLowerCase(Locale.ROOT);
        String script = null;
        String region = null;

        for (int i = 1; i < subtags.length; i++) {
            String subtag = subtags[i];
            if (script == null && region == null && SCRIPT.matcher(subtag).matches()) {
                script = Character.toUpperCase(subtag.charAt(0)) + subtag.substring(1).toLowerCase(Locale.ROOT);
            } else if (region == null && REGION.matcher(subtag).matches()) {
                region = subtag.toUpperCase(Locale.ROOT);
            }
        }

        return new LocaleTag(language, script, region);
    }

    public boolean isEmpty() {
        return language == null;
    }

    public String getLanguage() {
        return language;
    }

    public Optional<String> getScript() {
        return Optional.ofNullable(script);
    }

    public Optional<String> getRegion() {
        return Optional.ofNullable(region);
    }

    /**
     * Language plus script when present, e.g. "zh-Hans" or "en".
     */
    public String getLanguageScript() {
        if (isEmpty()) {
            return "";
        }
        return script == null ? language : language + "-" + script;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(language);
        if (script != null) {
            sb.append('-').append(script);
        }
        if (region != null) {
            sb.append('-').append(region);
        }
        return sb.toString();
    }
}
