package com.localedata.assembler.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A requested data category, classified once when it is recorded.
 */
@Getter
@EqualsAndHashCode(of = "name")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CategoryToken implements Comparable<CategoryToken> {

    public static final String CHARSET = "charset";
    public static final String CHARMAPS = "charmaps";
    public static final String ZONEINFO = "zoneinfo";
    public static final String ALL_SCRIPTS = "all";

    private static final Pattern NORMALIZATION = Pattern.compile("(nfc|nfd|nfkc|nfkd)(?:/(\\w+))?",
            Pattern.CASE_INSENSITIVE);

    public enum Kind {
        /** Resolved per hierarchy part against the repository. */
        ORDINARY,
        CHARSET,
        CHARMAPS,
        ZONEINFO,
        /** nfc, nfd, nfkc or nfkd, optionally qualified by a script. */
        NORMALIZATION;

        public boolean isSpecial() {
            return this != ORDINARY;
        }
    }

    private final String name;
    private final Kind kind;
    private final String form;
    private final String qualifier;

    public static CategoryToken of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Category name must not be blank");
        }
        String name = raw.trim();

        switch (name) {
            case CHARSET:
                return new CategoryToken(name, Kind.CHARSET, null, null);
            case CHARMAPS:
                return new CategoryToken(name, Kind.CHARMAPS, null, null);
            case ZONEINFO:
                return new CategoryToken(name, Kind.ZONEINFO, null, null);
            default:
                break;
        }

        Matcher m = NORMALIZATION.matcher(name);
        if (m.matches()) {
            String form = m.group(1).toLowerCase(Locale.ROOT);
            String qualifier = m.group(2);
            return new CategoryToken(name, Kind.NORMALIZATION, form, qualifier);
        }

        return new CategoryToken(name, Kind.ORDINARY, null, null);
    }

    public Optional<String> getForm() {
        return Optional.ofNullable(form);
    }

    /**
     * Script qualifier of a normalization token ("Latn", "all"), empty when unqualified.
     */
    public Optional<String> getQualifier() {
        return Optional.ofNullable(qualifier);
    }

    public boolean isSpecial() {
        return kind.isSpecial();
    }

    @Override
    public int compareTo(CategoryToken other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
