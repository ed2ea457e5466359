package com.localedata.assembler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One node of the locale fallback hierarchy: "root", "en", "zh-Hans",
 * "zh-Hans-CN", "en-US" or "und-US".
 */
@Value
public class PartKey {

    public static final String ROOT_NAME = "root";
    public static final PartKey ROOT = new PartKey(ROOT_NAME);

    @NonNull
    String value;

    public static PartKey of(String value) {
        return ROOT_NAME.equals(value) ? ROOT : new PartKey(value);
    }

    public static PartKey of(String... subtags) {
        return of(String.join("-", subtags));
    }

    public boolean isRoot() {
        return ROOT_NAME.equals(value);
    }

    /**
     * Directory of this part relative to the repository locale directory.
     * The root part lives directly in the locale directory.
     */
    public String toRepositoryPath() {
        return isRoot() ? "" : value.replace('-', '/');
    }

    @Override
    public String toString() {
        return value;
    }
}
