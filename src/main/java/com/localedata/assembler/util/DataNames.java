package com.localedata.assembler.util;

import java.util.regex.Pattern;

import com.localedata.assembler.model.PartKey;

import lombok.experimental.UtilityClass;

/**
 * Naming rules for runtime data namespace properties.
 */
@UtilityClass
public class DataNames {

    public static final String RUNTIME = "ilib";
    public static final String DATA_NAMESPACE = RUNTIME + ".data";

    private static final Pattern UNSAFE = Pattern.compile("[.:()/\\\\+\\-]");

    /**
     * Property-safe form of a category or part name. Root and "*" map to the empty name.
     */
    public static String toDataName(String name) {
        if (name == null || name.isEmpty() || PartKey.ROOT_NAME.equals(name) || "*".equals(name)) {
            return "";
        }
        return UNSAFE.matcher(name).replaceAll("_");
    }

    /**
     * Target for an ordinary category at a part: "ilib.data.dateformats" at root,
     * "ilib.data.dateformats_en_US" elsewhere.
     */
    public static String categoryTarget(String category, PartKey part) {
        String target = DATA_NAMESPACE + "." + toDataName(category);
        return part.isRoot() ? target : target + "_" + toDataName(part.getValue());
    }

    /**
     * Runtime key of a time zone: '-' becomes 'm' and '+' becomes 'p'.
     */
    public static String zoneKey(String zone) {
        return zone.replace('-', 'm').replace('+', 'p');
    }

    public static String zoneTarget(String zone) {
        return DATA_NAMESPACE + ".zoneinfo[\"" + zoneKey(zone) + "\"]";
    }
}
