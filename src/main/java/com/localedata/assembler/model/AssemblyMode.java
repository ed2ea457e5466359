package com.localedata.assembler.model;

/**
 * How emitted locale parts take effect at runtime.
 */
public enum AssemblyMode {
    /**
     * Parts are plain modules that merge their data as soon as they are loaded.
     */
    ASSEMBLED,

    /**
     * Parts expose a deferred installer; both code and data are loaded on demand.
     */
    DYNAMIC,

    /**
     * Parts expose a deferred installer; code is bundled, only data is loaded on demand.
     */
    DYNAMICDATA;

    public boolean isDeferred() {
        return this != ASSEMBLED;
    }

    public boolean defersCode() {
        return this == DYNAMIC;
    }
}
