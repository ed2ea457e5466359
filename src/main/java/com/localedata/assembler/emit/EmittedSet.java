package com.localedata.assembler.emit;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.localedata.assembler.model.PartKey;

/**
 * Parts already written in the current build, plus whether the manifest was written.
 */
public class EmittedSet {

    private final Set<PartKey> parts = ConcurrentHashMap.newKeySet();
    private volatile boolean manifestWritten;

    public boolean isEmitted(PartKey part) {
        return parts.contains(part);
    }

    void markEmitted(PartKey part) {
        parts.add(part);
    }

    public boolean isManifestWritten() {
        return manifestWritten;
    }

    void markManifestWritten() {
        manifestWritten = true;
    }

    public int size() {
        return parts.size();
    }
}
