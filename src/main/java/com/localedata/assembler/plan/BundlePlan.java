package com.localedata.assembler.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.localedata.assembler.model.PartKey;

/**
 * Part key to ordered entries. An entry key is stored at most once per part;
 * parts only exist once they hold at least one entry.
 */
public class BundlePlan {

    private final Map<PartKey, Map<String, PlanEntry>> parts = new LinkedHashMap<>();

    /**
     * Adds the entry unless the part already holds one with the same key.
     *
     * @return true if the entry was added
     */
    public boolean addIfAbsent(PartKey part, PlanEntry entry) {
        Map<String, PlanEntry> entries = parts.computeIfAbsent(part, p -> new LinkedHashMap<>());
        return entries.putIfAbsent(entry.getKey(), entry) == null;
    }

    public boolean addIfAbsent(ResolvedEntry resolved) {
        return addIfAbsent(resolved.getPart(), resolved.getEntry());
    }

    public boolean contains(PartKey part, String key) {
        Map<String, PlanEntry> entries = parts.get(part);
        return entries != null && entries.containsKey(key);
    }

    public List<PartKey> getParts() {
        return List.copyOf(parts.keySet());
    }

    public List<PlanEntry> getEntries(PartKey part) {
        Map<String, PlanEntry> entries = parts.get(part);
        return entries == null ? Collections.emptyList() : List.copyOf(entries.values());
    }

    public int getEntryCount() {
        return parts.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    /**
     * Part names in planning order, the form used for artifact names and the manifest.
     */
    public List<String> getPartNames() {
        List<String> names = new ArrayList<>(parts.size());
        parts.keySet().forEach(p -> names.add(p.getValue()));
        return names;
    }
}
