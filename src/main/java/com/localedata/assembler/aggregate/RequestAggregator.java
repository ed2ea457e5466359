package com.localedata.assembler.aggregate;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.model.CategoryToken;

/**
 * Build-wide set of requested categories.
 *
 * Grows only; safe for concurrent recording from any number of units. The
 * snapshot is sorted so that its content and iteration order do not depend
 * on the order in which units were processed.
 */
public class RequestAggregator {
    private static final Logger log = LoggerFactory.getLogger(RequestAggregator.class);

    private final Set<CategoryToken> requests = ConcurrentHashMap.newKeySet();
    private final boolean debug;

    public RequestAggregator() {
        this(false);
    }

    public RequestAggregator(boolean debug) {
        this.debug = debug;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Records a category name. Blank names are ignored.
     *
     * @return true if the category was not requested before
     */
    public boolean record(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        return record(CategoryToken.of(name));
    }

    public boolean record(CategoryToken token) {
        boolean added = requests.add(token);
        if (added && debug) {
            log.info("Recorded category {} ({})", token, token.getKind());
        } else if (added) {
            log.debug("Recorded category {} ({})", token, token.getKind());
        }
        return added;
    }

    public SortedSet<CategoryToken> snapshot() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(requests));
    }

    public int size() {
        return requests.size();
    }
}
