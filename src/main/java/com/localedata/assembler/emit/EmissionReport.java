package com.localedata.assembler.emit;

import java.nio.file.Path;
import java.util.List;

import com.localedata.assembler.model.PartKey;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one emission attempt.
 */
@Value
@Builder
public class EmissionReport {

    /**
     * Every planned part name followed by the manifest pseudo-entry; the list
     * loader code is generated from.
     */
    @Singular
    List<String> manifestEntries;

    /**
     * Parts physically written by this attempt; empty on repeated attempts.
     */
    @Singular
    List<PartKey> writtenParts;

    Path manifestPath;
}
