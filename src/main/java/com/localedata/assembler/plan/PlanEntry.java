package com.localedata.assembler.plan;

import java.nio.file.Path;

import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.DataDocument;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One resolved payload destined for a part artifact.
 */
@Value
@Builder(toBuilder = true)
public class PlanEntry {

    /**
     * Key unique within a part, e.g. "dateformats", "zoneinfo/America/New_York", "nfc/Latn".
     */
    @NonNull
    String key;

    @NonNull
    CategoryToken category;

    /**
     * Runtime expression the payload is applied to, e.g. "ilib.data.dateformats_en".
     */
    @NonNull
    String target;

    @NonNull
    @Builder.Default
    EntryKind kind = EntryKind.ASSIGN;

    @NonNull
    DataDocument payload;

    Path source;
}
