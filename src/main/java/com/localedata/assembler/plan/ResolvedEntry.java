package com.localedata.assembler.plan;

import com.localedata.assembler.model.PartKey;

import lombok.NonNull;
import lombok.Value;

/**
 * A plan entry together with the part it belongs to.
 */
@Value
public class ResolvedEntry {

    @NonNull
    PartKey part;

    @NonNull
    PlanEntry entry;
}
