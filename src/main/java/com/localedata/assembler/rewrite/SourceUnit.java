package com.localedata.assembler.rewrite;

import lombok.NonNull;
import lombok.Value;

/**
 * One source file handed over by the host build.
 */
@Value
public class SourceUnit {

    @NonNull
    String name;

    @NonNull
    String text;
}
