package com.localedata.assembler.plan;

/**
 * How a planned payload is applied to the runtime data namespace.
 */
public enum EntryKind {
    /** The payload replaces the target expression. */
    ASSIGN,
    /** The payload is merged into the existing target object. */
    EXTEND
}
