package com.hrplatform.domain.model;

/**
 * What to emit for a sensitive field the caller may not see in full.
 */
public enum ProcessingMode {
    /** Emit a partially redacted value. */
    MASK,
    /** Drop the field from the outgoing record. */
    OMIT
}
