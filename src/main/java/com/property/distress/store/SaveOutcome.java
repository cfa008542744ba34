package com.property.distress.store;

/**
 * What saving a score did to the history.
 */
public enum SaveOutcome {
    /** A new historical row was added. */
    INSERTED,
    /** Today's row was overwritten. */
    UPDATED,
    /** The score equals the latest stored one; nothing was written. */
    UNCHANGED
}
