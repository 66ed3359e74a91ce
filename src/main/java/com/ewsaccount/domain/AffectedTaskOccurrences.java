package com.ewsaccount.domain;

/**
 * Scope of a delete on a recurring task
 */
public enum AffectedTaskOccurrences {
    ALL_OCCURRENCES,
    SPECIFIED_OCCURRENCE_ONLY
}
