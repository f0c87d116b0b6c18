package com.twbconvert.relationship;

public enum CrossFilterDirection {
    /** Filters flow from the one side to the many side only. */
    SINGLE,
    BOTH
}
