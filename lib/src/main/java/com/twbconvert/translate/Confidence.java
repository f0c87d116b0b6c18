package com.twbconvert.translate;

public enum Confidence {
    /** Every node had a rule with the same semantics in DAX. */
    EXACT,
    /** At least one node was approximated; each approximation is listed as an assumption. */
    CLOSEST_MATCH
}
