package com.twbconvert.assumption;

/** Which stage of a conversion produced an assumption. Declared in pipeline order. */
public enum AssumptionCategory {
    EXTRACTION,
    PARSING,
    TRANSLATION,
    RELATIONSHIP,
    MODEL,
    REPORT
}
