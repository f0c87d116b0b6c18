package com.twbconvert;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 1;
    static final int PATCH = 0;
    private static final String QUALIFIER = "beta";

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH + "-" + QUALIFIER;
    public static final String GENERATOR = "twbconvert " + FULL;

    private Version() {}
}
