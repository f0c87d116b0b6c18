package com.twbconvert.workbook;

import java.util.Objects;

/** A field bound to a mark property (color, size, label, detail, tooltip, text). */
public final class Encoding {
    private final String channel;
    private final FieldUsage usage;

    public Encoding(String channel, FieldUsage usage) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.usage = Objects.requireNonNull(usage, "usage");
    }

    public String getChannel() {
        return channel;
    }

    public FieldUsage getUsage() {
        return usage;
    }
}
