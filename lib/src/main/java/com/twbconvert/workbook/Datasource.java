package com.twbconvert.workbook;

import java.util.Objects;

public final class Datasource {
    private final String name;
    private final String caption;
    private final DataConnection connection;

    public Datasource(String name, String caption, DataConnection connection) {
        this.name = Objects.requireNonNull(name, "name");
        this.caption = caption == null || caption.isBlank() ? name : caption;
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public String getName() {
        return name;
    }

    public String getCaption() {
        return caption;
    }

    public DataConnection getConnection() {
        return connection;
    }
}
