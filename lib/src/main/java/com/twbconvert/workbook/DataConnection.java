package com.twbconvert.workbook;

import java.util.Objects;

/** The physical connection behind a datasource, as far as the workbook describes it. */
public final class DataConnection {
    private final String connectionClass;
    private final String filename;
    private final String server;
    private final String database;

    public DataConnection(String connectionClass, String filename, String server, String database) {
        this.connectionClass = Objects.requireNonNull(connectionClass, "connectionClass");
        this.filename = filename;
        this.server = server;
        this.database = database;
    }

    public static DataConnection unknown() {
        return new DataConnection("", null, null, null);
    }

    public String getConnectionClass() {
        return connectionClass;
    }

    public String getFilename() {
        return filename;
    }

    public String getServer() {
        return server;
    }

    public String getDatabase() {
        return database;
    }
}
