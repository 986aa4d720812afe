package com.dbbridge.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters used to open a native connection. For SQLite {@code host} is the database file path.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionParams {
    String host;
    Integer port;
    String user;
    String password;
    String database;

    public ConnectionParams withDatabase(String database) {
        return toBuilder().database(database).build();
    }

    @Override
    public String toString() {
        // password omitted
        return "ConnectionParams(host=" + host + ", port=" + port + ", user=" + user + ", database=" + database + ")";
    }
}
