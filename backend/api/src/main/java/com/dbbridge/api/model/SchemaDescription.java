package com.dbbridge.api.model;

/**
 * Schema text together with the backend it was read from, captured in one pass over the connection.
 */
public record SchemaDescription(String backend, String schema) {
}
