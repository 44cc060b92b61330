package com.etl.migration.kettlegraph.dto.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A database connection declared at the top level of a document.
 */
@Value
@Builder
@Jacksonized
public class DatabaseConnectionInfo {
    String name;
    String type;
    String server;
    String database;
    String port;
    String username;
}
