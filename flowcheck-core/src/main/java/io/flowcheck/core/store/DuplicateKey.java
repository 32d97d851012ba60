package io.flowcheck.core.store;

/// A primary key value that occurs more than once in a table.
///
/// @param table table name, not null
/// @param id the duplicated key, not null
/// @param occurrences number of rows sharing the key, greater than one
public record DuplicateKey(String table, String id, int occurrences) {}
