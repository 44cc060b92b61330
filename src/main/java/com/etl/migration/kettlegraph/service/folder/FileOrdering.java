package com.etl.migration.kettlegraph.service.folder;

/**
 * Order of the files in a folder graph, independent of which worker finished first.
 */
public enum FileOrdering {
    BY_FILE_NAME,
    AS_SUPPLIED
}
