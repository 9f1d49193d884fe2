package com.bidscope.storage;

import java.util.List;

/**
 * A configured relation does not expose the columns the engines rely on.
 */
public class SchemaMismatchException extends RuntimeException {

    private final String relation;
    private final List<String> missingColumns;

    public SchemaMismatchException(String relation, List<String> missingColumns) {
        super("Relation is missing required columns");
        this.relation = relation;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getRelation() {
        return relation;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Relation: " + relation + "] [Missing: " + missingColumns + "]";
    }
}
