package com.tyron.picedit.core.query;

import com.tyron.picedit.core.rules.RuleTableException;

/**
 * A query string that cannot be compiled: bad syntax, an unknown node type or field, an
 * undefined capture or a malformed regular expression.
 */
public class QuerySyntaxException extends RuleTableException {

    private final int offset;

    public QuerySyntaxException(String message, String query, int offset) {
        super(message + " at offset " + offset + " in " + query);
        this.offset = offset;
    }

    public QuerySyntaxException(String message, String query, int offset, Throwable cause) {
        super(message + " at offset " + offset + " in " + query, cause);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
