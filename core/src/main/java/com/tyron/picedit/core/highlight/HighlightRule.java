package com.tyron.picedit.core.highlight;

import com.tyron.picedit.core.query.Query;

import java.util.Objects;

/**
 * One query of a highlight feature. Each non-internal capture of a match paints the
 * captured node with the capture name as category.
 *
 * @param override when true the rule repaints characters already painted by earlier rules;
 *                 otherwise it only fills characters nothing has painted yet
 */
public record HighlightRule(String feature, int level, Query query, boolean override) {

    public HighlightRule {
        Objects.requireNonNull(feature, "feature");
        Objects.requireNonNull(query, "query");
        HighlightLevels.checkLevel(level);
    }
}
