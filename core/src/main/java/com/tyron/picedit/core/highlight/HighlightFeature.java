package com.tyron.picedit.core.highlight;

import java.util.List;

/**
 * A named group of rules enabled together at one activation level.
 */
public record HighlightFeature(String name, int level, boolean override, List<HighlightRule> rules) {

    public HighlightFeature {
        rules = List.copyOf(rules);
    }

    public boolean isError() {
        return HighlightRuleTable.ERROR_FEATURE.equals(name);
    }
}
