package com.tyron.picedit.core.highlight;

import com.tyron.picedit.core.query.Query;
import com.tyron.picedit.core.rules.NodeVocabulary;
import com.tyron.picedit.core.rules.RuleTableException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered highlight rules grouped into features and levels.
 * <p>
 * Features are ordered by level; within a level they keep their declaration order, and
 * rules keep their order within a feature. That order decides which rule paints first.
 * <p>
 * The {@value #ERROR_FEATURE} feature is always evaluated when any level is enabled and is
 * painted after everything else, so it must be declared with {@code override}.
 */
public final class HighlightRuleTable {

    public static final String ERROR_FEATURE = "error";

    private final List<HighlightFeature> features;
    private final List<HighlightRule> rules;

    private HighlightRuleTable(List<HighlightFeature> features) {
        List<HighlightFeature> sorted = new ArrayList<>(features);
        // stable: declaration order is kept within a level
        sorted.sort(Comparator.comparingInt(HighlightFeature::level));
        this.features = List.copyOf(sorted);

        List<HighlightRule> all = new ArrayList<>();
        for (HighlightFeature f : this.features) {
            all.addAll(f.rules());
        }
        this.rules = List.copyOf(all);
    }

    public static Builder builder(@NotNull NodeVocabulary vocabulary) {
        return new Builder(vocabulary);
    }

    public List<HighlightFeature> getFeatures() {
        return features;
    }

    /**
     * @return every rule in evaluation order.
     */
    public List<HighlightRule> getRules() {
        return rules;
    }

    public HighlightFeature getFeature(String name) {
        for (HighlightFeature f : features) {
            if (f.name().equals(name)) {
                return f;
            }
        }
        return null;
    }

    public static final class Builder {

        private final NodeVocabulary vocabulary;
        private final List<HighlightFeature> features = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder(NodeVocabulary vocabulary) {
            this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        }

        /**
         * Declares a feature; each query string becomes one rule.
         *
         * @throws RuleTableException on a duplicate feature, a bad level, a non-override
         *                            error feature or a query that does not compile
         */
        public Builder feature(String name, int level, boolean override, String... queries) {
            return feature(name, level, override, List.of(queries));
        }

        public Builder feature(String name, int level, boolean override, List<String> queries) {
            if (name == null || name.isBlank()) {
                throw new RuleTableException("Feature name must not be blank");
            }
            if (!names.add(name)) {
                throw new RuleTableException("Duplicate feature '" + name + "'");
            }
            if (level < HighlightLevels.MIN_LEVEL || level > HighlightLevels.MAX_LEVEL) {
                throw new RuleTableException("Feature '" + name + "' has level " + level + " outside ["
                        + HighlightLevels.MIN_LEVEL + ", " + HighlightLevels.MAX_LEVEL + "]");
            }
            if (ERROR_FEATURE.equals(name) && !override) {
                throw new RuleTableException("Feature '" + ERROR_FEATURE + "' must be declared with override");
            }
            if (queries.isEmpty()) {
                throw new RuleTableException("Feature '" + name + "' has no queries");
            }

            List<HighlightRule> rules = new ArrayList<>(queries.size());
            for (String q : queries) {
                Query query;
                try {
                    query = Query.compile(q, vocabulary);
                } catch (RuleTableException e) {
                    throw new RuleTableException("Feature '" + name + "': " + e.getMessage(), e);
                }
                rules.add(new HighlightRule(name, level, query, override));
            }
            features.add(new HighlightFeature(name, level, override, rules));
            return this;
        }

        public HighlightRuleTable build() {
            return new HighlightRuleTable(features);
        }
    }
}
