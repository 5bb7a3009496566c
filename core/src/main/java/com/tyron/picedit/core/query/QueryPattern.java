package com.tyron.picedit.core.query;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Structural part of a query: what a node and, transitively, its children must look like.
 * Every pattern may bind the node it matched to one or more capture names.
 */
public interface QueryPattern {

    List<String> captures();

    /**
     * {@code (type child...)}; a null type is the {@code (_)} wildcard for any named node.
     * The type {@code ERROR} matches every error node.
     */
    record NodePattern(@Nullable String type, List<Child> children, List<String> captures) implements QueryPattern {

        public NodePattern {
            children = List.copyOf(children);
            captures = List.copyOf(captures);
        }
    }

    /**
     * {@code "literal"}: an anonymous token whose type is the literal text.
     */
    record LiteralPattern(String literal, List<String> captures) implements QueryPattern {

        public LiteralPattern {
            captures = List.copyOf(captures);
        }
    }

    /**
     * {@code _}: any node, named or not.
     */
    record AnyPattern(List<String> captures) implements QueryPattern {

        public AnyPattern {
            captures = List.copyOf(captures);
        }
    }

    /**
     * {@code [a b c]}: the first alternative that matches.
     */
    record Alternation(List<QueryPattern> alternatives, List<String> captures) implements QueryPattern {

        public Alternation {
            alternatives = List.copyOf(alternatives);
            captures = List.copyOf(captures);
        }
    }

    /**
     * A child pattern, optionally constrained to a field of the parent.
     */
    record Child(@Nullable String field, QueryPattern pattern) {
    }
}
