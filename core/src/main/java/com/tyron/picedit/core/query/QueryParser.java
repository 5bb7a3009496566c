package com.tyron.picedit.core.query;

import com.tyron.picedit.core.rules.NodeVocabulary;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recursive-descent parser for the query notation described on {@link Query}.
 * <p>
 * Grammar:
 * <pre>
 * query     := entry+
 * entry     := pattern | '(' pattern predicate* ')' capture*
 * pattern   := ( '(' type child* ')' | '[' pattern+ ']' | string | '_' ) capture*
 * child     := predicate | (field ':')? pattern
 * predicate := '(' '#' name capture string* ')'
 * </pre>
 * {@code ;} starts a comment that runs to the end of the line.
 */
final class QueryParser {

    private enum Kind { LPAREN, RPAREN, LBRACK, RBRACK, STRING, CAPTURE, PREDICATE, FIELD, IDENT, EOF }

    private record Token(Kind kind, String text, int offset) {
    }

    private final String source;
    private final NodeVocabulary vocabulary;
    private final List<Token> tokens;
    private int pos;
    private List<QueryPredicate> predicates;

    QueryParser(String source, NodeVocabulary vocabulary) {
        this.source = source;
        this.vocabulary = vocabulary;
        this.tokens = tokenize(source);
    }

    Query parse() {
        List<Query.Entry> entries = new ArrayList<>();
        while (peek().kind != Kind.EOF) {
            entries.add(parseEntry());
        }
        if (entries.isEmpty()) {
            throw error("Empty query", 0);
        }
        return new Query(source, entries);
    }

    private Query.Entry parseEntry() {
        predicates = new ArrayList<>();
        int start = peek().offset;
        QueryPattern pattern = parsePattern();

        Set<String> defined = new LinkedHashSet<>();
        Query.collectCaptures(pattern, defined);
        for (QueryPredicate predicate : predicates) {
            if (!defined.contains(predicate.capture())) {
                throw error("Predicate " + predicate + " refers to undefined capture @" + predicate.capture(), start);
            }
        }
        return new Query.Entry(pattern, predicates);
    }

    private QueryPattern parsePattern() {
        Token t = next();
        QueryPattern pattern;
        switch (t.kind) {
            case LPAREN -> pattern = parseParenthesized(t);
            case LBRACK -> {
                List<QueryPattern> alternatives = new ArrayList<>();
                while (peek().kind != Kind.RBRACK) {
                    if (peek().kind == Kind.EOF) {
                        throw error("Unclosed '['", t.offset);
                    }
                    alternatives.add(parsePattern());
                }
                next();
                if (alternatives.isEmpty()) {
                    throw error("Empty alternation", t.offset);
                }
                pattern = new QueryPattern.Alternation(alternatives, List.of());
            }
            case STRING -> {
                if (!vocabulary.isToken(t.text)) {
                    throw error("Unknown token \"" + t.text + "\"", t.offset);
                }
                pattern = new QueryPattern.LiteralPattern(t.text, List.of());
            }
            case IDENT -> {
                if (!"_".equals(t.text)) {
                    throw error("Bare identifier '" + t.text + "', expected a pattern", t.offset);
                }
                pattern = new QueryPattern.AnyPattern(List.of());
            }
            default -> throw error("Unexpected " + describe(t), t.offset);
        }
        return withCaptures(pattern, parseCaptures());
    }

    private QueryPattern parseParenthesized(Token open) {
        Token head = peek();
        if (head.kind == Kind.IDENT) {
            next();
            String type = "_".equals(head.text) ? null : head.text;
            if (type != null && !vocabulary.isNamedType(type)) {
                throw error("Unknown node type '" + type + "'", head.offset);
            }
            List<QueryPattern.Child> children = new ArrayList<>();
            while (peek().kind != Kind.RPAREN) {
                Token la = peek();
                if (la.kind == Kind.EOF) {
                    throw error("Unclosed '('", open.offset);
                }
                if (la.kind == Kind.LPAREN && peek(1).kind == Kind.PREDICATE) {
                    parsePredicate();
                } else if (la.kind == Kind.FIELD) {
                    next();
                    if (!vocabulary.isField(la.text)) {
                        throw error("Unknown field '" + la.text + "'", la.offset);
                    }
                    children.add(new QueryPattern.Child(la.text, parsePattern()));
                } else {
                    children.add(new QueryPattern.Child(null, parsePattern()));
                }
            }
            next();
            return new QueryPattern.NodePattern(type, children, List.of());
        }

        if (head.kind == Kind.LPAREN || head.kind == Kind.LBRACK || head.kind == Kind.STRING) {
            QueryPattern inner = parsePattern();
            while (peek().kind == Kind.LPAREN && peek(1).kind == Kind.PREDICATE) {
                parsePredicate();
            }
            Token close = next();
            if (close.kind != Kind.RPAREN) {
                throw error("Sibling sequences are not supported, found " + describe(close), close.offset);
            }
            return inner;
        }
        throw error("Expected a node type after '('", head.offset);
    }

    private void parsePredicate() {
        Token open = next();
        Token name = next();
        QueryPredicate.Kind kind = QueryPredicate.Kind.fromId(name.text);
        if (kind == null) {
            throw error("Unknown predicate #" + name.text, name.offset);
        }
        Token capture = next();
        if (capture.kind != Kind.CAPTURE) {
            throw error("Predicate #" + name.text + " expects a capture first", capture.offset);
        }
        List<String> values = new ArrayList<>();
        while (peek().kind == Kind.STRING) {
            values.add(next().text);
        }
        Token close = next();
        if (close.kind != Kind.RPAREN) {
            throw error("Predicate #" + name.text + " accepts only string arguments, found " + describe(close), close.offset);
        }

        Pattern regex = null;
        switch (kind) {
            case MATCH, NOT_MATCH -> {
                requireArity(kind, values, open);
                try {
                    regex = Pattern.compile(values.get(0));
                } catch (PatternSyntaxException e) {
                    throw new QuerySyntaxException("Malformed regex '" + values.get(0) + "'", source, open.offset, e);
                }
            }
            case EQ, NOT_EQ -> requireArity(kind, values, open);
            case ANY_OF -> {
                if (values.isEmpty()) {
                    throw error("#any-of? needs at least one value", open.offset);
                }
            }
        }
        predicates.add(new QueryPredicate(kind, capture.text, values, regex));
    }

    private void requireArity(QueryPredicate.Kind kind, List<String> values, Token at) {
        if (values.size() != 1) {
            throw error("#" + kind.id() + " takes exactly one string, got " + values.size(), at.offset);
        }
    }

    private List<String> parseCaptures() {
        List<String> captures = new ArrayList<>(1);
        while (peek().kind == Kind.CAPTURE) {
            captures.add(next().text);
        }
        return captures;
    }

    private static QueryPattern withCaptures(QueryPattern pattern, List<String> extra) {
        if (extra.isEmpty()) {
            return pattern;
        }
        List<String> all = new ArrayList<>(pattern.captures());
        all.addAll(extra);
        if (pattern instanceof QueryPattern.NodePattern p) {
            return new QueryPattern.NodePattern(p.type(), p.children(), all);
        } else if (pattern instanceof QueryPattern.LiteralPattern p) {
            return new QueryPattern.LiteralPattern(p.literal(), all);
        } else if (pattern instanceof QueryPattern.Alternation p) {
            return new QueryPattern.Alternation(p.alternatives(), all);
        }
        return new QueryPattern.AnyPattern(all);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind != Kind.EOF) {
            pos++;
        }
        return t;
    }

    private QuerySyntaxException error(String message, int offset) {
        return new QuerySyntaxException(message, source, offset);
    }

    private static String describe(Token t) {
        return t.kind == Kind.EOF ? "end of query" : "'" + t.text + "'";
    }

    private List<Token> tokenize(String s) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                while (i < s.length() && s.charAt(i) != '\n') i++;
            } else if (c == '(') {
                out.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                out.add(new Token(Kind.RPAREN, ")", i++));
            } else if (c == '[') {
                out.add(new Token(Kind.LBRACK, "[", i++));
            } else if (c == ']') {
                out.add(new Token(Kind.RBRACK, "]", i++));
            } else if (c == '"') {
                int start = i++;
                StringBuilder sb = new StringBuilder();
                while (true) {
                    if (i >= s.length()) {
                        throw error("Unterminated string", start);
                    }
                    char ch = s.charAt(i++);
                    if (ch == '"') break;
                    if (ch == '\\' && i < s.length()) {
                        char esc = s.charAt(i++);
                        switch (esc) {
                            case '"' -> sb.append('"');
                            case '\\' -> sb.append('\\');
                            case 'n' -> sb.append('\n');
                            case 't' -> sb.append('\t');
                            // regex escapes such as \d or \. pass through untouched
                            default -> sb.append('\\').append(esc);
                        }
                    } else {
                        sb.append(ch);
                    }
                }
                out.add(new Token(Kind.STRING, sb.toString(), start));
            } else if (c == '@' || c == '#') {
                int start = i++;
                int end = scanIdentifier(s, i);
                if (end == i) {
                    throw error("Expected a name after '" + c + "'", start);
                }
                out.add(new Token(c == '@' ? Kind.CAPTURE : Kind.PREDICATE, s.substring(i, end), start));
                i = end;
            } else if (isIdentifierChar(c)) {
                int start = i;
                int end = scanIdentifier(s, i);
                String text = s.substring(start, end);
                if (end < s.length() && s.charAt(end) == ':') {
                    out.add(new Token(Kind.FIELD, text, start));
                    i = end + 1;
                } else {
                    out.add(new Token(Kind.IDENT, text, start));
                    i = end;
                }
            } else {
                throw error("Unexpected character '" + c + "'", i);
            }
        }
        out.add(new Token(Kind.EOF, "", s.length()));
        return out;
    }

    private static int scanIdentifier(String s, int from) {
        int i = from;
        while (i < s.length() && (isIdentifierChar(s.charAt(i)) || s.charAt(i) == '?')) {
            i++;
        }
        return i;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
