package io.stageflow.core.element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Parsed property path addressing a value inside a tree-shaped record.
///
/// Segments are joined by `.`; any segment may carry one or more bracket
/// suffixes. A bracket holding digits addresses a list index, anything else
/// (optionally quoted with `"` or `'`) addresses a map key:
///
/// {@snippet :
/// PropertyPath.parse("user.profile.name");
/// PropertyPath.parse("items[0].price");
/// PropertyPath.parse("headers[\"content.type\"]");
/// }
///
/// ### Contracts
/// - **Precondition**: the expression is non-blank and bracket-balanced
/// - **Postcondition**: {@link #resolve(Object)} never throws
///
/// @implNote Immutable and thread-safe after construction.
public final class PropertyPath {

    private final String expression;
    private final List<Segment> segments;

    private PropertyPath(String expression, List<Segment> segments) {
        this.expression = expression;
        this.segments = Collections.unmodifiableList(segments);
    }

    /// Parses a path expression.
    ///
    /// @param expression dotted/bracketed path, not null
    /// @return parsed path, never null
    /// @throws IllegalArgumentException if the expression is blank or malformed
    public static PropertyPath parse(String expression) {
        Objects.requireNonNull(expression, "Property path required");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("Property path cannot be empty");
        }
        return new PropertyPath(expression, Parser.parse(expression));
    }

    /// Parses a path expression, returning empty instead of failing.
    ///
    /// @param expression path expression, may be null
    /// @return parsed path, or empty if the expression is null or malformed
    public static Optional<PropertyPath> tryParse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(expression));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /// Walks the path from left to right starting at `root`.
    ///
    /// @param root the record to resolve against, may be null
    /// @return the lookup outcome, never null
    public PropertyLookup resolve(Object root) {
        Object current = root;
        for (Segment segment : segments) {
            if (current == null) {
                return PropertyLookup.notFound();
            }
            PropertyLookup step = segment.step(current);
            if (!step.found()) {
                return step;
            }
            current = step.value();
        }
        return PropertyLookup.of(current);
    }

    /// Returns the original expression.
    ///
    /// @return path expression, never null
    public String getExpression() {
        return expression;
    }

    /// Returns the parsed segments in walk order.
    ///
    /// @return unmodifiable segment list, never empty
    public List<Segment> getSegments() {
        return segments;
    }

    /// Returns the first segment's key, the top-level field this path reads.
    ///
    /// @return root key, never null
    public String getRootKey() {
        return segments.get(0).key();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyPath that)) return false;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }

    /// One step of a property path: either a map key or a list index.
    ///
    /// @param key map key, or the decimal text of the index for index segments
    /// @param index list index, or `-1` for key segments
    public record Segment(String key, int index) {

        static Segment key(String key) {
            return new Segment(key, -1);
        }

        static Segment index(int index) {
            return new Segment(String.valueOf(index), index);
        }

        /// Checks whether this segment addresses a list position.
        ///
        /// @return true for index segments
        public boolean isIndex() {
            return index >= 0;
        }

        PropertyLookup step(Object current) {
            if (isIndex() && current instanceof List<?> list) {
                return index < list.size() ? PropertyLookup.of(list.get(index)) : PropertyLookup.notFound();
            }
            if (current instanceof Map<?, ?> map) {
                return map.containsKey(key) ? PropertyLookup.of(map.get(key)) : PropertyLookup.notFound();
            }
            return PropertyLookup.notFound();
        }
    }

    private static final class Parser {

        private final String text;
        private final List<Segment> segments = new ArrayList<>();
        private final StringBuilder buffer = new StringBuilder();
        private int pos;

        private Parser(String text) {
            this.text = text;
        }

        static List<Segment> parse(String text) {
            Parser parser = new Parser(text);
            parser.run();
            return parser.segments;
        }

        private void run() {
            boolean afterBracket = false;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '.') {
                    if (buffer.length() == 0 && !afterBracket) {
                        throw malformed("empty segment");
                    }
                    flushKey();
                    afterBracket = false;
                    pos++;
                    if (pos == text.length()) {
                        throw malformed("trailing '.'");
                    }
                } else if (c == '[') {
                    flushKey();
                    readBracket();
                    afterBracket = true;
                } else if (c == ']') {
                    throw malformed("unbalanced ']'");
                } else {
                    if (afterBracket) {
                        throw malformed("expected '.' or '[' after ']'");
                    }
                    buffer.append(c);
                    pos++;
                }
            }
            flushKey();
            if (segments.isEmpty()) {
                throw malformed("no segments");
            }
        }

        private void flushKey() {
            if (buffer.length() > 0) {
                segments.add(Segment.key(buffer.toString()));
                buffer.setLength(0);
            }
        }

        private void readBracket() {
            if (segments.isEmpty()) {
                throw malformed("path cannot start with '['");
            }
            pos++; // skip '['
            if (pos >= text.length()) {
                throw malformed("unclosed '['");
            }
            char first = text.charAt(pos);
            if (first == '"' || first == '\'') {
                int close = text.indexOf(first, pos + 1);
                if (close < 0 || close + 1 >= text.length() || text.charAt(close + 1) != ']') {
                    throw malformed("unterminated quoted key");
                }
                segments.add(Segment.key(text.substring(pos + 1, close)));
                pos = close + 2;
                return;
            }
            int close = text.indexOf(']', pos);
            if (close < 0) {
                throw malformed("unclosed '['");
            }
            String content = text.substring(pos, close).trim();
            if (content.isEmpty()) {
                throw malformed("empty brackets");
            }
            segments.add(isDigits(content) ? toIndex(content) : Segment.key(content));
            pos = close + 1;
        }

        private Segment toIndex(String digits) {
            try {
                return Segment.index(Integer.parseInt(digits));
            } catch (NumberFormatException e) {
                throw malformed("index out of range: " + digits);
            }
        }

        private static boolean isDigits(String s) {
            for (int i = 0; i < s.length(); i++) {
                if (!Character.isDigit(s.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        private IllegalArgumentException malformed(String reason) {
            return new IllegalArgumentException(
                    "Invalid property path '" + text + "': " + reason);
        }
    }
}
