package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@code ::}-separated path such as {@code self::buffer_h::buffer_t}.
 */
public final class SimplePath {
    public static final String SEPARATOR = "::";

    private final List<String> segments;

    private SimplePath(List<String> segments) {
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public static SimplePath of(String... segments) {
        return new SimplePath(Arrays.asList(segments));
    }

    public static SimplePath of(List<String> segments) {
        return new SimplePath(segments);
    }

    public static SimplePath empty() {
        return new SimplePath(Collections.emptyList());
    }

    /**
     * Parses {@code a::b::c}. A blank string yields the empty path.
     */
    public static SimplePath parse(String text) {
        if (text == null || text.isBlank()) {
            return empty();
        }
        List<String> segments = Arrays.stream(text.split(SEPARATOR))
                .map(String::trim)
                .collect(Collectors.toList());
        for (String s : segments) {
            if (s.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in path: " + text);
            }
        }
        return new SimplePath(segments);
    }

    public List<String> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public String first() {
        return segments.get(0);
    }

    public String last() {
        return segments.get(segments.size() - 1);
    }

    /** The path without its final segment. */
    public SimplePath parent() {
        if (segments.isEmpty()) {
            return this;
        }
        return new SimplePath(segments.subList(0, segments.size() - 1));
    }

    public SimplePath append(String segment) {
        List<String> copy = new ArrayList<>(segments);
        copy.add(segment);
        return new SimplePath(copy);
    }

    public boolean contains(String segment) {
        return segments.contains(segment);
    }

    /**
     * Drops relative segments like {@code self} and {@code super}. Single-segment
     * paths are returned unchanged so that {@code use self;} keeps its meaning.
     */
    public SimplePath withoutSegments(Collection<String> relative) {
        if (segments.size() <= 1) {
            return this;
        }
        List<String> kept = segments.stream()
                .filter(s -> !relative.contains(s))
                .collect(Collectors.toList());
        return new SimplePath(kept);
    }

    /** Replaces every segment equal to {@code from} by {@code to}. */
    public SimplePath replaceSegment(String from, String to) {
        List<String> copy = new ArrayList<>(segments.size());
        for (String s : segments) {
            copy.add(s.equals(from) ? to : s);
        }
        return new SimplePath(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return segments.equals(((SimplePath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
