package de.upb.sse.reorg.ast;

import lombok.Value;

import java.util.Optional;

/**
 * An outer attribute such as {@code #[header_src = "/usr/include/stdio.h"]}.
 * The value is null for bare attributes like {@code #[inline]}.
 */
@Value
public class Attribute {
    String name;
    String value;

    public static Attribute of(String name) {
        return new Attribute(name, null);
    }

    public static Attribute of(String name, String value) {
        return new Attribute(name, value);
    }

    public Optional<String> valueString() {
        return Optional.ofNullable(value);
    }
}
