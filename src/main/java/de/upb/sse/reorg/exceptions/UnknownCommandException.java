package de.upb.sse.reorg.exceptions;

import java.util.Collection;

public class UnknownCommandException extends ReorganizationException {
    public UnknownCommandException(String name, Collection<String> known) {
        super("Unknown command '" + name + "', known commands: " + known);
    }
}
