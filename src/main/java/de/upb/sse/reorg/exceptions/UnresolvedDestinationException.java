package de.upb.sse.reorg.exceptions;

import de.upb.sse.reorg.ast.NodeId;
import lombok.Getter;

/**
 * Thrown when no destination module can be decided for an item, which means the
 * tree reached the resolver in a shape it does not support (typically the same
 * node id under two header modules).
 */
@Getter
public class UnresolvedDestinationException extends ReorganizationException {
    private final NodeId itemId;
    private final String moduleName;

    public UnresolvedDestinationException(NodeId itemId, String moduleName) {
        super("Could not resolve a destination module for " + itemId + " in module '" + moduleName + "'");
        this.itemId = itemId;
        this.moduleName = moduleName;
    }
}
