package de.upb.sse.reorg.command;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.Nodes;

/**
 * State shared by the commands of one invocation. Hands out node ids that are
 * unique for the lifetime of the invocation.
 */
public class CommandState {
    private int nextId;

    public CommandState(int firstFreeId) {
        if (firstFreeId < 0) {
            throw new IllegalArgumentException("firstFreeId must not be negative: " + firstFreeId);
        }
        this.nextId = firstFreeId;
    }

    /** State whose ids start right after the largest id already present in {@code krate}. */
    public static CommandState forCrate(Crate krate) {
        return new CommandState(Nodes.maxNodeId(krate) + 1);
    }

    public NodeId nextNodeId() {
        return NodeId.of(nextId++);
    }

    public int peekNextId() {
        return nextId;
    }
}
