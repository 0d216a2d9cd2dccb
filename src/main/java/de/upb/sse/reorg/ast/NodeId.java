package de.upb.sse.reorg.ast;

/**
 * Stable identifier of a tree node. Ids survive cloning between passes, so two
 * values with the same id denote the same declaration.
 */
public final class NodeId implements Comparable<NodeId> {
    /** Placeholder used by path records whose destination is not known yet. */
    public static final NodeId DUMMY = new NodeId(Integer.MAX_VALUE);

    private final int value;

    private NodeId(int value) {
        this.value = value;
    }

    public static NodeId of(int value) {
        if (value < 0 || value == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid node id: " + value);
        }
        return new NodeId(value);
    }

    public int value() {
        return value;
    }

    public boolean isDummy() {
        return value == DUMMY.value;
    }

    @Override
    public int compareTo(NodeId o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((NodeId) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return isDummy() ? "NodeId(DUMMY)" : "NodeId(" + value + ")";
    }
}
