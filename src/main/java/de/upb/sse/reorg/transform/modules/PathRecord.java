package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.SimplePath;

/**
 * Where an import points after the move. Created during discovery with a
 * placeholder destination and patched in place once the module named in the
 * path has been resolved. The path is kept without {@code self}/{@code super}
 * so records can be matched against module names.
 */
public final class PathRecord {
    private SimplePath path;
    private NodeId destination = NodeId.DUMMY;

    PathRecord(SimplePath path) {
        this.path = path;
    }

    public SimplePath getPath() {
        return path;
    }

    public NodeId getDestination() {
        return destination;
    }

    public boolean isPatched() {
        return !destination.isDummy();
    }

    /**
     * Replaces {@code oldModule} in the path by the destination name.
     *
     * @return true if the path mentioned {@code oldModule}
     */
    boolean patch(String oldModule, Destination dest) {
        if (!path.contains(oldModule)) {
            return false;
        }
        path = path.replaceSegment(oldModule, dest.getName());
        destination = dest.getId();
        return true;
    }

    @Override
    public String toString() {
        return path + " -> " + destination;
    }
}
