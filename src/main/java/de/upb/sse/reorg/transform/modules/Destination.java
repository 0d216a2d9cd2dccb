package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.NodeId;
import lombok.Value;

/** A destination module: its id and the name paths should use for it. */
@Value
public class Destination {
    NodeId id;
    String name;
}
