package de.upb.sse.reorg.command;

import de.upb.sse.reorg.ast.Crate;

/**
 * A whole-crate rewrite exposed as a command.
 */
public interface Transform {
    /** Returns the rewritten crate. The input crate is never modified. */
    Crate transform(Crate krate, CommandState st, Session session);

    /** Earliest phase the transform may run in. */
    default Phase minPhase() {
        return Phase.PHASE1;
    }
}
