package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Crate;

/**
 * One pass of the reorganization. Stages run in a fixed order; each sees the
 * complete output of the previous one.
 */
interface ReorganizeStage {
    String name();

    Crate apply(Crate krate, ReorganizeContext cx);
}
