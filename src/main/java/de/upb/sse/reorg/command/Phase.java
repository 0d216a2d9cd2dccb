package de.upb.sse.reorg.command;

/**
 * Compiler phases the driver can be in when a command runs. Later phases
 * have more information available on the tree.
 */
public enum Phase {
    /** Parsed and macro-expanded. */
    PHASE1,
    /** Names resolved. */
    PHASE2,
    /** Type-checked. */
    PHASE3;

    public boolean isAtLeast(Phase other) {
        return compareTo(other) >= 0;
    }
}
