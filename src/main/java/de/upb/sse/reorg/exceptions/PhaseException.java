package de.upb.sse.reorg.exceptions;

import de.upb.sse.reorg.command.Phase;

public class PhaseException extends ReorganizationException {
    public PhaseException(String command, Phase required, Phase actual) {
        super("Command '" + command + "' requires " + required + " but the driver is in " + actual);
    }
}
