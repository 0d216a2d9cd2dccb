package de.upb.sse.reorg;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.command.CommandState;
import de.upb.sse.reorg.command.Registry;
import de.upb.sse.reorg.command.Session;
import de.upb.sse.reorg.command.Transform;
import de.upb.sse.reorg.configuration.ReorganizerConfiguration;
import de.upb.sse.reorg.exceptions.PhaseException;
import de.upb.sse.reorg.stats.ReorganizationStats;
import de.upb.sse.reorg.transform.modules.ReorganizeModules;
import lombok.Getter;

import java.util.logging.Logger;

/**
 * Entry point: owns the configuration, the command registry and the
 * statistics of the last run. Stage dumps can also be switched on with
 * {@code -Dreorg.dumpStages=true}.
 */
public class Reorganizer {
    private static final Logger logger = Logger.getLogger(Reorganizer.class.getName());

    @Getter private final ReorganizerConfiguration config;
    @Getter private final ReorganizationStats stats = new ReorganizationStats();
    @Getter private final Registry registry = new Registry();

    public Reorganizer() {
        this(new ReorganizerConfiguration());
    }

    public Reorganizer(ReorganizerConfiguration config) {
        this.config = config;
        ReorganizeModules.registerCommands(registry, config, stats);
    }

    /** Runs {@value ReorganizeModules#COMMAND_NAME} on {@code krate}. */
    public Crate reorganize(Crate krate, Session session) {
        return run(ReorganizeModules.COMMAND_NAME, krate, session);
    }

    /**
     * Runs the named command. Ids for new nodes start after the largest id in
     * {@code krate}.
     *
     * @throws de.upb.sse.reorg.exceptions.UnknownCommandException if no such command is registered
     * @throws PhaseException if the session is in an earlier phase than the command needs
     */
    public Crate run(String command, Crate krate, Session session) {
        Transform transform = registry.get(command);
        if (!session.getPhase().isAtLeast(transform.minPhase())) {
            throw new PhaseException(command, transform.minPhase(), session.getPhase());
        }
        logger.info(">> Running " + command);
        return transform.transform(krate, CommandState.forCrate(krate), session);
    }
}
