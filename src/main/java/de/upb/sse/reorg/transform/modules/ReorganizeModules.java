package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.ItemPrinter;
import de.upb.sse.reorg.command.CommandState;
import de.upb.sse.reorg.command.Phase;
import de.upb.sse.reorg.command.Registry;
import de.upb.sse.reorg.command.Session;
import de.upb.sse.reorg.command.Transform;
import de.upb.sse.reorg.configuration.ReorganizerConfiguration;
import de.upb.sse.reorg.stats.ReorganizationStats;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reorganizes the definitions of a translated project.
 *
 * <p>The translator wraps everything it pulls in from a header into a module
 * named after the header, so a project ends up like
 * <pre>
 * mod buffer {
 *     #[header_src = "/some/path/buffer.h"]
 *     mod buffer_h {
 *         struct buffer_t { data: i32 }
 *     }
 * }
 * </pre>
 * and the same declaration is repeated in every module whose source included
 * the header. This transform moves the items out of the header modules into
 * their destination module, removes the duplicates and fixes up imports:
 * <pre>
 * mod buffer {
 *     struct buffer_t { data: i32 }
 * }
 * </pre>
 * Items from system headers all go to one {@code stdlib} module.
 */
public class ReorganizeModules implements Transform {
    public static final String COMMAND_NAME = "reorganize_modules";
    /** Set to {@code true} to log the tree after every stage regardless of the configuration. */
    public static final String DUMP_STAGES_PROPERTY = "reorg.dumpStages";

    private static final Logger logger = Logger.getLogger(ReorganizeModules.class.getName());

    private final ReorganizerConfiguration config;
    private final ReorganizationStats stats;
    private final List<ReorganizeStage> stages = List.of(
            new DestinationDiscovery(),
            new DestinationResolver(),
            new ModuleSynthesizer(),
            new ItemInserter(),
            new ModuleCleanup());

    public ReorganizeModules() {
        this(new ReorganizerConfiguration(), new ReorganizationStats());
    }

    public ReorganizeModules(ReorganizerConfiguration config, ReorganizationStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    @Override
    public Crate transform(Crate krate, CommandState st, Session session) {
        Objects.requireNonNull(session, "session");
        // counts describe this run only
        stats.reset();
        boolean dumpStages = config.isDumpStages() || Boolean.getBoolean(DUMP_STAGES_PROPERTY);
        ReorganizeContext cx = new ReorganizeContext(config, st, session, stats);
        Crate current = krate;
        for (ReorganizeStage stage : stages) {
            current = stage.apply(current, cx);
            if (dumpStages) {
                logger.info("After stage " + stage.name() + ":\n" + ItemPrinter.print(current));
            }
        }
        logger.info("Reorganized modules: " + stats);
        return current;
    }

    @Override
    public Phase minPhase() {
        return Phase.PHASE3;
    }

    public ReorganizationStats getStats() {
        return stats;
    }

    public static void registerCommands(Registry reg, ReorganizerConfiguration config, ReorganizationStats stats) {
        reg.register(COMMAND_NAME, () -> new ReorganizeModules(config, stats));
    }

    public static void registerCommands(Registry reg) {
        reg.register(COMMAND_NAME, ReorganizeModules::new);
    }
}
