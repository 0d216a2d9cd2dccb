package de.upb.sse.reorg;

import de.upb.sse.reorg.ast.AstBuilder;
import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.ItemPrinter;
import de.upb.sse.reorg.command.CommandState;
import de.upb.sse.reorg.command.Phase;
import de.upb.sse.reorg.command.Session;
import de.upb.sse.reorg.configuration.ReorganizerConfiguration;
import de.upb.sse.reorg.exceptions.PhaseException;
import de.upb.sse.reorg.exceptions.UnknownCommandException;
import de.upb.sse.reorg.transform.modules.ReorganizeModules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ReorganizerTest {
    private Reorganizer reorganizer;
    private AstBuilder b;

    @BeforeEach
    void setup() {
        reorganizer = new Reorganizer();
        CommandState ids = new CommandState(0);
        b = new AstBuilder(ids::nextNodeId);
    }

    private Crate bufferCrate() {
        return b.crate(b.mod("buffer",
                b.headerMod("buffer_h", "/some/path/buffer.h", b.struct("buffer_t", "{ data: i32 }"))));
    }

    @Test
    @DisplayName("reorganize runs the module transform")
    void reorganize() {
        Crate result = reorganizer.reorganize(bufferCrate(), new Session(Path.of("/src/buffer.rs"), Phase.PHASE3));

        assertEquals("pub mod buffer {\n    pub struct buffer_t { data: i32 }\n}\n", ItemPrinter.print(result));
        assertTrue(reorganizer.getStats().changedAnything());
    }

    @Test
    @DisplayName("running before phase 3 is rejected")
    void tooEarly() {
        Crate krate = bufferCrate();
        Session session = new Session(Path.of("/src/buffer.rs"), Phase.PHASE2);
        PhaseException e = assertThrows(PhaseException.class, () -> reorganizer.reorganize(krate, session));
        assertTrue(e.getMessage().contains("reorganize_modules"));
    }

    @Test
    void unknownCommand() {
        Session session = new Session(null, Phase.PHASE3);
        assertThrows(UnknownCommandException.class, () -> reorganizer.run("bitcast_retype", b.crate(), session));
    }

    @Test
    @DisplayName("statistics describe the last run only")
    void statsAreReset() {
        Session session = new Session(Path.of("/src/buffer.rs"), Phase.PHASE3);
        Crate once = reorganizer.reorganize(bufferCrate(), session);
        assertEquals(1, reorganizer.getStats().getRemovedHeaderModules());

        reorganizer.reorganize(once, session);
        assertEquals(0, reorganizer.getStats().getRemovedHeaderModules());
        assertFalse(reorganizer.getStats().changedAnything());
    }

    @Test
    @DisplayName("the dump property does not change the caller's configuration")
    void dumpPropertyLeavesConfigurationAlone() {
        ReorganizerConfiguration config = new ReorganizerConfiguration();
        System.setProperty(ReorganizeModules.DUMP_STAGES_PROPERTY, "true");
        try {
            Reorganizer withProperty = new Reorganizer(config);
            Crate result = withProperty.reorganize(bufferCrate(), new Session(Path.of("/src/buffer.rs"), Phase.PHASE3));

            assertEquals("pub mod buffer {\n    pub struct buffer_t { data: i32 }\n}\n", ItemPrinter.print(result));
            assertFalse(config.isDumpStages());
        } finally {
            System.clearProperty(ReorganizeModules.DUMP_STAGES_PROPERTY);
        }
    }
}
