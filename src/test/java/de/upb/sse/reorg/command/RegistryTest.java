package de.upb.sse.reorg.command;

import de.upb.sse.reorg.exceptions.UnknownCommandException;
import de.upb.sse.reorg.transform.modules.ReorganizeModules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RegistryTest {

    @Test
    @DisplayName("reorganize_modules is registered and needs phase 3")
    void registersReorganizeModules() {
        Registry reg = new Registry();
        ReorganizeModules.registerCommands(reg);

        assertTrue(reg.contains("reorganize_modules"));
        Transform t = reg.get("reorganize_modules");
        assertTrue(t instanceof ReorganizeModules);
        assertEquals(Phase.PHASE3, t.minPhase());
        // every lookup builds a fresh transform
        assertNotSame(t, reg.get("reorganize_modules"));
    }

    @Test
    void unknownCommand() {
        Registry reg = new Registry();
        UnknownCommandException e = assertThrows(UnknownCommandException.class, () -> reg.get("rename_items"));
        assertTrue(e.getMessage().contains("rename_items"));
    }
}
