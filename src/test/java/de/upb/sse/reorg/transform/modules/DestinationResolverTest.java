package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.AstBuilder;
import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.ModItem;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.OpaqueItem;
import de.upb.sse.reorg.ast.UseItem;
import de.upb.sse.reorg.ast.Visibility;
import de.upb.sse.reorg.command.CommandState;
import de.upb.sse.reorg.command.Phase;
import de.upb.sse.reorg.command.Session;
import de.upb.sse.reorg.configuration.ReorganizerConfiguration;
import de.upb.sse.reorg.exceptions.UnresolvedDestinationException;
import de.upb.sse.reorg.stats.ReorganizationStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DestinationResolverTest {
    private CommandState ids;
    private AstBuilder b;

    @BeforeEach
    void setup() {
        ids = new CommandState(0);
        b = new AstBuilder(ids::nextNodeId);
    }

    private ReorganizeContext resolve(Crate krate, Session session) {
        ReorganizeContext cx = new ReorganizeContext(new ReorganizerConfiguration(),
                new CommandState(ids.peekNextId()), session, new ReorganizationStats());
        new DestinationDiscovery().apply(krate, cx);
        new DestinationResolver().apply(krate, cx);
        return cx;
    }

    private ReorganizeContext resolve(Crate krate) {
        return resolve(krate, new Session(Path.of("/src/main.rs"), Phase.PHASE3));
    }

    @Test
    @DisplayName("header module items go to the module whose name the header module contains")
    void containmentHeuristic() {
        OpaqueItem bufferT = b.struct("buffer_t", "{ data: i32 }");
        ModItem buffer = b.mod("buffer", b.headerMod("buffer_h", "/project/buffer.h", bufferT));
        ReorganizeContext cx = resolve(b.crate(buffer));

        assertEquals(buffer.getId(), cx.destinationOf(bufferT.getId()).orElseThrow());
        assertEquals(Collections.singleton(buffer.getId()), cx.getPossibleDestinationModules());
    }

    @Test
    @DisplayName("system header items all resolve to the one stdlib module")
    void stdlibSingleton() {
        OpaqueItem file = b.struct("FILE", "{ _flags: c_int }");
        OpaqueItem divT = b.struct("div_t", "{ quot: c_int }");
        Crate krate = b.crate(
                b.mod("main", b.headerMod("stdio_h", "/usr/include/stdio.h", file)),
                b.mod("buffer", b.headerMod("stdlib_h", "/usr/include/stdlib.h", divT)));
        ReorganizeContext cx = resolve(krate);

        NodeId stdlib = cx.stdlibModuleId();
        assertEquals(stdlib, cx.destinationOf(file.getId()).orElseThrow());
        assertEquals(stdlib, cx.destinationOf(divT.getId()).orElseThrow());
    }

    @Test
    @DisplayName("unmatched header modules of the same name share one new module")
    void newModuleReusedByName() {
        OpaqueItem left = b.struct("node", "{ next: *mut node }");
        OpaqueItem right = b.struct("list", "{ head: *mut node }");
        Crate krate = b.crate(
                b.mod("alpha", b.headerMod("types_h", "/project/types.h", left)),
                b.mod("beta", b.headerMod("types_h", "/project/types.h", right)));
        ReorganizeContext cx = resolve(krate);

        NodeId dest = cx.destinationOf(left.getId()).orElseThrow();
        assertEquals(dest, cx.destinationOf(right.getId()).orElseThrow());
        assertNotEquals(cx.stdlibModuleId(), dest);
        assertEquals("types_h", cx.newModuleName(dest).orElseThrow());
    }

    @Test
    @DisplayName("when several candidates match, the one with the lowest id wins")
    void candidatesInIdOrder() {
        ModItem buf = b.mod("buf");
        OpaqueItem bufferT = b.struct("buffer_t", "{ data: i32 }");
        ModItem buffer = b.mod("buffer", b.headerMod("buffer_h", "/project/buffer.h", bufferT));
        ReorganizeContext cx = resolve(b.crate(buffer, buf));

        assertTrue(buf.getId().compareTo(buffer.getId()) < 0);
        assertEquals(buf.getId(), cx.destinationOf(bufferT.getId()).orElseThrow());
    }

    @Test
    @DisplayName("import paths naming a header module are patched to the destination")
    void pathRecordsArePatched() {
        UseItem viaSelf = b.use("self::buffer_h::buffer_t");
        UseItem libc = b.use("libc");
        ModItem buffer = b.mod("buffer", viaSelf, libc,
                b.headerMod("buffer_h", "/project/buffer.h", b.struct("buffer_t", "{ data: i32 }")));
        ReorganizeContext cx = resolve(b.crate(buffer));

        PathRecord patched = cx.pathRecord(viaSelf.getId()).orElseThrow();
        assertEquals("buffer::buffer_t", patched.getPath().toString());
        assertEquals(buffer.getId(), patched.getDestination());

        PathRecord untouched = cx.pathRecord(libc.getId()).orElseThrow();
        assertEquals("libc", untouched.getPath().toString());
        assertFalse(untouched.isPatched());
    }

    @Test
    @DisplayName("an unnamed candidate module is matched through the crate's file name")
    void unnamedCandidateUsesSourceFile() {
        OpaqueItem bufferT = b.struct("buffer_t", "{ data: i32 }");
        ModItem root = new ModItem(ids.nextNodeId(), "", Collections.emptyList(), Visibility.PUBLIC,
                List.of(b.headerMod("buffer_h", "/project/buffer.h", bufferT)), true);
        ReorganizeContext cx = resolve(b.crate(root), new Session(Path.of("/project/src/buffer.rs"), Phase.PHASE3));

        assertEquals(root.getId(), cx.destinationOf(bufferT.getId()).orElseThrow());
    }

    @Test
    @DisplayName("an unnamed candidate without a known source file fails the run")
    void unnamedCandidateWithoutSourceFile() {
        ModItem root = new ModItem(ids.nextNodeId(), "", Collections.emptyList(), Visibility.PUBLIC,
                List.of(b.headerMod("buffer_h", "/project/buffer.h", b.struct("buffer_t", "{}"))), true);
        Crate krate = b.crate(root);
        assertThrows(IllegalStateException.class, () -> resolve(krate, new Session(null, Phase.PHASE3)));
    }

    @Test
    @DisplayName("the same item under two unmatched header modules cannot be resolved")
    void sameItemTwice() {
        OpaqueItem shared = b.struct("shared_t", "{}");
        Crate krate = b.crate(
                b.mod("left", b.headerMod("dup_h", "/project/dup.h", shared)),
                b.mod("right", b.headerMod("dup_h", "/project/dup.h", shared)));

        UnresolvedDestinationException e = assertThrows(UnresolvedDestinationException.class, () -> resolve(krate));
        assertEquals(shared.getId(), e.getItemId());
        assertEquals("dup_h", e.getModuleName());
    }
}
