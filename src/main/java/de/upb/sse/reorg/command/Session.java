package de.upb.sse.reorg.command;

import lombok.Getter;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What the driver knows about the crate being rewritten.
 */
public class Session {
    private final Path localCrateSourceFile;
    @Getter private final Phase phase;

    public Session(Path localCrateSourceFile, Phase phase) {
        this.localCrateSourceFile = localCrateSourceFile;
        this.phase = phase == null ? Phase.PHASE1 : phase;
    }

    public Optional<Path> getLocalCrateSourceFile() {
        return Optional.ofNullable(localCrateSourceFile);
    }

    /**
     * File name of the crate root without its extension, e.g. {@code buffer}
     * for {@code /src/buffer.rs}.
     *
     * @throws IllegalStateException if the session has no source file
     */
    public String sourceFileStem() {
        Path file = getLocalCrateSourceFile()
                .map(Path::getFileName)
                .orElseThrow(() -> new IllegalStateException("Session has no local crate source file"));
        String name = file.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
