package com.gpappid.harvester.harvest.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class AtomicFiles {

    private AtomicFiles() {
    }

    /**
     * Creates an empty temp file next to {@code target}. The name starts with a dot so directory
     * listings that skip hidden files never pick it up as a finished file.
     */
    public static Path createSiblingTemp(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        return Files.createTempFile(parent, "." + target.getFileName() + ".", ".tmp");
    }

    public static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Best effort removal used on failure paths; returns the problem instead of throwing so the
     * original failure stays the one reported.
     */
    public static IOException deleteQuietly(Path path) {
        if (path == null) {
            return null;
        }
        try {
            Files.deleteIfExists(path);
            return null;
        } catch (IOException e) {
            return e;
        }
    }
}
