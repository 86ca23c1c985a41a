package com.photoorg.app.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class PathSafetyTest {

    @TempDir
    Path tmp;

    @Test
    void acceptsSiblingsAndMissingDestination() throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src"));
        PathSafety.Resolved r = PathSafety.validate(src, tmp.resolve("out/novo"));

        assertEquals(src.toRealPath(), r.source());
        assertTrue(r.destination().endsWith("out/novo"));
        assertFalse(Files.exists(tmp.resolve("out")), "validação não cria nada");
    }

    @Test
    void rejectsSameOrNestedPaths() throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src"));

        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(src, src));
        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(src, tmp.resolve("src/../src")));
        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(src, src.resolve("organizado")));
        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(src, tmp));
    }

    @Test
    void rejectsNestingThroughSymlink() throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src"));
        Path alias = Files.createSymbolicLink(tmp.resolve("alias"), src);

        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(src, alias.resolve("dest")));
    }

    @Test
    void rejectsMissingSourceAndFileDestination() throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src"));
        Path file = Files.writeString(tmp.resolve("arquivo.txt"), "x");

        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(tmp.resolve("nada"), tmp.resolve("d")));
        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(file, tmp.resolve("d")));
        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(src, file));
        assertThrows(PreRunValidationException.class, () -> PathSafety.validate(null, tmp.resolve("d")));
    }
}
