package com.photoorg.app.metadata;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class MediaDateResolverTest {

    @TempDir
    Path tmp;

    @Test
    void fileWithoutMetadataFallsBackToName() throws Exception {
        Path f = Files.writeString(tmp.resolve("IMG_20230401_x.jpg"), "não é jpeg");
        MediaDateResolver r = new MediaDateResolver(new FilenameDateResolver(List.of("IMG_")));

        assertEquals(Optional.of(new CaptureDate(2023, 4)), r.resolve(f));
    }

    @Test
    void nothingUsableGivesEmpty() throws Exception {
        Path f = Files.writeString(tmp.resolve("praia.jpg"), "lixo");
        MediaDateResolver r = new MediaDateResolver(new FilenameDateResolver(List.of()));

        assertEquals(Optional.empty(), r.resolve(f));
    }

    @Test
    void missingFileAndFailingFallbackDoNotThrow() {
        MediaDateResolver r = new MediaDateResolver(p -> {
            throw new IllegalStateException("boom");
        });
        assertEquals(Optional.empty(), r.resolve(tmp.resolve("nao-existe.mp4")));
    }
}
