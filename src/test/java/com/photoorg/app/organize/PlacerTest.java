package com.photoorg.app.organize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class PlacerTest {

    private static final String HASH = "0123456789abcdef";

    @TempDir
    Path tmp;

    private Path file(String name, String content) throws Exception {
        Path p = tmp.resolve("src").resolve(name);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void copyCreatesParentsAndKeepsSource() throws Exception {
        Path src = file("IMG_1.jpg", "abc");
        Path dest = tmp.resolve("dest");
        Placer placer = new Placer(dest, TransferMode.COPY, false);

        Path placed = placer.place(src, "PHOTO/2023/04/IMG_1.jpg", HASH);

        assertEquals(dest.resolve("PHOTO/2023/04/IMG_1.jpg").toAbsolutePath().normalize(), placed);
        assertEquals("abc", Files.readString(placed));
        assertTrue(Files.exists(src));
        assertEquals(Files.getLastModifiedTime(src).toMillis(), Files.getLastModifiedTime(placed).toMillis());
        try (Stream<Path> s = Files.list(placed.getParent())) {
            assertEquals(1, s.count(), "nenhum .part deve sobrar");
        }
    }

    @Test
    void neverOverwritesExistingFile() throws Exception {
        Path src = file("a.jpg", "novo");
        Path dest = tmp.resolve("dest");
        Path existing = dest.resolve("PHOTO/a.jpg");
        Files.createDirectories(existing.getParent());
        Files.writeString(existing, "antigo");

        Placer placer = new Placer(dest, TransferMode.COPY, false);
        PlacementException e = assertThrows(PlacementException.class, () -> placer.place(src, "PHOTO/a.jpg", HASH));
        assertTrue(e.isCollision());
        assertEquals("antigo", Files.readString(existing));
    }

    @Test
    void moveDeletesSource() throws Exception {
        Path src = file("v.mp4", "video");
        Placer placer = new Placer(tmp.resolve("dest"), TransferMode.MOVE, false);

        Path placed = placer.place(src, "VIDEO/2020/01/v.mp4", HASH);

        assertFalse(Files.exists(src));
        assertEquals("video", Files.readString(placed));
    }

    @Test
    void placeWithSuffixSkipsOccupiedNames() throws Exception {
        Path src = file("a.jpg", "x");
        Path dest = tmp.resolve("dest");
        Files.createDirectories(dest.resolve("PHOTO_DUPLICATES"));
        Files.writeString(dest.resolve("PHOTO_DUPLICATES/a.jpg"), "outro");
        Files.writeString(dest.resolve("PHOTO_DUPLICATES/a_01234567.jpg"), "outro");

        Placer placer = new Placer(dest, TransferMode.COPY, false);
        String rel = placer.placeWithSuffix(src, "PHOTO_DUPLICATES/a.jpg", HASH);

        assertEquals("PHOTO_DUPLICATES/a_01234567_2.jpg", rel);
        assertEquals("x", Files.readString(dest.resolve(rel)));
    }

    @Test
    void firstFreeAttemptLooksAtDisk() throws Exception {
        Path dest = tmp.resolve("dest");
        Files.createDirectories(dest.resolve("PHOTO"));
        Placer placer = new Placer(dest, TransferMode.COPY, false);
        assertEquals(0, placer.firstFreeAttempt("PHOTO/a.jpg", HASH));

        Files.writeString(dest.resolve("PHOTO/a.jpg"), "1");
        assertEquals(1, placer.firstFreeAttempt("PHOTO/a.jpg", HASH));
    }

    @Test
    void dryRunWritesNothingButTracksOccupancy() throws Exception {
        Path src = file("a.jpg", "x");
        Path dest = tmp.resolve("dest");
        Placer placer = new Placer(dest, TransferMode.MOVE, true);

        placer.place(src, "PHOTO/a.jpg", HASH);
        PlacementException e = assertThrows(PlacementException.class, () -> placer.place(src, "PHOTO/a.jpg", HASH));
        assertTrue(e.isCollision());
        assertEquals(1, placer.firstFreeAttempt("PHOTO/a.jpg", HASH));
        assertEquals("PHOTO/a_01234567.jpg", placer.placeWithSuffix(src, "PHOTO/a.jpg", HASH));

        assertFalse(Files.exists(dest));
        assertTrue(Files.exists(src), "dry-run no modo move não remove a origem");
    }

    @Test
    void rejectsPathsOutsideRoot() {
        Placer placer = new Placer(tmp.resolve("dest"), TransferMode.COPY, false);
        assertThrows(IllegalArgumentException.class, () -> placer.resolve("../fora.jpg"));
    }

    @Test
    void moveUndoesTargetWhenSourceCannotBeRemoved() throws Exception {
        Path src = file("v.mp4", "video");
        Path dest = tmp.resolve("dest");
        Placer placer = new Placer(dest, TransferMode.MOVE, false, p -> {
            throw new java.nio.file.AccessDeniedException(p.toString());
        });

        PlacementException e = assertThrows(PlacementException.class, () -> placer.place(src, "VIDEO/2020/01/v.mp4", HASH));

        assertFalse(e.isCollision());
        assertTrue(Files.exists(src));
        assertFalse(Files.exists(dest.resolve("VIDEO/2020/01/v.mp4")));
        try (Stream<Path> s = Files.list(dest.resolve("VIDEO/2020/01"))) {
            assertEquals(0, s.count(), "nem destino nem .part devem sobrar");
        }
    }

    @Test
    void concurrentPlacementsOfSameNameAndContentYieldOneFileAndCollisions() throws Exception {
        int threads = 16;
        byte[] content = new byte[2 * 1024 * 1024];
        java.util.Arrays.fill(content, (byte) 7);
        List<Path> sources = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Path p = tmp.resolve("src/d" + i + "/IMG_20230401.jpg");
            Files.createDirectories(p.getParent());
            sources.add(Files.write(p, content));
        }
        Path dest = tmp.resolve("dest");
        Placer placer = new Placer(dest, TransferMode.COPY, false);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (Path source : sources) {
            results.add(pool.submit(() -> {
                go.await();
                try {
                    placer.place(source, "PHOTO_DUPLICATES/IMG_20230401.jpg", HASH);
                    return true;
                } catch (PlacementException e) {
                    assertTrue(e.isCollision(), e.getMessage());
                    return false;
                }
            }));
        }
        go.countDown();
        int placed = 0;
        for (Future<Boolean> f : results) {
            if (f.get(30, TimeUnit.SECONDS)) placed++;
        }
        pool.shutdown();

        assertEquals(1, placed);
        try (Stream<Path> s = Files.list(dest.resolve("PHOTO_DUPLICATES"))) {
            assertEquals(List.of("IMG_20230401.jpg"), s.map(p -> p.getFileName().toString()).toList());
        }
        assertEquals(content.length, Files.size(dest.resolve("PHOTO_DUPLICATES/IMG_20230401.jpg")));
    }

    @Test
    void tempNamesAreUniquePerPlacement() {
        String a = Placer.tempName("IMG_1.jpg", HASH);
        String b = Placer.tempName("IMG_1.jpg", HASH);

        assertNotEquals(a, b);
        assertTrue(a.startsWith(".IMG_1.jpg.01234567."), a);
        assertTrue(Placer.isPartial(a));
        assertFalse(Placer.isPartial("IMG_1.jpg"));
        assertFalse(Placer.isPartial("video.part"));
    }

    @Test
    void sweepRemovesLeftoverPartialsOnly() throws Exception {
        Path dest = tmp.resolve("dest");
        Path dir = Files.createDirectories(dest.resolve("PHOTO/2023/04"));
        Files.writeString(dir.resolve(Placer.tempName("IMG_1.jpg", HASH)), "metade");
        Files.writeString(dir.resolve("IMG_1.jpg"), "inteiro");
        Files.writeString(dir.resolve("video.part"), "arquivo do usuário");

        Placer placer = new Placer(dest, TransferMode.COPY, false);

        assertEquals(1, placer.sweepPartials());
        try (Stream<Path> s = Files.list(dir)) {
            assertEquals(List.of("IMG_1.jpg", "video.part"), s.map(p -> p.getFileName().toString()).sorted().toList());
        }
        assertEquals(0, new Placer(dest, TransferMode.COPY, true).sweepPartials());
    }
}
