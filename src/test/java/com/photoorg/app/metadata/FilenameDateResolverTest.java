package com.photoorg.app.metadata;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FilenameDateResolverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private final FilenameDateResolver resolver =
            new FilenameDateResolver(List.of("IMG_", "DSC", "DSCF", "PXL_", "VID_"), CLOCK);

    @Test
    void compactDateAfterPrefix() {
        assertEquals(Optional.of(new CaptureDate(2023, 4)), resolver.parse("IMG_20230401_photo.jpg"));
        assertEquals(Optional.of(new CaptureDate(2021, 12)), resolver.parse("PXL_20211231_101010.jpg"));
    }

    @Test
    void separatedDates() {
        assertEquals(Optional.of(new CaptureDate(2019, 7)), resolver.parse("2019-07-15 viagem.jpg"));
        assertEquals(Optional.of(new CaptureDate(2018, 2)), resolver.parse("foto_2018_02_28.png"));
    }

    @Test
    void mixedSeparatorsAreNotADate() {
        assertEquals(Optional.empty(), resolver.parse("2019-07_15.jpg"));
    }

    @Test
    void rejectsImpossibleAndOutOfRangeDates() {
        assertEquals(Optional.empty(), resolver.parse("IMG_20231345.jpg"));
        assertEquals(Optional.empty(), resolver.parse("IMG_20230230.jpg"));
        assertEquals(Optional.empty(), resolver.parse("IMG_19850101.jpg"));
        assertEquals(Optional.empty(), resolver.parse("IMG_20300101.jpg"));
        assertEquals(Optional.of(new CaptureDate(2025, 1)), resolver.parse("IMG_20250101.jpg"), "ano seguinte é aceito");
    }

    @Test
    void digitsGluedToTheDateAreIgnored() {
        assertEquals(Optional.empty(), resolver.parse("123202304011.jpg"));
    }

    @Test
    void noDate() {
        assertEquals(Optional.empty(), resolver.parse("foto_praia.jpg"));
        assertEquals(Optional.empty(), resolver.resolve(Path.of("/")));
    }

    @Test
    void longestPrefixWinsCaseInsensitive() {
        assertEquals("_1.jpg", resolver.stripPrefix("dscf_1.jpg"));
        assertEquals("_1.jpg", resolver.stripPrefix("DSC_1.jpg"));
        assertEquals("x.jpg", resolver.stripPrefix("x.jpg"));
    }

    @Test
    void resolveUsesFileNameOnly() {
        assertEquals(Optional.of(new CaptureDate(2023, 4)), resolver.resolve(Path.of("/tmp/19990101/IMG_20230401.jpg")));
    }
}
