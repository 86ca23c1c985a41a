package com.photoorg.app.metadata;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;

/**
 * Data de captura via metadata-extractor (EXIF, QuickTime, MP4), com o nome
 * do arquivo como fallback.
 */
public final class MediaDateResolver implements DateResolver {

    private static final Logger logger = LoggerFactory.getLogger(MediaDateResolver.class);

    /** Datas de container zeradas viram 1904/1970; abaixo disso é lixo. */
    static final int MIN_METADATA_YEAR = 1971;

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private final DateResolver fallback;
    private final Clock clock;

    public MediaDateResolver(DateResolver fallback) {
        this(fallback, Clock.systemDefaultZone());
    }

    public MediaDateResolver(DateResolver fallback, Clock clock) {
        this.fallback = fallback;
        this.clock = clock;
    }

    @Override
    public Optional<CaptureDate> resolve(Path file) {
        Optional<CaptureDate> fromMetadata = readMetadata(file);
        if (fromMetadata.isPresent()) return fromMetadata;
        try {
            return fallback.resolve(file);
        } catch (RuntimeException e) {
            logger.debug("Fallback de data falhou para {}", file, e);
            return Optional.empty();
        }
    }

    Optional<CaptureDate> readMetadata(Path file) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException | IOException e) {
            logger.debug("Sem metadados legíveis em {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            // arquivos truncados às vezes estouram dentro do parser
            logger.debug("Parser de metadados falhou em {}", file, e);
            return Optional.empty();
        }

        return firstPlausible(
                dateOf(metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class), ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL),
                dateOf(metadata.getFirstDirectoryOfType(ExifIFD0Directory.class), ExifIFD0Directory.TAG_DATETIME),
                dateOf(metadata.getFirstDirectoryOfType(QuickTimeDirectory.class), QuickTimeDirectory.TAG_CREATION_TIME),
                dateOf(metadata.getFirstDirectoryOfType(Mp4Directory.class), Mp4Directory.TAG_CREATION_TIME));
    }

    private Optional<CaptureDate> firstPlausible(Date... candidates) {
        int maxYear = LocalDate.now(clock).getYear() + 1;
        for (Date d : candidates) {
            if (d == null) continue;
            LocalDate local = d.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
            if (local.getYear() >= MIN_METADATA_YEAR && local.getYear() <= maxYear) {
                return Optional.of(CaptureDate.of(local));
            }
        }
        return Optional.empty();
    }

    private static Date dateOf(Directory dir, int tag) {
        if (dir == null || !dir.containsTag(tag)) return null;
        try {
            return dir.getDate(tag, UTC);
        } catch (RuntimeException e) {
            return null;
        }
    }
}
