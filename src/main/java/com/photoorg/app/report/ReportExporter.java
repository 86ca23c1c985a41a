package com.photoorg.app.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.index.FileRecord;

/**
 * Exporta registros de arquivos para CSV.
 */
public final class ReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(ReportExporter.class);

    static final String[] HEADER = {
            "id", "session_id", "status", "media_type", "year", "month", "hash",
            "source_path", "dest_path", "duplicate_of", "size_bytes", "worker", "created_at", "message"
    };

    private ReportExporter() {}

    /**
     * @return quantidade de linhas escritas (sem o cabeçalho)
     */
    public static int exportCsv(List<FileRecord> records, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(HEADER)
                .build();
        int count = 0;
        try (var writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
             var printer = new CSVPrinter(writer, format)) {
            for (FileRecord r : records) {
                printer.printRecord(
                        r.id(),
                        r.sessionId(),
                        r.status().dbValue(),
                        r.mediaType().dbValue(),
                        r.year(),
                        r.month(),
                        r.hash(),
                        r.sourcePath(),
                        r.destPath(),
                        r.duplicateOf(),
                        r.sizeBytes(),
                        r.worker(),
                        r.createdAt(),
                        r.message()
                );
                count++;
            }
        }
        logger.info("CSV exportado: {} registros em {}", count, out.toAbsolutePath());
        return count;
    }
}
