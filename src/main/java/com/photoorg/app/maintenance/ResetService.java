package com.photoorg.app.maintenance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.database.Database;
import com.photoorg.app.organize.Classifier;
import com.photoorg.app.scan.MediaType;

/**
 * Reset completo: apaga o banco, o arquivo de log e as pastas de categoria do destino.
 * A origem nunca é tocada.
 */
public final class ResetService {

    private static final Logger logger = LoggerFactory.getLogger(ResetService.class);

    public static final String LOG_FILE_PROPERTY = "photoorg.logFile";
    static final String DEFAULT_LOG_FILE = "photoorg.log";

    private final Path destination;
    private final Path dbFile;
    private final Path source;
    private final Path logFile;

    public ResetService(Path destination, Path dbFile, Path source) {
        this(destination, dbFile, source, null);
    }

    /**
     * @param source  usado só para recusar o reset se a origem estiver dentro de uma pasta a apagar; pode ser null
     * @param logFile log da aplicação a apagar junto; null não mexe em log
     */
    public ResetService(Path destination, Path dbFile, Path source, Path logFile) {
        this.destination = destination.toAbsolutePath().normalize();
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.source = source == null ? null : source.toAbsolutePath().normalize();
        this.logFile = logFile == null ? null : logFile.toAbsolutePath().normalize();
    }

    /**
     * Arquivo do appender de arquivo do logback.xml ({@code photoorg.logFile}).
     */
    public static Path currentLogFile() {
        return Path.of(System.getProperty(LOG_FILE_PROPERTY, DEFAULT_LOG_FILE));
    }

    public static List<String> categoryFolders() {
        List<String> out = new ArrayList<>();
        for (MediaType t : MediaType.values()) {
            out.add(t.folder());
            out.add(t.duplicatesFolder());
        }
        out.add(Classifier.REVIEW_FOLDER);
        return out;
    }

    /**
     * O que existe hoje e seria removido.
     */
    public List<Path> plan() {
        List<Path> targets = new ArrayList<>();
        if (Files.exists(dbFile)) targets.add(dbFile);
        if (logFile != null && Files.isRegularFile(logFile)) targets.add(logFile);
        for (String folder : categoryFolders()) {
            Path p = destination.resolve(folder);
            if (Files.exists(p)) targets.add(p);
        }
        return targets;
    }

    public ResetResult execute() throws IOException {
        List<Path> folders = new ArrayList<>();
        for (String folder : categoryFolders()) {
            folders.add(destination.resolve(folder));
        }
        if (source != null) {
            for (Path f : folders) {
                if (source.startsWith(f)) {
                    throw new IOException("Origem está dentro de " + f + "; reset recusado");
                }
            }
        }

        boolean dbRemoved = Database.deleteFiles(dbFile);
        if (dbRemoved) logger.info("Banco removido: {}", dbFile);

        boolean logRemoved = false;
        if (logFile != null) {
            // no Linux o appender segue escrevendo no inode já desligado
            logRemoved = Files.deleteIfExists(logFile);
            if (logRemoved) logger.info("Log removido: {}", logFile);
        }

        int removed = 0;
        for (Path f : folders) {
            if (!Files.exists(f)) continue;
            if (Files.isDirectory(f)) {
                FileUtils.deleteDirectory(f.toFile());
            } else {
                Files.delete(f);
            }
            logger.info("Removido: {}", f);
            removed++;
        }
        return new ResetResult(dbRemoved, removed, logRemoved);
    }

    public record ResetResult(boolean databaseRemoved, int foldersRemoved, boolean logRemoved) {}
}
