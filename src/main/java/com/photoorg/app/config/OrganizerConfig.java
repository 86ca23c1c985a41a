package com.photoorg.app.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.photoorg.app.organize.TransferMode;
import com.photoorg.app.scan.ScanRules;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

/**
 * Configuração validada e imutável de uma execução.
 *
 * <p>Ordem de precedência: flags da linha de comando, arquivo {@code --config},
 * {@code reference.conf}.
 */
public record OrganizerConfig(
        Path source,
        Path destination,
        Path database,
        boolean dryRun,
        TransferMode transfer,
        ScanRules scanRules,
        List<String> photographicPrefixes,
        Parallel parallel,
        Performance performance,
        DatabaseSettings databaseSettings
) {

    public static final String ROOT = "photoorg";

    public record Parallel(boolean enabled, int maxWorkers, int cpuMultiplier, int maxWorkersLimit) {}

    /**
     * @param fileTimeout {@link Duration#ZERO} desliga o timeout por arquivo
     */
    public record Performance(int bufferSize, String hashAlgorithm, int queueCapacity, Duration fileTimeout) {}

    public record DatabaseSettings(boolean vacuumOnCompletion, Duration busyTimeout, int busyRetries, Duration busyBackoff) {}

    public OrganizerConfig {
        photographicPrefixes = photographicPrefixes == null ? List.of() : List.copyOf(photographicPrefixes);
    }

    /**
     * Quantidade de workers para esta máquina.
     */
    public int workerCount(int availableProcessors) {
        if (!parallel.enabled()) return 1;
        int limit = Math.max(1, parallel.maxWorkersLimit());
        if (parallel.maxWorkers() > 0) {
            return Math.min(parallel.maxWorkers(), limit);
        }
        return Math.max(1, Math.min(availableProcessors * parallel.cpuMultiplier(), limit));
    }

    public int workerCount() {
        return workerCount(Runtime.getRuntime().availableProcessors());
    }

    public OrganizerConfig withDryRun(boolean value) {
        return new OrganizerConfig(source, destination, database, value, transfer, scanRules,
                photographicPrefixes, parallel, performance, databaseSettings);
    }

    /**
     * Resumo gravado na sessão (serializado em JSON).
     */
    public Map<String, Object> snapshot(int workers) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source", source.toString());
        m.put("destination", destination.toString());
        m.put("dryRun", dryRun);
        m.put("transfer", transfer.name());
        m.put("workers", workers);
        m.put("imageExtensions", scanRules.imageExtensions().stream().sorted().toList());
        m.put("videoExtensions", scanRules.videoExtensions().stream().sorted().toList());
        m.put("otherExtensions", scanRules.otherExtensions().stream().sorted().toList());
        m.put("excludeHiddenDirs", scanRules.excludeHidden());
        m.put("excludePatterns", scanRules.excludePatterns());
        m.put("hashAlgorithm", performance.hashAlgorithm());
        m.put("bufferSize", performance.bufferSize());
        return m;
    }

    // --- Carga ---------------------------------------------------------------

    public static OrganizerConfig load(Path userFile, Map<String, ?> overrides) {
        Config base = ConfigFactory.load();
        Config file = ConfigFactory.empty();
        if (userFile != null) {
            if (!Files.isRegularFile(userFile)) {
                throw new ConfigValidationException(List.of("Arquivo de configuração não encontrado: " + userFile));
            }
            try {
                file = ConfigFactory.parseFile(userFile.toFile(), ConfigParseOptions.defaults().setAllowMissing(false));
            } catch (ConfigException e) {
                throw new ConfigValidationException("Arquivo de configuração inválido: " + e.getMessage(), e);
            }
        }
        Config cli = ConfigFactory.parseMap(overrides == null ? Map.of() : overrides, "linha de comando");
        Config merged = cli.withFallback(file).withFallback(base).resolve();
        return from(merged.getConfig(ROOT));
    }

    public static OrganizerConfig from(Config c) {
        List<String> errors = new ArrayList<>();
        try {
            String source = c.getString("source");
            String destination = c.getString("destination");
            String database = c.hasPath("database") ? c.getString("database") : "";

            if (StringUtils.isBlank(source)) errors.add("'source' é obrigatório");
            if (StringUtils.isBlank(destination)) errors.add("'destination' é obrigatório");

            TransferMode transfer = TransferMode.COPY;
            try {
                transfer = TransferMode.parse(c.getString("transfer"));
            } catch (IllegalArgumentException e) {
                errors.add("'transfer' deve ser copy ou move: " + c.getString("transfer"));
            }

            Set<String> images = extensions(c, "image-extensions", errors);
            Set<String> videos = extensions(c, "video-extensions", errors);
            Set<String> others = c.hasPath("other-extensions") ? extensions(c, "other-extensions", errors) : Set.of();
            if (images.isEmpty() && videos.isEmpty()) {
                errors.add("Nenhuma extensão configurada (image-extensions/video-extensions)");
            }
            Set<String> overlap = new HashSet<>(images);
            overlap.retainAll(videos);
            if (!overlap.isEmpty()) errors.add("Extensões em foto e vídeo ao mesmo tempo: " + overlap);

            Parallel parallel = new Parallel(
                    c.getBoolean("parallel.enabled"),
                    c.getInt("parallel.max-workers"),
                    c.getInt("parallel.cpu-multiplier"),
                    c.getInt("parallel.max-workers-limit"));
            if (parallel.maxWorkers() < 0) errors.add("'parallel.max-workers' não pode ser negativo");
            if (parallel.cpuMultiplier() < 1) errors.add("'parallel.cpu-multiplier' deve ser >= 1");
            if (parallel.maxWorkersLimit() < 1) errors.add("'parallel.max-workers-limit' deve ser >= 1");

            Performance performance = new Performance(
                    c.getInt("performance.buffer-size"),
                    c.getString("performance.hash-algorithm"),
                    c.getInt("performance.queue-capacity"),
                    c.getDuration("performance.file-timeout"));
            if (performance.bufferSize() <= 0) errors.add("'performance.buffer-size' deve ser positivo");
            if (performance.queueCapacity() <= 0) errors.add("'performance.queue-capacity' deve ser positivo");
            if (performance.fileTimeout().isNegative()) errors.add("'performance.file-timeout' não pode ser negativo");

            DatabaseSettings db = new DatabaseSettings(
                    c.getBoolean("database-config.vacuum-on-completion"),
                    c.getDuration("database-config.busy-timeout"),
                    c.getInt("database-config.busy-retries"),
                    c.getDuration("database-config.busy-backoff"));
            if (db.busyRetries() < 1) errors.add("'database-config.busy-retries' deve ser >= 1");

            if (!errors.isEmpty()) throw new ConfigValidationException(errors);

            ScanRules rules = new ScanRules(
                    c.getBoolean("exclude-hidden-dirs"),
                    c.getStringList("exclude-patterns"),
                    images, videos, others);

            return new OrganizerConfig(
                    Paths.get(source.trim()),
                    Paths.get(destination.trim()),
                    StringUtils.isBlank(database) ? null : Paths.get(database.trim()),
                    c.getBoolean("dry-run"),
                    transfer,
                    rules,
                    c.getStringList("photographic-prefixes"),
                    parallel,
                    performance,
                    db);
        } catch (ConfigException e) {
            throw new ConfigValidationException("Configuração inválida: " + e.getMessage(), e);
        }
    }

    private static Set<String> extensions(Config c, String key, List<String> errors) {
        Set<String> out = new HashSet<>();
        for (String ext : c.getStringList(key)) {
            String e = ext == null ? "" : ext.trim();
            if (!e.startsWith(".") || e.length() < 2) {
                errors.add("Extensão inválida em '" + key + "': \"" + ext + "\" (use .jpg)");
                continue;
            }
            out.add(e);
        }
        return out;
    }
}
