package com.photoorg.app.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração de ambiente do PhotoOrg.
 * Resolve o diretório de dados e o arquivo do banco a partir de
 * system properties, variáveis de ambiente ou do arquivo .env.
 */
public final class Config {

    private static final String APP_NAME = "PhotoOrg";

    private static final String DEFAULT_DB_NAME = "organizer.db";

    // Variáveis de ambiente (ordem de prioridade)
    private static final String ENV_DB_NAME = "PHOTOORG_DB_NAME";
    private static final String ENV_DATA_DIR = "PHOTOORG_DATA_DIR";
    private static final String ENV_CONFIG_FILE = "PHOTOORG_CONFIG";

    // System property overrides (tests/CI)
    private static final String PROP_DB_NAME = "photoorg.dbName";
    private static final String PROP_DATA_DIR = "photoorg.dataDir";
    private static final String PROP_CONFIG_FILE = "photoorg.config";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDbPathKey;
    private static volatile Path cachedDbPath;

    private Config() {}

    /**
     * Caminho padrão do banco SQLite quando a configuração não informa um.
     */
    public static Path getDbFilePath() {
        String dbFileName = resolveDbFileName();
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);

        String key = (overrideDir == null ? "" : overrideDir.trim()) + "|" + dbFileName;
        Path current = cachedDbPath;
        if (current != null && key.equals(cachedDbPathKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDbPath;
            if (current != null && key.equals(cachedDbPathKey)) {
                return current;
            }
            Path resolved = resolveDbPath(dbFileName);
            cachedDbPathKey = key;
            cachedDbPath = resolved;
            return resolved;
        }
    }

    public static String getDbUrl(Path dbFile) {
        return "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }

    /**
     * Arquivo HOCON do usuário, se configurado fora da linha de comando.
     */
    public static Path getUserConfigFile() {
        String v = getEnvOrDotenv(ENV_CONFIG_FILE);
        return v == null ? null : Paths.get(v);
    }

    // --- Lógica de Resolução ---

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null || name.isBlank() ? DEFAULT_DB_NAME : name.trim();
    }

    /**
     * System property, depois variável de ambiente, depois .env (java-dotenv).
     */
    private static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_CONFIG_FILE -> PROP_CONFIG_FILE;
            default -> null;
        };
    }

    private static Path resolveDbPath(String dbFileName) {
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);
        if (overrideDir != null && !overrideDir.isBlank()) {
            Path p = Paths.get(overrideDir.trim());
            logger.info("Banco de dados localizado em (override): {}", p.toAbsolutePath());
            return p.resolve(dbFileName);
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");
        Path appDataDir;

        if (os.contains("win")) {
            String appDataEnv = System.getenv("APPDATA");
            if (appDataEnv != null && !appDataEnv.isBlank()) {
                appDataDir = Paths.get(appDataEnv, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, "AppData", "Roaming", APP_NAME);
            }
        } else if (os.contains("mac")) {
            appDataDir = Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            // Linux/Unix: padrão XDG (~/.local/share/PhotoOrg)
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isBlank()) {
                appDataDir = Paths.get(xdgData, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, ".local", "share", APP_NAME);
            }
        }

        // O diretório só é criado quando o banco é aberto; aqui apenas checamos se é utilizável.
        if (Files.isDirectory(appDataDir) || canCreate(appDataDir)) {
            logger.debug("Banco de dados localizado em: {}", appDataDir.toAbsolutePath());
            return appDataDir.resolve(dbFileName);
        }
        Path localPath = Paths.get(dbFileName).toAbsolutePath();
        logger.warn("ERRO PERMISSÃO: não foi possível usar {}. Usando diretório local como fallback: {}", appDataDir, localPath);
        return localPath;
    }

    private static boolean canCreate(Path dir) {
        Path existing = dir.toAbsolutePath();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        return existing != null && Files.isWritable(existing);
    }
}
