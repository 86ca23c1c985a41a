package com.photoorg.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Banco SQLite do organizador: pool Hikari, migrações Flyway e Jdbi.
 */
public final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private static final List<String> SIDECAR_SUFFIXES = List.of("-wal", "-shm", "-journal");

    private final Path dbFile;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private Database(Path dbFile, HikariDataSource dataSource) {
        this.dbFile = dbFile;
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    /**
     * Abre (ou cria) o banco e aplica as migrações pendentes.
     *
     * @param dbFile      arquivo SQLite
     * @param maxPoolSize conexões simultâneas (uma por worker é suficiente)
     * @param busyTimeout espera máxima do SQLite por um lock antes de devolver SQLITE_BUSY
     */
    public static Database open(Path dbFile, int maxPoolSize, Duration busyTimeout) {
        Path abs = dbFile.toAbsolutePath().normalize();
        try {
            Path parent = abs.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Não foi possível criar diretório do banco: " + abs.getParent(), e);
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(Config.getDbUrl(abs));
        config.setPoolName("photoorg-sqlite");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(Math.max(2, maxPoolSize));
        // PRAGMAs aplicados pelo driver em cada conexão nova
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("busy_timeout", String.valueOf(Math.max(0, busyTimeout.toMillis())));

        HikariDataSource ds = new HikariDataSource(config);
        Database db = new Database(abs, ds);
        try {
            db.migrate();
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        logger.info("Banco aberto: {}", abs);
        return db;
    }

    private void migrate() {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    public Path file() {
        return dbFile;
    }

    /**
     * VACUUM + ANALYZE ao final de uma sessão real.
     */
    public void optimize() {
        try {
            jdbi.useHandle(h -> {
                h.execute("PRAGMA wal_checkpoint(TRUNCATE)");
                h.execute("VACUUM");
                h.execute("ANALYZE");
            });
            logger.info("Banco otimizado (VACUUM/ANALYZE)");
        } catch (RuntimeException e) {
            logger.warn("Falha ao otimizar o banco {}", dbFile, e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }

    /**
     * Remove o arquivo do banco e os arquivos auxiliares (-wal, -shm).
     *
     * @return true se algum arquivo foi removido
     */
    public static boolean deleteFiles(Path dbFile) throws IOException {
        boolean removed = Files.deleteIfExists(dbFile);
        for (String suffix : SIDECAR_SUFFIXES) {
            Path sidecar = dbFile.resolveSibling(dbFile.getFileName().toString() + suffix);
            removed |= Files.deleteIfExists(sidecar);
        }
        return removed;
    }
}
