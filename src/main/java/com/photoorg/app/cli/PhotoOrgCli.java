package com.photoorg.app.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.config.Config;
import com.photoorg.app.config.ConfigValidationException;
import com.photoorg.app.config.OrganizerConfig;
import com.photoorg.app.database.BusyRetry;
import com.photoorg.app.database.Database;
import com.photoorg.app.index.SessionRow;
import com.photoorg.app.index.SessionStatus;
import com.photoorg.app.index.SqliteDuplicateIndex;
import com.photoorg.app.maintenance.ResetService;
import com.photoorg.app.pipeline.Organizer;
import com.photoorg.app.pipeline.PreRunValidationException;
import com.photoorg.app.pipeline.SessionSummary;
import com.photoorg.app.report.ReportExporter;
import com.photoorg.app.report.StatsReport;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

public final class PhotoOrgCli {

    private static final Logger logger = LoggerFactory.getLogger(PhotoOrgCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELED = 130;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    PhotoOrgCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        run(args);
    }

    public static void run(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        return new PhotoOrgCli(System.in, System.out, System.err).dispatch(args);
    }

    int dispatch(String[] args) {
        if (args == null) args = new String[0];
        if (args.length == 0 && Config.getUserConfigFile() == null) {
            printUsage();
            return EXIT_OK;
        }

        // sem subcomando: execução padrão (organizar)
        String cmd = args.length == 0 || args[0].startsWith("-") ? "run" : safeLower(args[0]);
        String[] rest = "run".equals(cmd) && (args.length == 0 || args[0].startsWith("-"))
                ? args
                : Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "run" -> runOrganize(rest);
                case "stats" -> runStats(rest);
                case "export" -> runExport(rest);
                case "history" -> runHistory(rest);
                case "help" -> {
                    printUsage();
                    yield EXIT_OK;
                }
                default -> {
                    err.println("Comando invalido: " + args[0]);
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (ConfigValidationException e) {
            err.println("Configuração inválida:");
            for (String v : e.violations()) {
                err.println("  - " + v);
            }
            return EXIT_USAGE;
        } catch (Exception e) {
            logger.error("Erro fatal", e);
            err.println("Erro fatal: " + safeMsg(e));
            return EXIT_FAILURE;
        }
    }

    // ----------------- run / reset -----------------

    private int runOrganize(String[] args) throws IOException {
        ParseResult<RunArgs> parsed = RunArgs.parse(args);
        if (parsed.help()) {
            printUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printUsage();
            return EXIT_USAGE;
        }

        RunArgs a = parsed.value();
        OrganizerConfig config = OrganizerConfig.load(a.configFile(), a.overrides());

        if (a.reset()) {
            return runReset(config, a.yes());
        }

        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicInteger exitCode = new AtomicInteger(EXIT_CANCELED);

        // Ctrl+C / kill: pede parada e segura a JVM até a sessão ser fechada
        Thread cancelHook = new Thread(() -> {
            System.err.println("Cancelamento solicitado (shutdown hook) em " + Instant.now());
            if (cancelAndAwait(cancel, finished, SHUTDOWN_GRACE)) {
                out.flush();
                System.err.flush();
                Runtime.getRuntime().halt(exitCode.get());
            }
            System.err.println("Sessão não terminou em " + SHUTDOWN_GRACE.toSeconds() + "s; saindo assim mesmo");
        }, "photoorg-cli-cancel");
        boolean hooked = false;
        try {
            Runtime.getRuntime().addShutdownHook(cancelHook);
            hooked = true;
        } catch (IllegalStateException e) {
            logger.debug("Shutdown hook não registrado: {}", e.getMessage());
        }

        try {
            SessionSummary summary = new Organizer(config).run(cancel);
            out.println(summary.describe());
            if (summary.database() != null) {
                out.println("Banco: " + summary.database());
            }
            if (summary.status() == SessionStatus.CANCELED) {
                exitCode.set(EXIT_CANCELED);
            } else {
                exitCode.set(summary.status() == SessionStatus.COMPLETED ? EXIT_OK : EXIT_FAILURE);
            }
            return exitCode.get();
        } catch (PreRunValidationException e) {
            err.println("Execução recusada: " + safeMsg(e));
            exitCode.set(EXIT_USAGE);
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            exitCode.set(EXIT_FAILURE);
            throw e;
        } finally {
            finished.countDown();
            if (hooked) {
                try {
                    Runtime.getRuntime().removeShutdownHook(cancelHook);
                } catch (IllegalStateException e) {
                    logger.debug("JVM já em shutdown; hook mantido");
                }
            }
        }
    }

    /**
     * Liga o pedido de parada e espera a sessão terminar.
     *
     * @return false se o prazo acabou antes
     */
    static boolean cancelAndAwait(AtomicBoolean cancel, CountDownLatch finished, Duration grace) {
        cancel.set(true);
        try {
            return finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private int runReset(OrganizerConfig config, boolean yes) throws IOException {
        Path db = Organizer.databaseFile(config);
        ResetService reset = new ResetService(config.destination(), db, config.source(), ResetService.currentLogFile());
        List<Path> targets = reset.plan();
        if (targets.isEmpty()) {
            out.println("Nada para remover.");
            return EXIT_OK;
        }

        out.println("Serão removidos:");
        for (Path p : targets) {
            out.println("  " + p);
        }
        if (!yes && !confirm("Confirmar reset? [s/N] ")) {
            out.println("Reset cancelado.");
            return EXIT_OK;
        }

        ResetService.ResetResult result = reset.execute();
        out.printf("Reset concluído: banco %s, log %s, %d pastas removidas%n",
                result.databaseRemoved() ? "removido" : "inexistente",
                result.logRemoved() ? "removido" : "inexistente", result.foldersRemoved());
        return EXIT_OK;
    }

    private boolean confirm(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line = reader.readLine();
        String answer = safeLower(line);
        return answer.equals("s") || answer.equals("sim") || answer.equals("y") || answer.equals("yes");
    }

    // ----------------- stats / export / history -----------------

    private int runStats(String[] args) {
        ParseResult<StoreArgs> parsed = StoreArgs.parse(args, false);
        if (parsed.help()) {
            printStoreUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printStoreUsage();
            return EXIT_USAGE;
        }

        Path db = resolveDatabase(parsed.value());
        if (!Files.isRegularFile(db)) {
            out.println("Sem banco em " + db);
            return EXIT_OK;
        }
        try (SqliteDuplicateIndex index = openIndex(db)) {
            out.print(StatsReport.of(index).render());
        }
        return EXIT_OK;
    }

    private int runExport(String[] args) throws IOException {
        ParseResult<StoreArgs> parsed = StoreArgs.parse(args, true);
        if (parsed.help()) {
            printStoreUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printStoreUsage();
            return EXIT_USAGE;
        }

        Path db = resolveDatabase(parsed.value());
        if (!Files.isRegularFile(db)) {
            err.println("Sem banco em " + db);
            return EXIT_FAILURE;
        }
        Path target = Path.of(parsed.value().out());
        try (SqliteDuplicateIndex index = openIndex(db)) {
            int n = ReportExporter.exportCsv(index.records(), target);
            out.println("Exportados " + n + " registros para " + target.toAbsolutePath());
        }
        return EXIT_OK;
    }

    private int runHistory(String[] args) {
        ParseResult<StoreArgs> parsed = StoreArgs.parse(args, false);
        if (parsed.help()) {
            printStoreUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printStoreUsage();
            return EXIT_USAGE;
        }

        Path db = resolveDatabase(parsed.value());
        if (!Files.isRegularFile(db)) {
            out.println("Sem historico de sessões.");
            return EXIT_OK;
        }

        List<SessionRow> rows;
        try (SqliteDuplicateIndex index = openIndex(db)) {
            rows = index.sessions(parsed.value().limit());
        }
        if (rows.isEmpty()) {
            out.println("Sem historico de sessões.");
            return EXIT_OK;
        }

        out.println("id | status | inicio | duração | vistos | organizados | duplicados | revisão | erros | origem");
        for (SessionRow row : rows) {
            out.printf(
                    "%d | %s%s | %s | %s | %d | %d | %d | %d | %d | %s%n",
                    row.id(),
                    row.status(),
                    row.dryRun() ? " (dry-run)" : "",
                    row.startedAt(),
                    row.durationMs() == null ? "-" : Duration.ofMillis(row.durationMs()).toSeconds() + "s",
                    row.totals().filesSeen(),
                    row.totals().organized(),
                    row.totals().duplicates(),
                    row.totals().review(),
                    row.totals().errors(),
                    safeText(row.sourceRoot())
            );
        }
        return EXIT_OK;
    }

    private static SqliteDuplicateIndex openIndex(Path db) {
        Database database = Database.open(db, 2, Duration.ofSeconds(30));
        return new SqliteDuplicateIndex(database, new BusyRetry(6, Duration.ofMillis(50)), true);
    }

    /**
     * --db, depois a chave photoorg.database do --config, depois o padrão do ambiente.
     */
    private static Path resolveDatabase(StoreArgs a) {
        if (!isBlank(a.db())) return Path.of(a.db());
        Path configFile = a.configFile() != null ? a.configFile() : Config.getUserConfigFile();
        if (configFile != null && Files.isRegularFile(configFile)) {
            try {
                com.typesafe.config.Config c = ConfigFactory.parseFile(configFile.toFile());
                String key = OrganizerConfig.ROOT + ".database";
                if (c.hasPath(key) && !isBlank(c.getString(key))) {
                    return Path.of(c.getString(key).trim());
                }
            } catch (ConfigException e) {
                throw new ConfigValidationException("Arquivo de configuração inválido: " + e.getMessage(), e);
            }
        }
        return Config.getDbFilePath();
    }

    // ----------------- usage -----------------

    private void printUsage() {
        out.println("""
                PhotoOrg CLI
                Uso:
                  [run] --source <origem> --dest <destino> [opções]
                  [run] --reset [--yes] --source <origem> --dest <destino>
                  stats   [--db <arquivo>] [--config <arquivo>]
                  export  --out <arquivo.csv> [--db <arquivo>] [--config <arquivo>]
                  history [--limit <n>] [--db <arquivo>] [--config <arquivo>]
                  help

                Opções de execução:
                  --config <arquivo>   configuração HOCON (sobrescreve os padrões)
                  --source <dir>       pasta de origem (nunca é alterada no modo copy)
                  --dest <dir>         pasta de destino
                  --db <arquivo>       banco SQLite
                  --dry-run            simula sem escrever nada
                  --move               move em vez de copiar
                  --workers <n>        quantidade de workers
                  --reset              apaga o banco e as pastas de categoria do destino
                  --yes                não pede confirmação no reset
                """);
    }

    private void printStoreUsage() {
        out.println("""
                Uso:
                  stats   [--db <arquivo>] [--config <arquivo>]
                  export  --out <arquivo.csv> [--db <arquivo>] [--config <arquivo>]
                  history [--limit <n>] [--db <arquivo>] [--config <arquivo>]

                Exemplo:
                  history --limit 50
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    private record RunArgs(Path configFile, Map<String, Object> overrides, boolean reset, boolean yes) {
        static ParseResult<RunArgs> parse(String[] args) {
            Path configFile = Config.getUserConfigFile();
            Map<String, Object> overrides = new LinkedHashMap<>();
            boolean reset = false;
            boolean yes = false;
            String root = OrganizerConfig.ROOT + ".";

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--config" -> configFile = Path.of(c.requireNext("--config"));
                        case "--source" -> overrides.put(root + "source", c.requireNext("--source"));
                        case "--dest" -> overrides.put(root + "destination", c.requireNext("--dest"));
                        case "--db" -> overrides.put(root + "database", c.requireNext("--db"));
                        case "--dry-run" -> overrides.put(root + "dry-run", true);
                        case "--move" -> overrides.put(root + "transfer", "move");
                        case "--workers" -> {
                            int n = Integer.parseInt(c.requireNext("--workers").trim());
                            if (n < 1) return ParseResult.errorResult("--workers deve ser >= 1");
                            overrides.put(root + "parallel.max-workers", n);
                        }
                        case "--reset" -> reset = true;
                        case "--yes", "-y" -> yes = true;
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor invalido para --workers");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new RunArgs(configFile, overrides, reset, yes));
        }
    }

    private record StoreArgs(String db, Path configFile, int limit, String out) {
        static ParseResult<StoreArgs> parse(String[] args, boolean requireOut) {
            String db = null;
            Path configFile = null;
            String out = null;
            int limit = 20;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--db" -> db = c.requireNext("--db");
                        case "--config" -> configFile = Path.of(c.requireNext("--config"));
                        case "--out" -> out = c.requireNext("--out");
                        case "--limit" -> {
                            String v = c.requireNext("--limit");
                            int n = Integer.parseInt(v.trim());
                            limit = Math.max(1, n);
                        }
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor invalido para --limit");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (requireOut && isBlank(out)) {
                return ParseResult.errorResult("Parametro obrigatorio: --out");
            }
            return ParseResult.okResult(new StoreArgs(db, configFile, limit, out));
        }
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return isBlank(v) ? "-" : v;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
