package com.photoorg.app.scan;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Percorre a árvore de origem e entrega cada arquivo aceito ao consumidor,
 * na ordem da caminhada em profundidade. Não segue links simbólicos.
 *
 * <p>Sem estado entre chamadas: pode ser executado de novo sobre a mesma raiz.
 */
public final class PathScanner {

    private static final Logger logger = LoggerFactory.getLogger(PathScanner.class);

    private static final String GLOB_CHARS = "*?[{";

    private final ScanRules rules;
    private final List<PathMatcher> globMatchers;
    private final Set<String> excludedNames;

    public PathScanner(ScanRules rules) {
        this.rules = rules;
        this.globMatchers = compileMatchers(rules.excludePatterns());
        this.excludedNames = literalNames(rules.excludePatterns());
    }

    /**
     * @param sink    recebe os candidatos; pode bloquear (fila cheia)
     * @param cancel  interrompe a caminhada quando true
     */
    public void scan(Path root, Consumer<CandidatePath> sink, ScanMetrics metrics, AtomicBoolean cancel) throws IOException {
        final Path rootAbs = root.toAbsolutePath().normalize();

        Files.walkFileTree(
            rootAbs,
            EnumSet.noneOf(FileVisitOption.class),
            Integer.MAX_VALUE,
            new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) return FileVisitResult.TERMINATE;
                    if (dir.equals(rootAbs)) return FileVisitResult.CONTINUE;

                    if (isExcluded(rootAbs.relativize(dir))) {
                        metrics.dirsSkipped.increment();
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) return FileVisitResult.TERMINATE;

                    if (attrs.isSymbolicLink()) {
                        if (!Files.exists(file)) {
                            logger.warn("Link simbólico quebrado ignorado: {}", file);
                            metrics.scanErrors.increment();
                        } else {
                            logger.debug("Link simbólico não seguido: {}", file);
                            metrics.filesSkipped.increment();
                        }
                        return FileVisitResult.CONTINUE;
                    }
                    if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;

                    if (isExcluded(rootAbs.relativize(file))) {
                        metrics.filesSkipped.increment();
                        return FileVisitResult.CONTINUE;
                    }

                    Optional<MediaType> type = rules.mediaTypeOf(file.getFileName().toString());
                    if (type.isEmpty()) {
                        metrics.filesSkipped.increment();
                        return FileVisitResult.CONTINUE;
                    }

                    metrics.candidates.increment();
                    sink.accept(new CandidatePath(file, type.get()));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Não foi possível acessar {}: {}", file, exc.toString());
                    metrics.scanErrors.increment();
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        logger.warn("Listagem incompleta de {}: {}", dir, exc.toString());
                        metrics.scanErrors.increment();
                    }
                    return FileVisitResult.CONTINUE;
                }
            }
        );
    }

    /**
     * Conveniência: caminhada completa em memória.
     */
    public List<CandidatePath> collect(Path root, ScanMetrics metrics) throws IOException {
        List<CandidatePath> out = new ArrayList<>();
        scan(root, out::add, metrics, new AtomicBoolean(false));
        return out;
    }

    boolean isExcluded(Path rel) {
        String name = rel.getFileName() == null ? "" : rel.getFileName().toString();
        if (rules.excludeHidden() && name.startsWith(".")) return true;

        for (Path element : rel) {
            if (excludedNames.contains(element.toString())) return true;
        }

        if (!globMatchers.isEmpty()) {
            Path nameOnly = Paths.get(name);
            for (PathMatcher m : globMatchers) {
                if (m.matches(rel) || m.matches(nameOnly)) return true;
            }
        }
        return false;
    }

    private static boolean isGlob(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (GLOB_CHARS.indexOf(pattern.charAt(i)) >= 0) return true;
        }
        return false;
    }

    private static List<PathMatcher> compileMatchers(List<String> patterns) {
        var fs = FileSystems.getDefault();
        var out = new ArrayList<PathMatcher>();
        for (String p : patterns) {
            if (p == null || p.isBlank() || !isGlob(p)) continue;
            out.add(fs.getPathMatcher("glob:" + p.trim()));
        }
        return out;
    }

    private static Set<String> literalNames(List<String> patterns) {
        var out = new HashSet<String>();
        for (String p : patterns) {
            if (p == null || p.isBlank() || isGlob(p)) continue;
            out.add(p.trim());
        }
        return Set.copyOf(out);
    }
}
