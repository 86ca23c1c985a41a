package com.photoorg.app.organize;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.index.DuplicateIndex;

/**
 * Coloca arquivos na árvore de destino sem nunca sobrescrever.
 *
 * <p>No modo real os bytes vão primeiro para um temporário irmão exclusivo
 * ({@code .nome.hash8.aleatorio.part}) e só então ganham o nome final, por
 * hard link (falha se o nome existe) ou, sem suporte a links, por rename.
 * No dry-run nada é escrito: a ocupação simulada fica em memória para que
 * colisões entre arquivos da mesma execução apareçam como apareceriam de verdade.
 */
public final class Placer {

    private static final Logger logger = LoggerFactory.getLogger(Placer.class);

    static final String PART_SUFFIX = ".part";

    private final Path destRoot;
    private final TransferMode mode;
    private final boolean dryRun;
    private final SourceRemoval sourceRemoval;
    private final Set<String> simulated = ConcurrentHashMap.newKeySet();

    /** Remoção da origem no modo MOVE. */
    @FunctionalInterface
    interface SourceRemoval {
        void remove(Path source) throws IOException;
    }

    public Placer(Path destRoot, TransferMode mode, boolean dryRun) {
        this(destRoot, mode, dryRun, Files::delete);
    }

    Placer(Path destRoot, TransferMode mode, boolean dryRun, SourceRemoval sourceRemoval) {
        this.destRoot = destRoot.toAbsolutePath().normalize();
        this.mode = Objects.requireNonNull(mode, "mode");
        this.dryRun = dryRun;
        this.sourceRemoval = Objects.requireNonNull(sourceRemoval, "sourceRemoval");
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public TransferMode mode() {
        return mode;
    }

    public Path destRoot() {
        return destRoot;
    }

    /**
     * Primeira tentativa de {@link CollisionNames} cujo caminho está livre no disco
     * (ou na ocupação simulada).
     */
    public int firstFreeAttempt(String relativePath, String hash) throws PlacementException {
        for (int attempt = 0; attempt < DuplicateIndex.MAX_DESTINATION_ATTEMPTS; attempt++) {
            if (!isOccupied(CollisionNames.candidate(relativePath, hash, attempt))) {
                return attempt;
            }
        }
        throw new PlacementException("Nenhum nome livre para " + relativePath, true, null);
    }

    /**
     * Coloca {@code source} exatamente em {@code relativePath}.
     *
     * @throws PlacementException com {@link PlacementException#isCollision()} se o destino já existe
     */
    public Path place(Path source, String relativePath, String hash) throws PlacementException {
        Path target = resolve(relativePath);
        if (dryRun) {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS) || !simulated.add(relativePath)) {
                throw new PlacementException("Destino já existe: " + relativePath, true, null);
            }
            logger.debug("[DRY-RUN] {} -> {}", source, relativePath);
            return target;
        }

        Path parent = target.getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new PlacementException("Não foi possível criar " + parent, e);
        }

        Path temp = parent.resolve(tempName(target.getFileName().toString(), hash));
        try (InputStream in = Files.newInputStream(source)) {
            Files.copy(in, temp);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PlacementException("Falha copiando " + source + " para " + relativePath, e);
        }
        copyModifiedTime(source, temp);

        try {
            publish(temp, target);
        } catch (FileAlreadyExistsException e) {
            deleteQuietly(temp);
            throw new PlacementException("Destino já existe: " + relativePath, true, e);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PlacementException("Falha movendo temporário para " + relativePath, e);
        }

        if (mode == TransferMode.MOVE) {
            try {
                sourceRemoval.remove(source);
            } catch (IOException e) {
                deleteQuietly(target);
                throw new PlacementException("Origem não pôde ser removida, destino desfeito: " + source, e);
            }
        }
        return target;
    }

    /**
     * Coloca uma duplicata, avançando no sufixo de colisão até achar um nome livre.
     *
     * @return caminho relativo final
     */
    public String placeWithSuffix(Path source, String relativePath, String hash) throws PlacementException {
        int attempt = firstFreeAttempt(relativePath, hash);
        PlacementException last = null;
        for (; attempt < DuplicateIndex.MAX_DESTINATION_ATTEMPTS; attempt++) {
            String rel = CollisionNames.candidate(relativePath, hash, attempt);
            try {
                place(source, rel, hash);
                return rel;
            } catch (PlacementException e) {
                if (!e.isCollision()) throw e;
                last = e;
            }
        }
        throw new PlacementException("Nenhum nome livre para " + relativePath, true, last);
    }

    public Path resolve(String relativePath) {
        Path target = destRoot.resolve(relativePath).normalize();
        if (!target.startsWith(destRoot) || target.equals(destRoot)) {
            throw new IllegalArgumentException("Destino fora da raiz: " + relativePath);
        }
        return target;
    }

    /**
     * Remove temporários {@code .part} deixados por uma execução interrompida.
     * Chamar antes de qualquer colocação da sessão.
     *
     * @return quantos foram removidos
     */
    public int sweepPartials() throws IOException {
        if (dryRun || !Files.isDirectory(destRoot)) return 0;
        List<Path> partials;
        try (Stream<Path> s = Files.walk(destRoot)) {
            partials = s.filter(p -> isPartial(p.getFileName().toString()))
                    .filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .toList();
        }
        for (Path p : partials) {
            Files.deleteIfExists(p);
            logger.info("Temporário antigo removido: {}", p);
        }
        return partials.size();
    }

    static String tempName(String fileName, String hash) {
        String unique = UUID.randomUUID().toString().substring(0, 8);
        return "." + fileName + "." + CollisionNames.hashPrefix(hash) + "." + unique + PART_SUFFIX;
    }

    static boolean isPartial(String fileName) {
        return fileName.startsWith(".") && fileName.endsWith(PART_SUFFIX) && fileName.length() > PART_SUFFIX.length() + 1;
    }

    /**
     * Dá ao temporário o nome final sem nunca substituir um arquivo existente.
     */
    private static void publish(Path temp, Path target) throws IOException {
        try {
            Files.createLink(target, temp);
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (UnsupportedOperationException | FileSystemException e) {
            logger.debug("Hard link indisponível para {}, usando rename: {}", target, e.toString());
            Files.move(temp, target);
            return;
        }
        deleteQuietly(temp);
    }

    private boolean isOccupied(String relativePath) {
        return simulated.contains(relativePath) || Files.exists(resolve(relativePath), LinkOption.NOFOLLOW_LINKS);
    }

    private static void copyModifiedTime(Path from, Path to) {
        try {
            Files.setLastModifiedTime(to, Files.getLastModifiedTime(from));
        } catch (IOException e) {
            logger.debug("Não foi possível preservar mtime de {}", from, e);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            logger.warn("Artefato parcial não removido: {}", p, e);
        }
    }
}
