package com.photoorg.app.index;

import java.util.List;
import java.util.Optional;

/**
 * Índice compartilhado de conteúdo já visto.
 *
 * <p>O claim é a única serialização entre workers: a tentativa de inserir o
 * registro canônico, com unicidade por hash e por destino, decide quem fica
 * com o conteúdo. Não existe verificação separada antes da inserção.
 * Implementações são thread-safe.
 */
public interface DuplicateIndex extends AutoCloseable {

    /** Tentativas de nome de colisão antes de desistir do arquivo. */
    int MAX_DESTINATION_ATTEMPTS = 64;

    long openSession(SessionStart start);

    void closeSession(long sessionId, SessionStatus status, SessionTotals totals, long durationMs);

    /**
     * Insere o registro canônico ou devolve o dono atual do conteúdo.
     *
     * @throws IllegalStateException se nenhum nome de destino livre foi encontrado
     */
    ClaimResult claim(ClaimRequest request);

    /**
     * Desfaz um claim vencido cujo arquivo não pôde ser colocado no destino.
     */
    void release(ClaimResult.Won claim);

    /**
     * Grava um registro não canônico (duplicate ou error).
     */
    FileRecord append(FileRecord record);

    Optional<FileRecord> findCanonical(String hash);

    /** Todos os registros em ordem de inserção. */
    List<FileRecord> records();

    List<FileRecord> records(long sessionId);

    /** Sessões mais recentes primeiro. */
    List<SessionRow> sessions(int limit);

    /** false para o índice em memória do dry-run. */
    boolean isDurable();

    @Override
    void close();
}
