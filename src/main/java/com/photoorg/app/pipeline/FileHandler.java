package com.photoorg.app.pipeline;

/**
 * Trabalho feito por um worker para cada arquivo.
 */
public interface FileHandler {

    /**
     * Processa o arquivo até o fim. Deve chamar {@link FileJob#settle} antes de
     * gravar o registro final; se o settle falhar o resultado é descartado.
     */
    void handle(FileJob job) throws Exception;

    /**
     * Grava o registro de erro de um job já finalizado como ERROR. Não lança.
     */
    void recordFailure(FileJob job, Throwable cause);
}
