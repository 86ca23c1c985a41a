package com.photoorg.app.index;

/**
 * Contadores finais de uma sessão.
 */
public record SessionTotals(
        long filesSeen,
        long organized,
        long duplicates,
        long review,
        long errors,
        long scanErrors
) {

    public static SessionTotals empty() {
        return new SessionTotals(0, 0, 0, 0, 0, 0);
    }

    /** Arquivos com destino decidido (inclui erros). */
    public long settled() {
        return organized + duplicates + review + errors;
    }
}
