package com.photoorg.app.index;

/**
 * Resultado de {@link DuplicateIndex#claim(ClaimRequest)}.
 */
public sealed interface ClaimResult permits ClaimResult.Won, ClaimResult.LostTo {

    /**
     * O registro canônico é deste worker.
     */
    record Won(FileRecord record) implements ClaimResult {
        public String destination() {
            return record.destPath();
        }
    }

    /**
     * Outro registro já é dono do conteúdo.
     *
     * @param existingDestination destino do registro canônico
     * @param existingSessionId   sessão que gravou o registro canônico
     * @param priorPlacement      destino já gravado para o mesmo arquivo de origem, ou null
     */
    record LostTo(String existingDestination, long existingSessionId, String priorPlacement) implements ClaimResult {
        public boolean alreadyPlaced() {
            return priorPlacement != null;
        }
    }
}
