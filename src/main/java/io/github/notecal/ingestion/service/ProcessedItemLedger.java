package io.github.notecal.ingestion.service;

import java.util.Set;

/**
 * Registro append-only dos itens de origem já convertidos em eventos.
 * Um id, uma vez registrado, nunca é removido.
 */
public interface ProcessedItemLedger {

    /**
     * Ids persistidos até o momento da chamada.
     *
     * @throws io.github.notecal.ingestion.domain.exception.LedgerException se o registro estiver ilegível
     */
    Set<String> snapshot();

    /**
     * Registra o id de forma durável antes de retornar. Registrar um id já presente não tem efeito.
     *
     * @throws io.github.notecal.ingestion.domain.exception.LedgerException se a escrita falhar
     */
    void commit(String itemId);

    /**
     * Ids aceitos pelo registro: não vazios, sem quebra de linha e sem espaços nas bordas.
     */
    static boolean isValidId(String itemId) {
        return itemId != null
                && !itemId.isBlank()
                && itemId.indexOf('\n') < 0
                && itemId.indexOf('\r') < 0
                && itemId.equals(itemId.strip());
    }
}
