package io.github.notecal.ingestion.domain.exception;

/**
 * Falha de leitura ou escrita do registro de itens processados. Interrompe a execução inteira.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
