package org.prop.formula;

/**
 * Eccezione base per tutti gli errori rilevati dal nucleo di logica proposizionale.
 *
 * Gli errori del nucleo non sono mai fatali per il processo: vengono sollevati nel punto
 * di rilevamento e propagati al chiamante, che decide come riportarli all'utente.
 * Nessuna operazione restituisce alberi parziali o semanticamente errati in caso di errore.
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
