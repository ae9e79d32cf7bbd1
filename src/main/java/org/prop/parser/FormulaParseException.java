package org.prop.parser;

import org.prop.formula.FormulaException;

/**
 * Errore di sintassi nel testo di una formula.
 *
 * Riporta la posizione (offset in caratteri dall'inizio del testo) del token che ha
 * causato il rifiuto, oppure la lunghezza del testo per errori di fine input.
 */
public class FormulaParseException extends FormulaException {

    /** Offset del carattere in cui è stato rilevato l'errore */
    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " (posizione " + position + ")");
        this.position = position;
    }

    public FormulaParseException(String message, int position, Throwable cause) {
        super(message + " (posizione " + position + ")", cause);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
