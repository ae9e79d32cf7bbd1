package org.prop.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Listener ANTLR che trasforma gli errori lessicali in {@link FormulaParseException}
 * invece di stamparli su stderr e proseguire con il recupero automatico.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        throw new FormulaParseException("Errore lessicale alla riga " + line + ": " + msg, charPositionInLine);
    }
}
