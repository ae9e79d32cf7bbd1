package org.prop.formula;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Variabile proposizionale, unica foglia dell'albero.
 * Il nome è la chiave usata negli assegnamenti di verità.
 */
public final class Var extends Formula {

    /** Stessa classe di caratteri dei token IDENTIFIER del lexer: niente spazi Unicode né parentesi */
    private static final Pattern IDENTIFIER = Pattern.compile("[^\\p{IsWhite_Space}()]+");

    /** Parole chiave che il lexer non restituisce mai come identificatori */
    private static final Set<String> KEYWORDS = Set.of("NOT", "AND", "OR", "IMPLIES", "IFF");

    /** Nome della variabile: un identificatore rileggibile dal parser */
    private final String name;

    /**
     * @param name nome della variabile
     * @throws FormulaConstructionException se il nome è null, vuoto, contiene spazi o
     *         parentesi oppure coincide con una parola chiave
     */
    public Var(String name) {
        this(name, null);
    }

    public Var(String name, String label) {
        super(Type.VAR, label);
        if (name == null || name.isEmpty()) {
            throw new FormulaConstructionException("Nome variabile non può essere null o vuoto");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new FormulaConstructionException("Nome variabile non valido (spazi o parentesi): \"" + name + "\"");
        }
        if (KEYWORDS.contains(name)) {
            throw new FormulaConstructionException("Nome variabile riservato: " + name);
        }
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public List<Formula> children() {
        return List.of();
    }

    @Override
    public Var withLabel(String label) {
        return new Var(name, label);
    }
}
