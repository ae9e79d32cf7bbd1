package org.prop;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Formato testuale piatto chiave/valore per gli assegnamenti di verità: {@code p=true,q=false}.
 *
 * Valori accettati (senza distinzione tra maiuscole e minuscole): true/false, t/f, 1/0.
 * Separatori ammessi tra le coppie: virgola o punto e virgola.
 */
public final class TruthAssignmentFormat {

    private TruthAssignmentFormat() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param text assegnamento in formato testuale
     * @return mappa immutabile nome -> valore, nell'ordine del testo
     * @throws IllegalArgumentException se il testo non è ben formato o ripete una variabile
     */
    public static Map<String, Boolean> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Assegnamento di verità vuoto");
        }

        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (String pair : text.split("[,;]")) {
            if (pair.isBlank()) continue;

            int separator = pair.indexOf('=');
            if (separator <= 0 || separator == pair.length() - 1) {
                throw new IllegalArgumentException("Coppia non valida (atteso nome=valore): " + pair.trim());
            }

            String name = pair.substring(0, separator).trim();
            String value = pair.substring(separator + 1).trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Nome variabile vuoto in: " + pair.trim());
            }
            if (assignment.put(name, parseValue(value)) != null) {
                throw new IllegalArgumentException("Variabile assegnata più volte: " + name);
            }
        }

        if (assignment.isEmpty()) {
            throw new IllegalArgumentException("Assegnamento di verità vuoto");
        }
        return Collections.unmodifiableMap(assignment);
    }

    private static boolean parseValue(String value) {
        switch (value.toLowerCase()) {
            case "true", "t", "1":
                return true;
            case "false", "f", "0":
                return false;
            default:
                throw new IllegalArgumentException("Valore di verità non valido: " + value);
        }
    }

    /**
     * Operazione inversa di {@link #parse(String)}.
     */
    public static String format(Map<String, Boolean> assignment) {
        StringJoiner joiner = new StringJoiner(",");
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            joiner.add(entry.getKey() + "=" + entry.getValue());
        }
        return joiner.toString();
    }
}
