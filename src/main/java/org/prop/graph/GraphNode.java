package org.prop.graph;

import org.prop.formula.Formula;

/**
 * Nodo della descrizione a grafo: uno per ogni nodo dell'albero della formula.
 */
public final class GraphNode {

    private final int id;
    private final Formula.Type kind;
    private final String text;
    private final String description;
    private final Boolean value;

    GraphNode(int id, Formula.Type kind, String text, String description, Boolean value) {
        this.id = id;
        this.kind = kind;
        this.text = text;
        this.description = description;
        this.value = value;
    }

    /** Identificativo progressivo in ordine di visita anticipata, radice = 0 */
    public int id() {
        return id;
    }

    public Formula.Type kind() {
        return kind;
    }

    /** Nome della variabile per i nodi VAR, nome del connettivo per gli altri */
    public String text() {
        return text;
    }

    /** Etichetta descrittiva del nodo della formula, null se assente */
    public String description() {
        return description;
    }

    /** Valore di verità del sottoalbero, null se il grafo è stato costruito senza assegnamento */
    public Boolean value() {
        return value;
    }

    @Override
    public String toString() {
        return id + ":" + text + (value == null ? "" : "=" + value);
    }
}
