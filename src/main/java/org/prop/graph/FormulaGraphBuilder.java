package org.prop.graph;

import org.prop.formula.Formula;
import org.prop.formula.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Costruisce la descrizione a grafo di una formula per i componenti di visualizzazione.
 *
 * Ogni nodo dell'albero diventa un {@link GraphNode} (visita anticipata, radice con id 0)
 * e ogni relazione padre-figlio un {@link GraphEdge}. Se viene fornito un assegnamento,
 * ogni nodo riporta il valore di verità del proprio sottoalbero.
 */
public class FormulaGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(FormulaGraphBuilder.class.getName());

    public FormulaGraph build(Formula formula) {
        return build(formula, null);
    }

    /**
     * @param formula formula da descrivere
     * @param assignment assegnamento per i valori dei nodi, null per un grafo senza valori
     * @throws org.prop.formula.MissingVariableException se l'assegnamento non copre la formula
     */
    public FormulaGraph build(Formula formula, Map<String, Boolean> assignment) {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        visit(formula, assignment, nodes, edges);
        LOGGER.fine("Grafo costruito: " + nodes.size() + " nodi, " + edges.size() + " archi");
        return new FormulaGraph(nodes, edges);
    }

    private int visit(Formula formula, Map<String, Boolean> assignment,
                      List<GraphNode> nodes, List<GraphEdge> edges) {
        int id = nodes.size();
        String text = formula.type() == Formula.Type.VAR ? ((Var) formula).name() : formula.type().name();
        Boolean value = assignment == null ? null : formula.evaluate(assignment);
        nodes.add(new GraphNode(id, formula.type(), text, formula.label(), value));

        for (Formula child : formula.children()) {
            int childId = visit(child, assignment, nodes, edges);
            edges.add(new GraphEdge(id, childId));
        }
        return id;
    }
}
