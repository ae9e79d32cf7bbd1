package org.prop.graph;

import java.util.List;

/**
 * Descrizione astratta nodi/archi di una formula, indipendente dal motore di rendering.
 */
public final class FormulaGraph {

    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;

    FormulaGraph(List<GraphNode> nodes, List<GraphEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public GraphNode root() {
        return nodes.get(0);
    }

    /**
     * @return true se i nodi riportano i valori di verità di un assegnamento
     */
    public boolean hasValues() {
        return root().value() != null;
    }
}
