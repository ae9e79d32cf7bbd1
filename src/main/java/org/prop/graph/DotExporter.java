package org.prop.graph;

/**
 * Esporta un {@link FormulaGraph} in formato Graphviz DOT.
 * Con valori presenti i nodi veri sono verdi e quelli falsi rossi.
 */
public final class DotExporter {

    private static final String TRUE_COLOR = "palegreen";
    private static final String FALSE_COLOR = "lightcoral";

    private DotExporter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static String export(FormulaGraph graph) {
        StringBuilder dot = new StringBuilder("digraph formula {\n");
        dot.append("    node [shape=box, fontname=\"Helvetica\"];\n");

        for (GraphNode node : graph.nodes()) {
            dot.append("    n").append(node.id()).append(" [label=\"").append(escape(node.text())).append('"');
            if (node.description() != null) {
                dot.append(", tooltip=\"").append(escape(node.description())).append('"');
            }
            if (node.value() != null) {
                dot.append(", style=filled, fillcolor=").append(node.value() ? TRUE_COLOR : FALSE_COLOR);
            }
            dot.append("];\n");
        }

        for (GraphEdge edge : graph.edges()) {
            dot.append("    n").append(edge.parent()).append(" -> n").append(edge.child()).append(";\n");
        }

        return dot.append("}\n").toString();
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
