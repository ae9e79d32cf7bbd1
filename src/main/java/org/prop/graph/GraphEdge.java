package org.prop.graph;

/**
 * Arco padre -> figlio della descrizione a grafo.
 */
public final class GraphEdge {

    private final int parent;
    private final int child;

    GraphEdge(int parent, int child) {
        this.parent = parent;
        this.child = child;
    }

    public int parent() {
        return parent;
    }

    public int child() {
        return child;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        GraphEdge other = (GraphEdge) obj;
        return parent == other.parent && child == other.child;
    }

    @Override
    public int hashCode() {
        return 31 * parent + child;
    }

    @Override
    public String toString() {
        return parent + "->" + child;
    }
}
