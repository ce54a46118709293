package dfasim;

import java.util.stream.Stream;

/**
 * Graphviz rendering of a state diagram.
 *
 * @param <V> vertices (states)
 * @param <E> edge labels
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   * @param sink is this a state runs never leave?
   */
  record Vertex<V>(V id, boolean accepting, boolean sink) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edges starts (or no vertex if `null`)
   * @param to vertex where the edges ends
   * @param label label on the edge
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return plain text label (escaped later)
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : label.toString();
  }

  /**
   * Render a full Dot graph.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final String shape;
      if (vertex.accepting()) {
        shape = "doublecircle";
      } else if (vertex.sink()) {
        shape = "box";
      } else {
        shape = "circle";
      }
      builder.append("  " + id + " [shape = " + shape + ", label = <" + escapeHtml(vertex.id().toString()) + ">];\n");
    }

    // Edges (an edge without a source marks the initial state)
    boolean hasEntry = false;
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final String from;
      if (edge.from() == null) {
        from = escapeId("_entry");
        hasEntry = true;
      } else {
        from = escapeId(edge.from().toString());
      }
      final var to = escapeId(edge.to().toString());
      final var label = escapeHtml(renderEdgeLabel(edge));
      builder.append("  " + from + " -> " + to + " [label = <" + label + ">];\n");
    }

    if (hasEntry) {
      builder.append("  " + escapeId("_entry") + " [shape = none, label = <>];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  /**
   * Escape text for use inside an HTML-like label.
   *
   * @param str raw label text
   */
  private static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;")
      .replace("\"", "&quot;");
  }
}
