package exm.dec.common.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Directed graph stored as adjacency sets.
 *
 * Vertices are compared with equals(), so types that don't override it
 * (e.g. AST statements) are compared by identity.  Adding an existing
 * vertex or edge is a no-op.  Iteration order of vertices and of each
 * vertex's successors is insertion order, so traversals are
 * deterministic.
 */
public class DiGraph<V> {

  private final Set<V> vertices;

  /** vertex -> successors */
  private final SetMultimap<V, V> successors;

  public DiGraph() {
    this.vertices = new LinkedHashSet<V>();
    this.successors = LinkedHashMultimap.create();
  }

  /**
   * @return false if the vertex was already present
   */
  public boolean addVertex(V vertex) {
    if (vertex == null) {
      throw new IllegalArgumentException("Null vertex");
    }
    return vertices.add(vertex);
  }

  /**
   * Add directed edge
   * @return false if edge was already present
   * @throws IllegalArgumentException if either vertex is not in the graph
   */
  public boolean addEdge(V source, V destination) {
    checkVertex(source);
    checkVertex(destination);
    return successors.put(source, destination);
  }

  /**
   * Remove vertex and all edges into or out of it
   * @return false if the vertex was not in the graph
   */
  public boolean removeVertex(V vertex) {
    if (!vertices.remove(vertex)) {
      return false;
    }
    successors.removeAll(vertex);
    for (V v: vertices) {
      successors.remove(v, vertex);
    }
    return true;
  }

  /**
   * @return false if the edge did not exist
   * @throws IllegalArgumentException if either vertex is not in the graph
   */
  public boolean removeEdge(V source, V destination) {
    checkVertex(source);
    checkVertex(destination);
    return successors.remove(source, destination);
  }

  public boolean hasVertex(V vertex) {
    return vertices.contains(vertex);
  }

  public boolean hasEdge(V source, V destination) {
    return successors.containsEntry(source, destination);
  }

  /**
   * @return direct successors of vertex, in insertion order
   * @throws IllegalArgumentException if vertex is not in the graph
   */
  public List<V> neighbors(V vertex) {
    checkVertex(vertex);
    return ImmutableList.copyOf(successors.get(vertex));
  }

  public Set<V> vertices() {
    return Collections.unmodifiableSet(vertices);
  }

  public int vertexCount() {
    return vertices.size();
  }

  public int edgeCount() {
    return successors.size();
  }

  /**
   * @return new graph with the same vertices and every edge reversed
   */
  public DiGraph<V> transpose() {
    DiGraph<V> reversed = new DiGraph<V>();
    for (V v: vertices) {
      reversed.addVertex(v);
    }
    for (V v: vertices) {
      for (V succ: successors.get(v)) {
        reversed.addEdge(succ, v);
      }
    }
    return reversed;
  }

  /**
   * Breadth-first search from start.  Each vertex is visited at most once,
   * so cycles are safe.
   * @param start start vertex, or null for an empty result
   * @return reachable vertices including start, and all others
   */
  public Reachability<V> breadthFirstSearch(V start) {
    if (start == null || vertices.isEmpty()) {
      return Reachability.empty();
    }
    checkVertex(start);

    Set<V> visited = new LinkedHashSet<V>();
    Deque<V> queue = new ArrayDeque<V>();
    visited.add(start);
    queue.add(start);
    while (!queue.isEmpty()) {
      V curr = queue.removeFirst();
      for (V succ: successors.get(curr)) {
        if (visited.add(succ)) {
          queue.addLast(succ);
        }
      }
    }

    Set<V> unvisited = new LinkedHashSet<V>();
    for (V v: vertices) {
      if (!visited.contains(v)) {
        unvisited.add(v);
      }
    }
    return new Reachability<V>(visited, unvisited);
  }

  /**
   * Depth-first search over all vertices, including disconnected ones.
   * @return vertices in order of decreasing finish time (the vertex that
   *         finished last is first)
   */
  public List<V> depthFirstOrder() {
    Set<V> visited = new HashSet<V>();
    Deque<V> finished = new ArrayDeque<V>();
    for (V v: vertices) {
      if (!visited.contains(v)) {
        dfsVisit(v, visited, finished);
      }
    }
    return new ArrayList<V>(finished);
  }

  /**
   * Iterative so that long straight-line graphs don't overflow the stack
   */
  private void dfsVisit(V root, Set<V> visited, Deque<V> finished) {
    Deque<V> stack = new ArrayDeque<V>();
    Deque<Integer> childIx = new ArrayDeque<Integer>();
    visited.add(root);
    stack.push(root);
    childIx.push(0);
    while (!stack.isEmpty()) {
      V curr = stack.peek();
      int ix = childIx.pop();
      List<V> succs = ImmutableList.copyOf(successors.get(curr));
      if (ix < succs.size()) {
        childIx.push(ix + 1);
        V next = succs.get(ix);
        if (visited.add(next)) {
          stack.push(next);
          childIx.push(0);
        }
      } else {
        stack.pop();
        finished.push(curr);
      }
    }
  }

  /**
   * Strongly connected components using Kosaraju's algorithm: a DFS to
   * get finish order, then a DFS over the transposed graph in that order.
   * @return list of components, each a list of vertices
   */
  public List<List<V>> stronglyConnectedComponents() {
    List<V> order = depthFirstOrder();
    DiGraph<V> reversed = transpose();

    List<List<V>> components = new ArrayList<List<V>>();
    Set<V> assigned = new HashSet<V>();
    for (V v: order) {
      if (assigned.contains(v)) {
        continue;
      }
      List<V> component = new ArrayList<V>();
      Deque<V> stack = new ArrayDeque<V>();
      stack.push(v);
      assigned.add(v);
      while (!stack.isEmpty()) {
        V curr = stack.pop();
        component.add(curr);
        for (V pred: reversed.successors.get(curr)) {
          if (assigned.add(pred)) {
            stack.push(pred);
          }
        }
      }
      components.add(component);
    }
    return components;
  }

  private void checkVertex(V vertex) {
    if (!vertices.contains(vertex)) {
      throw new IllegalArgumentException("Vertex " + vertex
                                       + " not in graph");
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Vertices: ").append(vertexCount());
    sb.append(" Edges: ").append(edgeCount()).append("\n");
    for (V v: vertices) {
      sb.append("  ").append(v).append(" -> ");
      sb.append(successors.get(v)).append("\n");
    }
    return sb.toString();
  }
}
