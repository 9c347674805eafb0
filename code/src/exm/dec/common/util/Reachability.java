package exm.dec.common.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partition of a graph's vertices into those reachable from a start
 * vertex and the rest.  Reachable vertices are in the order they were
 * discovered, starting with the start vertex; unreachable vertices are in
 * graph insertion order.
 */
public class Reachability<V> {
  private final Set<V> reachable;
  private final Set<V> unreachable;

  public Reachability(Set<V> reachable, Set<V> unreachable) {
    this.reachable = Collections.unmodifiableSet(
                          new LinkedHashSet<V>(reachable));
    this.unreachable = Collections.unmodifiableSet(
                          new LinkedHashSet<V>(unreachable));
  }

  public static <V> Reachability<V> empty() {
    return new Reachability<V>(Collections.<V>emptySet(),
                               Collections.<V>emptySet());
  }

  public Set<V> getReachable() {
    return reachable;
  }

  public Set<V> getUnreachable() {
    return unreachable;
  }

  public boolean isReachable(V vertex) {
    return reachable.contains(vertex);
  }

  @Override
  public String toString() {
    return "reachable: " + reachable + " unreachable: " + unreachable;
  }
}
