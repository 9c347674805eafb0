package exm.dec.common.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map.Entry;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * A scope of named slots that allows cheap creation of nested scopes.
 * If a lookup fails in the current table, then it sees if the name is in
 * the parent table.  Declarations always go into the local table: a child
 * never modifies its parent, and a child declaration shadows the parent's
 * binding for lookups made through the child.
 *
 * Values may be null, so presence is tracked separately from the value.
 */
public class SymbolTable<K, V> {
  private final LinkedHashMap<K, V> map;

  /** Enclosing scope.  Not owned: may be shared by several children. */
  private final SymbolTable<K, V> parent;

  public SymbolTable() {
    this(null);
  }

  public SymbolTable(SymbolTable<K, V> parent) {
    this.map = new LinkedHashMap<K, V>();
    this.parent = parent;
  }

  public SymbolTable<K, V> makeChildTable() {
    return new SymbolTable<K, V>(this);
  }

  public SymbolTable<K, V> getParent() {
    return parent;
  }

  /**
   * Insert or overwrite in the local table.
   * @return the previous local value, or null
   */
  public V declare(K name, V value) {
    checkName(name);
    return map.put(name, value);
  }

  public boolean contains(K name) {
    return getDepth(name) >= 0;
  }

  public boolean containsLocal(K name) {
    checkName(name);
    return map.containsKey(name);
  }

  /**
   * Look up through the scope chain
   * @param name
   * @return value from the nearest table that declares name
   * @throws NoSuchElementException if no table in the chain declares name
   */
  public V lookup(K name) {
    checkName(name);
    SymbolTable<K, V> curr = this;
    while (curr != null) {
      if (curr.map.containsKey(name)) {
        return curr.map.get(name);
      }
      curr = curr.parent;
    }
    throw new NoSuchElementException("symbol not found: " + name);
  }

  /**
   * @param name
   * @return value from this table only
   * @throws NoSuchElementException if name is not declared locally
   */
  public V lookupLocal(K name) {
    if (!containsLocal(name)) {
      throw new NoSuchElementException("symbol not found locally: " + name);
    }
    return map.get(name);
  }

  /**
   * @param name
   * @return the depth at which the name is declared: 0 for this table,
   *         1 for the parent, etc.  -1 if not declared anywhere.
   */
  public int getDepth(K name) {
    checkName(name);
    int depth = 0;
    SymbolTable<K, V> curr = this;
    while (curr != null) {
      if (curr.map.containsKey(name)) {
        return depth;
      }
      depth++;
      curr = curr.parent;
    }
    return -1;
  }

  /**
   * @return true if name is declared in an ancestor and would be shadowed
   *         by a local declaration
   */
  public boolean isShadowing(K name) {
    return !containsLocal(name) && parent != null && parent.contains(name);
  }

  /**
   * Names declared in this table, in declaration order
   */
  public Set<K> localNames() {
    return Collections.unmodifiableSet(map.keySet());
  }

  public int localSize() {
    return map.size();
  }

  /**
   * Total bindings in the chain, counting shadowed names once per table
   */
  public int size() {
    int parentSize = parent == null ? 0 : parent.size();
    return parentSize + map.size();
  }

  /**
   * Remove all local bindings.  Parent is untouched and stays linked.
   */
  public void clear() {
    map.clear();
  }

  private void checkName(K name) {
    if (name == null) {
      throw new IllegalArgumentException("Null symbol name");
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("{");
    int written = writeContents(sb, true);
    if (parent != null) {
      sb.append(written == 0 ? "" : " ");
      sb.append("^");
      sb.append(parent.toString());
    }
    sb.append("}");
    return sb.toString();
  }

  private int writeContents(StringBuilder sb, boolean first) {
    for (Entry<K, V> e: this.map.entrySet()) {
      if (first) {
        first = false;
      } else {
        sb.append(",");
      }
      sb.append(e.getKey());
      sb.append(":");
      sb.append(e.getValue());
    }
    return map.size();
  }
}
