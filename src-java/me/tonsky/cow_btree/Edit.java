package me.tonsky.cow_btree;

/**
 * Generation token. A node may be changed in place only by a tree whose
 * edit is identical to the node's own; any other tree copies it first.
 * Compared by identity only.
 */
public class Edit<Key> {
  public final NodePool<Key> _pool;

  public Edit(NodePool<Key> pool) {
    _pool = pool;
  }

  public NodePool<Key> pool() {
    return _pool;
  }

  public Node<Key> newNode() {
    Node<Key> node = _pool.acquire();
    node._edit = this;
    return node;
  }

  /**
   * Clears {@code node} and hands it to the pool, but only if this
   * generation owns it. Nodes of another generation may still be
   * reachable from other trees and are left alone.
   */
  public FreeType freeNode(Node<Key> node) {
    if (node._edit != this) {
      return FreeType.NOT_OWNED;
    }
    node._items.truncate(0);
    node._children.truncate(0);
    node._edit = null;
    return _pool.release(node) ? FreeType.STORED : FreeType.FREELIST_FULL;
  }

  // New generation over the same pool, owning none of the existing nodes
  public Edit<Key> fork() {
    return new Edit<Key>(_pool);
  }
}
