package me.tonsky.cow_btree;

import java.util.*;
import clojure.lang.*;

/**
 * Immutable cursor over one item of a tree. {@code _parent} points at the
 * item of an ancestor that comes next once the current subtree is
 * exhausted, so moving forward never needs to look upwards in the tree.
 */
@SuppressWarnings("unchecked")
class Seq<Key> extends ASeq {
  final BTree<Key> _tree;
  final Seq<Key> _parent;
  final Node<Key> _node;
  final int _idx;
  final boolean _asc;
  final int _version;

  Seq(IPersistentMap meta, BTree<Key> tree, Seq<Key> parent, Node<Key> node, int idx, boolean asc, int version) {
    super(meta);
    _tree    = tree;
    _parent  = parent;
    _node    = node;
    _idx     = idx;
    _asc     = asc;
    _version = version;
  }

  static <Key> Seq<Key> create(BTree<Key> tree, boolean asc) {
    Node<Key> root = tree._root;
    if (root == null || root.len() == 0) {
      return null;
    }
    return dive(tree, null, root, asc, tree._version);
  }

  // Outermost item of node's subtree, remembering every branch passed
  static <Key> Seq<Key> dive(BTree<Key> tree, Seq<Key> parent, Node<Key> node, boolean asc, int version) {
    while (!node.leaf()) {
      parent = new Seq<Key>(null, tree, parent, node, asc ? 0 : node.len() - 1, asc, version);
      node = asc ? node._children.get(0) : node._children.last();
    }
    return new Seq<Key>(null, tree, parent, node, asc ? 0 : node.len() - 1, asc, version);
  }

  void checkVersion() {
    if (_version != _tree._version)
      throw new ConcurrentModificationException("BTree was modified while iterating over its seq");
  }

  Seq<Key> at(int idx) {
    return new Seq<Key>(null, _tree, _parent, _node, idx, _asc, _version);
  }

  // ASeq
  public Object first() {
    checkVersion();
    return _node._items.get(_idx);
  }

  public Seq<Key> next() {
    checkVersion();
    if (_asc) {
      if (!_node.leaf()) {
        Seq<Key> parent = _idx + 1 < _node.len() ? at(_idx + 1) : _parent;
        return dive(_tree, parent, _node._children.get(_idx + 1), true, _version);
      }
      return _idx + 1 < _node.len() ? at(_idx + 1) : _parent;
    } else {
      if (!_node.leaf()) {
        Seq<Key> parent = _idx > 0 ? at(_idx - 1) : _parent;
        return dive(_tree, parent, _node._children.get(_idx), false, _version);
      }
      return _idx > 0 ? at(_idx - 1) : _parent;
    }
  }

  public Seq<Key> withMeta(IPersistentMap meta) {
    if (meta() == meta) return this;
    return new Seq<Key>(meta, _tree, _parent, _node, _idx, _asc, _version);
  }

  // Iterable
  public Iterator iterator() {
    return new JavaIter<Key>(this);
  }
}
