package me.tonsky.cow_btree;

import java.util.*;

/**
 * Represents both branches and leaves.
 *
 * Leaf:
 *
 *   _items      :: ElementList, sorted, no duplicates
 *   _children   :: empty ChildList
 *
 * Branch:
 *
 *   _children._len == _items._len + 1
 *   every item in _children[i]   <  _items[i]
 *   every item in _children[i+1] >  _items[i]
 *
 * Ownership:
 *
 *   _edit == tree._edit   node is reachable only from trees writing through
 *                         that generation, may be changed in place
 *   _edit != tree._edit   node may be shared with another tree handle,
 *                         must go through mutableFor() before any write
 *   _edit == null         node was retired to a pool
 */
public class Node<Key> {
  public final ElementList<Key> _items = new ElementList<>();

  public final ChildList<Key> _children = new ChildList<>();

  // Nullable
  public Edit<Key> _edit;

  public int len() {
    return _items._len;
  }

  public boolean leaf() {
    return _children._len == 0;
  }

  /**
   * Returns this node if {@code edit} already owns it, otherwise a copy
   * owned by {@code edit}. Only the child references are copied, the
   * subtrees stay shared until they are made mutable in turn.
   */
  public Node<Key> mutableFor(Edit<Key> edit) {
    if (_edit == edit) {
      return this;
    }
    Node<Key> out = edit.newNode();
    out._items.appendAll(_items);
    out._children.appendAll(_children);
    return out;
  }

  public Node<Key> mutableChild(int i) {
    Node<Key> child = _children.get(i).mutableFor(_edit);
    _children.set(i, child);
    return child;
  }

  /**
   * Pulls out item {@code i}. Items after it, and children after
   * {@code i+1}, move to a new right sibling.
   */
  public SplitResult<Key> split(int i) {
    Key item = _items.get(i);
    Node<Key> next = _edit.newNode();
    next._items.appendAll(_items, i + 1, _items._len);
    _items.truncate(i);
    if (!leaf()) {
      next._children.appendAll(_children, i + 1, _children._len);
      _children.truncate(i + 1);
    }
    return new SplitResult<Key>(item, next);
  }

  // Splits child i if it is full, promoting its median into this node
  boolean maybeSplitChild(int i, int maxItems) {
    if (_children.get(i).len() < maxItems) {
      return false;
    }
    Node<Key> first = mutableChild(i);
    SplitResult<Key> split = first.split(maxItems / 2);
    _items.insertAt(i, split._item);
    _children.insertAt(i + 1, split._right);
    return true;
  }

  /**
   * Inserts into the subtree rooted here, splitting full children on the
   * way down so a leaf always has room. Returns the replaced item, or
   * null if nothing equal to {@code item} was present.
   */
  public Key insert(Key item, int maxItems, Comparator<Key> cmp) {
    int idx = _items.search(item, cmp);
    if (idx >= 0) {
      return _items.set(idx, item);
    }

    int i = -idx - 1;
    if (leaf()) {
      _items.insertAt(i, item);
      return null;
    }

    if (maybeSplitChild(i, maxItems)) {
      Key inTree = _items.get(i);
      if (cmp.compare(item, inTree) < 0) {
        // stays in the left half
      } else if (cmp.compare(inTree, item) < 0) {
        i++;
      } else {
        return _items.set(i, item);
      }
    }
    return mutableChild(i).insert(item, maxItems, cmp);
  }

  public Key get(Key key, Comparator<Key> cmp) {
    Node<Key> node = this;
    while (true) {
      int idx = node._items.search(key, cmp);
      if (idx >= 0) {
        return node._items.get(idx);
      }
      if (node.leaf()) {
        return null;
      }
      node = node._children.get(-idx - 1);
    }
  }

  public static <Key> Key min(Node<Key> node) {
    if (node == null) {
      return null;
    }
    while (!node.leaf()) {
      node = node._children.get(0);
    }
    return node._items.first();
  }

  public static <Key> Key max(Node<Key> node) {
    if (node == null) {
      return null;
    }
    while (!node.leaf()) {
      node = node._children.last();
    }
    return node._items.last();
  }

  /**
   * Removes from the subtree rooted here. Before descending into a child
   * that holds only {@code minItems} items, the child is grown by stealing
   * or merging, so a removal never leaves a non-root node underfull.
   */
  public Key remove(Key item, int minItems, Remove mode, Comparator<Key> cmp) {
    int i;
    boolean found = false;
    switch (mode) {
      case MAX:
        if (leaf()) {
          return _items.pop();
        }
        i = _items._len;
        break;
      case MIN:
        if (leaf()) {
          return _items.removeAt(0);
        }
        i = 0;
        break;
      case ITEM:
        int idx = _items.search(item, cmp);
        found = idx >= 0;
        i = found ? idx : -idx - 1;
        if (leaf()) {
          return found ? _items.removeAt(i) : null;
        }
        break;
      default:
        throw new IllegalStateException("Unexpected remove mode: " + mode);
    }

    if (_children.get(i).len() <= minItems) {
      return growChildAndRemove(i, item, minItems, mode, cmp);
    }

    Node<Key> child = mutableChild(i);
    if (found) {
      // child i has spare items, so its max can replace the removed separator
      Key out = _items.get(i);
      _items.set(i, child.remove(null, minItems, Remove.MAX, cmp));
      return out;
    }
    return child.remove(item, minItems, mode, cmp);
  }

  /**
   * Brings child {@code i} above {@code minItems}, trying in order: steal
   * from the left sibling, steal from the right sibling, merge with the
   * right sibling. Then retries the removal, which now hits a child with
   * items to spare.
   */
  Key growChildAndRemove(int i, Key item, int minItems, Remove mode, Comparator<Key> cmp) {
    if (i > 0 && _children.get(i - 1).len() > minItems) {
      Node<Key> child = mutableChild(i);
      Node<Key> stealFrom = mutableChild(i - 1);
      Key stolen = stealFrom._items.pop();
      child._items.insertAt(0, _items.get(i - 1));
      _items.set(i - 1, stolen);
      if (!stealFrom.leaf()) {
        child._children.insertAt(0, stealFrom._children.pop());
      }
    } else if (i < _items._len && _children.get(i + 1).len() > minItems) {
      Node<Key> child = mutableChild(i);
      Node<Key> stealFrom = mutableChild(i + 1);
      Key stolen = stealFrom._items.removeAt(0);
      child._items.append(_items.get(i));
      _items.set(i, stolen);
      if (!stealFrom.leaf()) {
        child._children.append(stealFrom._children.removeAt(0));
      }
    } else {
      if (i >= _items._len) {
        i--;
      }
      Node<Key> child = mutableChild(i);
      Key mergeItem = _items.removeAt(i);
      Node<Key> mergeChild = _children.removeAt(i + 1);
      child._items.append(mergeItem);
      child._items.appendAll(mergeChild._items);
      child._children.appendAll(mergeChild._children);
      _edit.freeNode(mergeChild);
    }
    return remove(item, minItems, mode, cmp);
  }

  // Whether the start boundary has been passed, shared by one whole traversal
  static class Hit {
    boolean _value;
  }

  /**
   * In-order walk in direction {@code dir}. Ascending visits
   * [start, stop), descending visits [start, stop) counted downwards.
   * Returns false once the walk is over, either because {@code stop} was
   * reached or because {@code iter} asked to stop.
   */
  boolean iterate(Direction dir, Key start, Key stop, boolean includeStart, Hit hit, Comparator<Key> cmp, ItemIterator<Key> iter) {
    switch (dir) {
      case ASCEND: {
        int index = 0;
        if (start != null) {
          index = _items.search(start, cmp);
          if (index < 0) index = -index - 1;
        }
        for (int i = index; i < _items._len; ++i) {
          if (!leaf() && !_children.get(i).iterate(dir, start, stop, includeStart, hit, cmp, iter)) {
            return false;
          }
          Key item = _items.get(i);
          if (!includeStart && !hit._value && start != null && !(cmp.compare(start, item) < 0)) {
            hit._value = true;
            continue;
          }
          hit._value = true;
          if (stop != null && !(cmp.compare(item, stop) < 0)) {
            return false;
          }
          if (!iter.visit(item)) {
            return false;
          }
        }
        if (!leaf() && !_children.last().iterate(dir, start, stop, includeStart, hit, cmp, iter)) {
          return false;
        }
        break;
      }
      case DESCEND: {
        int index;
        if (start != null) {
          index = _items.search(start, cmp);
          // not present: start from the last item below it
          if (index < 0) index = -index - 2;
        } else {
          index = _items._len - 1;
        }
        for (int i = index; i >= 0; --i) {
          Key item = _items.get(i);
          if (start != null && !(cmp.compare(item, start) < 0)) {
            if (!includeStart || hit._value || cmp.compare(start, item) < 0) {
              continue;
            }
          }
          if (!leaf() && !_children.get(i + 1).iterate(dir, start, stop, includeStart, hit, cmp, iter)) {
            return false;
          }
          if (stop != null && !(cmp.compare(stop, item) < 0)) {
            return false;
          }
          hit._value = true;
          if (!iter.visit(item)) {
            return false;
          }
        }
        if (!leaf() && !_children.get(0).iterate(dir, start, stop, includeStart, hit, cmp, iter)) {
          return false;
        }
        break;
      }
    }
    return true;
  }

  /**
   * Retires this subtree into {@code edit}'s pool, children first.
   * Returns false as soon as the pool is full, since walking further
   * could not store anything.
   */
  boolean reset(Edit<Key> edit) {
    for (int i = 0; i < _children._len; ++i) {
      if (!_children.get(i).reset(edit)) {
        return false;
      }
    }
    return edit.freeNode(this) != FreeType.FREELIST_FULL;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    toString(sb, "");
    return sb.toString();
  }

  public void toString(StringBuilder sb, String indent) {
    sb.append(indent).append("Node len: ").append(len()).append(" ").append(_items).append("\n");
    for (int i = 0; i < _children._len; ++i) {
      _children.get(i).toString(sb, indent + "  ");
    }
  }
}
