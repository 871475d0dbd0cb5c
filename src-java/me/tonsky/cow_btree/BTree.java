package me.tonsky.cow_btree;

import java.util.*;
import clojure.lang.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory B-tree ordered by a comparator, with O(1) copy-on-write
 * {@link #clone()}.
 *
 * A single handle is not safe for concurrent writes. After a clone both
 * handles may be read from any thread, and each may be written by its own
 * thread: neither changes a node created before the clone in place.
 */
@SuppressWarnings("unchecked")
public class BTree<Key> implements Counted, Seqable, Reversible, IReduceInit, Iterable<Key> {
  private static final Logger logger = LoggerFactory.getLogger(BTree.class);

  public final Settings _settings;
  public final Comparator<Key> _cmp;
  public Node<Key> _root;
  public int _length;
  public Edit<Key> _edit;
  // Bumped on every write, checked by live seqs
  public int _version;

  public BTree() {
    this(new Settings(), RT.DEFAULT_COMPARATOR, new NodePool<Key>());
  }

  public BTree(int degree) {
    this(new Settings(degree), RT.DEFAULT_COMPARATOR, new NodePool<Key>());
  }

  public BTree(int degree, Comparator<Key> cmp) {
    this(new Settings(degree), cmp, new NodePool<Key>());
  }

  public BTree(int degree, Comparator<Key> cmp, NodePool<Key> pool) {
    this(new Settings(degree), cmp, pool);
  }

  public BTree(Settings settings, Comparator<Key> cmp, NodePool<Key> pool) {
    this(settings, cmp, null, 0, new Edit<Key>(pool));
  }

  BTree(Settings settings, Comparator<Key> cmp, Node<Key> root, int length, Edit<Key> edit) {
    _settings = settings;
    _cmp      = cmp;
    _root     = root;
    _length   = length;
    _edit     = edit;
  }

  public static <Key extends Item<Key>> BTree<Key> ofItems(int degree) {
    return new BTree<Key>(degree, Item.<Key>comparator());
  }

  public int degree() {
    return _settings.degree();
  }

  public NodePool<Key> pool() {
    return _edit.pool();
  }

  /**
   * Lazy copy. Both this tree and the returned one get a fresh generation,
   * so every node existing now is foreign to both and is copied on the
   * first write that reaches it, by whichever handle gets there.
   */
  public BTree<Key> clone() {
    Edit<Key> edit1 = _edit.fork(),
              edit2 = _edit.fork();
    _edit = edit1;
    logger.trace("Cloned tree of {} items", _length);
    return new BTree<Key>(_settings, _cmp, _root, _length, edit2);
  }

  /**
   * Adds {@code item}, replacing an equal one if present. Returns the
   * replaced item or null.
   *
   * @throws NullPointerException if {@code item} is null
   */
  public Key insertOrReplace(Key item) {
    if (item == null) {
      throw new NullPointerException("null item being added to BTree");
    }
    _version += 1;
    if (_root == null) {
      _root = _edit.newNode();
      _root._items.append(item);
      _length += 1;
      return null;
    }

    _root = _root.mutableFor(_edit);
    int maxItems = _settings.maxItems();
    if (_root.len() >= maxItems) {
      SplitResult<Key> split = _root.split(maxItems / 2);
      Node<Key> oldRoot = _root;
      _root = _edit.newNode();
      _root._items.append(split._item);
      _root._children.append(oldRoot);
      _root._children.append(split._right);
    }

    Key out = _root.insert(item, maxItems, _cmp);
    if (out == null) {
      _length += 1;
    }
    return out;
  }

  // Removed item, or null if nothing equal to item was present
  public Key delete(Key item) {
    return deleteItem(item, Remove.ITEM);
  }

  public Key deleteMin() {
    return deleteItem(null, Remove.MIN);
  }

  public Key deleteMax() {
    return deleteItem(null, Remove.MAX);
  }

  Key deleteItem(Key item, Remove mode) {
    if (_root == null || _root.len() == 0) {
      return null;
    }
    // rebalancing on the way down may reshape nodes even if item is absent
    _version += 1;
    _root = _root.mutableFor(_edit);
    Key out = _root.remove(item, _settings.minItems(), mode, _cmp);
    if (_root.len() == 0 && !_root.leaf()) {
      Node<Key> oldRoot = _root;
      _root = _root._children.get(0);
      _edit.freeNode(oldRoot);
    }
    if (out != null) {
      _length -= 1;
      if (_length == 0) {
        _edit.freeNode(_root);
        _root = null;
      }
    }
    return out;
  }

  public Key get(Key key) {
    if (_root == null) {
      return null;
    }
    return _root.get(key, _cmp);
  }

  public boolean has(Key key) {
    return get(key) != null;
  }

  public Key min() {
    return Node.min(_root);
  }

  public Key max() {
    return Node.max(_root);
  }

  public int len() {
    return _length;
  }

  /**
   * Drops all items. With {@code addNodesToPool} the nodes this tree owns
   * are retired into its pool until the pool is full; otherwise the
   * whole structure is left to the GC in O(1).
   */
  public void clear(boolean addNodesToPool) {
    if (_root != null && addNodesToPool) {
      logger.debug("Returning nodes of {} item tree to pool ({}/{})", _length, pool().size(), pool().capacity());
      _root.reset(_edit);
    }
    _root = null;
    _length = 0;
    _version += 1;
  }

  void iterate(Direction dir, Key start, Key stop, boolean includeStart, ItemIterator<Key> iter) {
    if (_root == null) {
      return;
    }
    _root.iterate(dir, start, stop, includeStart, new Node.Hit(), _cmp, iter);
  }

  // [greaterOrEqual, lessThan)
  public void ascendRange(Key greaterOrEqual, Key lessThan, ItemIterator<Key> iter) {
    iterate(Direction.ASCEND, greaterOrEqual, lessThan, true, iter);
  }

  // [first, pivot)
  public void ascendLessThan(Key pivot, ItemIterator<Key> iter) {
    iterate(Direction.ASCEND, null, pivot, false, iter);
  }

  // [pivot, last]
  public void ascendGreaterOrEqual(Key pivot, ItemIterator<Key> iter) {
    iterate(Direction.ASCEND, pivot, null, true, iter);
  }

  public void ascend(ItemIterator<Key> iter) {
    iterate(Direction.ASCEND, null, null, false, iter);
  }

  // [lessOrEqual, greaterThan), walking down
  public void descendRange(Key lessOrEqual, Key greaterThan, ItemIterator<Key> iter) {
    iterate(Direction.DESCEND, lessOrEqual, greaterThan, true, iter);
  }

  // [pivot, first]
  public void descendLessOrEqual(Key pivot, ItemIterator<Key> iter) {
    iterate(Direction.DESCEND, pivot, null, true, iter);
  }

  // [last, pivot)
  public void descendGreaterThan(Key pivot, ItemIterator<Key> iter) {
    iterate(Direction.DESCEND, null, pivot, false, iter);
  }

  public void descend(ItemIterator<Key> iter) {
    iterate(Direction.DESCEND, null, null, false, iter);
  }

  // Counted
  public int count() {
    return _length;
  }

  // Seqable
  public ISeq seq() {
    return Seq.create(this, true);
  }

  // Reversible
  public ISeq rseq() {
    return Seq.create(this, false);
  }

  // IReduceInit
  public Object reduce(IFn f, Object start) {
    Object[] ret = new Object[] { start };
    ascend(item -> {
      ret[0] = f.invoke(ret[0], item);
      return !(ret[0] instanceof Reduced);
    });
    return ret[0] instanceof Reduced ? ((Reduced) ret[0]).deref() : ret[0];
  }

  // Iterable
  public Iterator<Key> iterator() {
    return new JavaIter<Key>(Seq.create(this, true));
  }

  public String str() {
    return _root == null ? "" : _root.toString();
  }

  public String toString() {
    StringBuilder sb = new StringBuilder("#{");
    ascend(item -> {
      sb.append(item).append(" ");
      return true;
    });
    if (sb.charAt(sb.length() - 1) == ' ') {
      sb.delete(sb.length() - 1, sb.length());
    }
    sb.append("}");
    return sb.toString();
  }
}
