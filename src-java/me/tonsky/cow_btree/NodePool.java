package me.tonsky.cow_btree;

import java.util.concurrent.locks.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LIFO stash of retired nodes. May be shared by any number of
 * trees, including ones on different threads.
 */
@SuppressWarnings("unchecked")
public class NodePool<Key> {
  private static final Logger logger = LoggerFactory.getLogger(NodePool.class);

  public static final int DEFAULT_CAPACITY = 32;

  private final ReentrantLock _lock = new ReentrantLock();
  private final Node<Key>[] _nodes;
  private int _size;

  public NodePool() {
    this(DEFAULT_CAPACITY);
  }

  public NodePool(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Pool capacity must be >= 0, got " + capacity);
    }
    _nodes = (Node<Key>[]) new Node[capacity];
  }

  public int capacity() {
    return _nodes.length;
  }

  public int size() {
    _lock.lock();
    try {
      return _size;
    } finally {
      _lock.unlock();
    }
  }

  // Most recently released node, or a fresh one when empty
  public Node<Key> acquire() {
    _lock.lock();
    try {
      if (_size > 0) {
        _size -= 1;
        Node<Key> node = _nodes[_size];
        _nodes[_size] = null;
        return node;
      }
    } finally {
      _lock.unlock();
    }
    return new Node<Key>();
  }

  /**
   * Keeps an already cleared node for reuse. Returns false, keeping
   * nothing, when the pool is at capacity.
   */
  public boolean release(Node<Key> node) {
    assert node.len() == 0 && node.leaf() : "Releasing node that was not cleared";
    _lock.lock();
    try {
      if (_size < _nodes.length) {
        _nodes[_size] = node;
        _size += 1;
        return true;
      }
    } finally {
      _lock.unlock();
    }
    logger.trace("Node pool at capacity {}, dropping node", _nodes.length);
    return false;
  }
}
