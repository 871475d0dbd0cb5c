package me.tonsky.cow_btree;

import java.util.*;

/**
 * Positional slice of node-local slots. Slots at [_len ... _slots.length)
 * are always null, so recycled node storage never pins removed items or
 * subtrees.
 */
@SuppressWarnings("unchecked")
public abstract class AList<T> {
  // >= 0
  public int _len;

  // Only valid [0 ... _len-1]
  protected T[] _slots;

  protected AList(int capacity) {
    _slots = (T[]) new Object[capacity];
  }

  public int len() {
    return _len;
  }

  public T get(int idx) {
    assert 0 <= idx && idx < _len : "Index " + idx + " out of [0, " + _len + ")";
    return _slots[idx];
  }

  public T set(int idx, T value) {
    assert 0 <= idx && idx < _len : "Index " + idx + " out of [0, " + _len + ")";
    T out = _slots[idx];
    _slots[idx] = value;
    return out;
  }

  // Raw slot, including the cleared ones past _len
  Object slot(int idx) {
    return _slots[idx];
  }

  int capacity() {
    return _slots.length;
  }

  protected void ensureCapacity(int len) {
    if (_slots.length < len) {
      _slots = ArrayUtil.grow(_slots, len);
    }
  }

  public void insertAt(int idx, T value) {
    assert 0 <= idx && idx <= _len;
    ensureCapacity(_len + 1);
    ArrayUtil.copy(_slots, idx, _len, _slots, idx + 1);
    _slots[idx] = value;
    _len += 1;
  }

  public void append(T value) {
    ensureCapacity(_len + 1);
    _slots[_len] = value;
    _len += 1;
  }

  public void appendAll(AList<T> other, int from, int to) {
    ensureCapacity(_len + to - from);
    _len = new Stitch<T>(_slots, _len)
      .copyAll(other._slots, from, to)
      .offset();
  }

  public void appendAll(AList<T> other) {
    appendAll(other, 0, other._len);
  }

  public T removeAt(int idx) {
    assert 0 <= idx && idx < _len;
    T out = _slots[idx];
    ArrayUtil.copy(_slots, idx + 1, _len, _slots, idx);
    _len -= 1;
    _slots[_len] = null;
    return out;
  }

  public T pop() {
    assert _len > 0;
    _len -= 1;
    T out = _slots[_len];
    _slots[_len] = null;
    return out;
  }

  // Drops [idx ... _len) and nulls the freed slots
  public void truncate(int idx) {
    assert 0 <= idx && idx <= _len;
    Arrays.fill(_slots, idx, _len, null);
    _len = idx;
  }

  public List<T> toList() {
    return Arrays.asList(Arrays.copyOfRange(_slots, 0, _len));
  }

  @Override
  public String toString() {
    return toList().toString();
  }
}
