package me.tonsky.cow_btree;

import java.util.*;

/**
 * Sorted, duplicate-free items of one node.
 */
public class ElementList<Key> extends AList<Key> {
  public ElementList() {
    super(4);
  }

  /**
   * Binary search following {@link Arrays#binarySearch} conventions:
   * index of the equal item if present, {@code -ins - 1} otherwise, where
   * {@code ins} is the first index whose item is greater than {@code key}.
   * Two items are equal when neither is less than the other.
   */
  public int search(Key key, Comparator<Key> cmp) {
    int low = 0, high = _len;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (cmp.compare(key, _slots[mid]) < 0)
        high = mid;
      else
        low = mid + 1;
    }
    if (low > 0 && !(cmp.compare(_slots[low - 1], key) < 0))
      return low - 1;
    return -low - 1;
  }

  public Key first() {
    return _len == 0 ? null : _slots[0];
  }

  public Key last() {
    return _len == 0 ? null : _slots[_len - 1];
  }
}
