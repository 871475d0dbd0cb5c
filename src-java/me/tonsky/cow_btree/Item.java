package me.tonsky.cow_btree;

import java.util.*;

/**
 * Value that knows its own order. Two items are equal when neither is
 * less than the other.
 */
public interface Item<T> {
  boolean less(T than);

  static <T extends Item<T>> Comparator<T> comparator() {
    return (a, b) -> a.less(b) ? -1 : (b.less(a) ? 1 : 0);
  }
}
