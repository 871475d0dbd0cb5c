package me.tonsky.cow_btree;

import clojure.lang.*;

/**
 * Called once per visited item, in traversal order. Returning false ends
 * the traversal.
 */
@FunctionalInterface
public interface ItemIterator<Key> {
  boolean visit(Key item);

  static <Key> ItemIterator<Key> of(IFn f) {
    return item -> RT.booleanCast(f.invoke(item));
  }
}
