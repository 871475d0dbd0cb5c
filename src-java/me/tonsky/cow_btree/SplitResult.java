package me.tonsky.cow_btree;

/**
 * Outcome of {@link Node#split(int)}: the median item pulled out of the
 * node and the new right sibling holding everything after it.
 */
class SplitResult<Key> {
  final Key _item;
  final Node<Key> _right;

  SplitResult(Key item, Node<Key> right) {
    _item  = item;
    _right = right;
  }
}
