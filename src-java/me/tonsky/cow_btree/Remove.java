package me.tonsky.cow_btree;

enum Remove {
  // exact item
  ITEM,
  // leftmost item of the subtree
  MIN,
  // rightmost item of the subtree
  MAX
}
