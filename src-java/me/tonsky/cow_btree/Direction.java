package me.tonsky.cow_btree;

enum Direction {
  ASCEND,
  DESCEND
}
