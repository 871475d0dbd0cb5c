package me.tonsky.cow_btree;

/**
 * What {@link Edit#freeNode(Node)} did with a retired node.
 */
public enum FreeType {
  // cleared, but the pool was full so it is left to the GC
  FREELIST_FULL,
  // cleared and stored in the pool for reuse
  STORED,
  // belongs to another generation, left untouched
  NOT_OWNED
}
