package me.tonsky.cow_btree;

public class Stitch<T> {

  T[] target;
  int offset;

  public Stitch(T[] target, int offset) {
    this.target = target;
    this.offset = offset;
  }

  public Stitch<T> copyAll(T[] source, int from, int to) {
    if (to >= from) {
      System.arraycopy(source, from, target, offset, to - from);
      offset += to - from;
    }
    return this;
  }

  public int offset() {
    return offset;
  }
}
