package me.tonsky.cow_btree;

import java.util.*;

public class ArrayUtil {
  public static <T> T[] copy(T[] src, int from, int to, T[] target, int offset) {
    System.arraycopy(src, from, target, offset, to-from);
    return target;
  }

  public static <T> T[] grow(T[] src, int minLen) {
    int len = Math.max(minLen, src.length + (src.length >>> 1) + 1);
    return Arrays.copyOf(src, len);
  }
}
