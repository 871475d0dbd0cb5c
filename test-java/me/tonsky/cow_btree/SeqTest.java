package me.tonsky.cow_btree;

import java.util.*;

import clojure.lang.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeqTest {

  private static BTree<Long> range(int degree, long from, long to) {
    BTree<Long> tree = new BTree<>(degree);
    for (long i = from; i < to; ++i) {
      tree.insertOrReplace(i);
    }
    return tree;
  }

  private static List<Object> walk(ISeq seq) {
    List<Object> out = new ArrayList<>();
    for (ISeq s = seq; s != null; s = s.next()) {
      out.add(s.first());
    }
    return out;
  }

  private static List<Object> expected(long from, long to, boolean asc) {
    List<Object> out = new ArrayList<>();
    for (long i = from; i < to; ++i) {
      out.add(i);
    }
    if (!asc) {
      Collections.reverse(out);
    }
    return out;
  }

  @Test
  void seqWalksEveryShape() {
    for (int degree = 2; degree <= 4; ++degree) {
      for (int size = 0; size < 60; ++size) {
        BTree<Long> tree = range(degree, 0, size);
        assertEquals(expected(0, size, true), walk(tree.seq()), "degree " + degree + " size " + size);
        assertEquals(expected(0, size, false), walk(tree.rseq()), "degree " + degree + " size " + size);
      }
    }
  }

  @Test
  void emptyTreeHasNilSeq() {
    BTree<Long> tree = new BTree<>(2);
    assertNull(tree.seq());
    assertNull(tree.rseq());
    assertFalse(tree.iterator().hasNext());
    assertThrows(NoSuchElementException.class, () -> tree.iterator().next());

    tree.insertOrReplace(1L);
    tree.delete(1L);
    assertNull(tree.seq());
  }

  @Test
  void seqIsPersistent() {
    BTree<Long> tree = range(2, 0, 10);
    ISeq seq = tree.seq();
    ISeq rest = seq.next();
    assertEquals(0L, seq.first());
    assertEquals(1L, rest.first());
    assertEquals(1L, seq.next().first());
    assertEquals(10, seq.count());
  }

  @Test
  void iteratorFollowsAscendingOrder() {
    BTree<Long> tree = new BTree<>(3);
    long[] values = { 50, 10, 40, 20, 30, 60, 0 };
    for (long v : values) {
      tree.insertOrReplace(v);
    }
    List<Long> seen = new ArrayList<>();
    for (Long v : tree) {
      seen.add(v);
    }
    assertEquals(Arrays.asList(0L, 10L, 20L, 30L, 40L, 50L, 60L), seen);
  }

  @Test
  void mutationInvalidatesSeq() {
    BTree<Long> tree = range(2, 0, 20);
    ISeq seq = tree.seq();
    tree.insertOrReplace(100L);
    assertThrows(ConcurrentModificationException.class, seq::next);
    assertThrows(ConcurrentModificationException.class, seq::first);

    Iterator<Long> it = tree.iterator();
    it.next();
    tree.deleteMin();
    assertThrows(ConcurrentModificationException.class, it::next);
  }

  @Test
  void cloneKeepsSeqValid() {
    BTree<Long> tree = range(2, 0, 20);
    ISeq seq = tree.seq();
    BTree<Long> copy = tree.clone();
    copy.insertOrReplace(100L);
    assertEquals(expected(0, 20, true), walk(seq));
  }

  @Test
  void clojureCollectionInterop() {
    BTree<Long> tree = range(3, 1, 11);
    assertEquals(10, RT.count(tree));
    assertEquals(1L, RT.first(tree));
    assertEquals(10L, RT.first(tree.rseq()));

    IFn plus = new AFn() {
      public Object invoke(Object acc, Object x) {
        return (Long) acc + (Long) x;
      }
    };
    assertEquals(55L, tree.reduce(plus, 0L));
  }

  @Test
  void reduceStopsOnReduced() {
    BTree<Long> tree = range(2, 0, 1000);
    List<Object> seen = new ArrayList<>();
    IFn firstOverFive = new AFn() {
      public Object invoke(Object acc, Object x) {
        seen.add(x);
        return (Long) x > 5 ? new Reduced(x) : acc;
      }
    };
    assertEquals(6L, tree.reduce(firstOverFive, null));
    assertEquals(7, seen.size());
  }

  @Test
  void clojureFnAsItemIterator() {
    BTree<Long> tree = range(2, 0, 100);
    List<Object> seen = new ArrayList<>();
    IFn takeThree = new AFn() {
      public Object invoke(Object x) {
        seen.add(x);
        return seen.size() < 3 ? Boolean.TRUE : null;
      }
    };
    tree.descend(ItemIterator.of(takeThree));
    assertEquals(Arrays.asList(99L, 98L, 97L), seen);
  }
}
