package me.tonsky.cow_btree;

import java.util.*;
import java.util.concurrent.*;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodePoolTest {

  @Test
  void acquireFromEmptyPoolAllocates() {
    NodePool<Int> pool = new NodePool<>(4);
    Node<Int> node = pool.acquire();
    assertNotNull(node);
    assertEquals(0, node.len());
    assertTrue(node.leaf());
    assertEquals(0, pool.size());
  }

  @Test
  void releaseIsBoundedByCapacity() {
    NodePool<Int> pool = new NodePool<>(3);
    int accepted = 0;
    for (int i = 0; i < 10; ++i) {
      if (pool.release(new Node<>())) {
        accepted++;
      }
      assertTrue(pool.size() <= 3);
    }
    assertEquals(3, accepted);
    assertEquals(3, pool.size());
  }

  @Test
  void acquireReturnsMostRecentlyReleased() {
    NodePool<Int> pool = new NodePool<>();
    Node<Int> first = new Node<>(), second = new Node<>();
    pool.release(first);
    pool.release(second);
    assertSame(second, pool.acquire());
    assertSame(first, pool.acquire());
    assertEquals(0, pool.size());
  }

  @Test
  void defaultCapacity() {
    assertEquals(NodePool.DEFAULT_CAPACITY, new NodePool<Int>().capacity());
    assertEquals(32, NodePool.DEFAULT_CAPACITY);
  }

  @Test
  void zeroCapacityKeepsNothing() {
    NodePool<Int> pool = new NodePool<>(0);
    assertFalse(pool.release(new Node<>()));
    assertEquals(0, pool.size());
  }

  @Test
  void negativeCapacityRejected() {
    assertThrows(IllegalArgumentException.class, () -> new NodePool<Int>(-1));
  }

  @Test
  void freeNodeOnlyTakesOwnedNodes() {
    NodePool<Int> pool = new NodePool<>(1);
    Edit<Int> edit = new Edit<>(pool);
    Edit<Int> other = edit.fork();

    Node<Int> foreign = other.newNode();
    foreign._items.append(Int.of(1));
    assertEquals(FreeType.NOT_OWNED, edit.freeNode(foreign));
    assertEquals(1, foreign.len());
    assertSame(other, foreign._edit);

    Node<Int> owned = edit.newNode();
    owned._items.append(Int.of(1));
    assertEquals(FreeType.STORED, edit.freeNode(owned));
    assertEquals(0, owned.len());
    assertNull(owned._edit);

    Node<Int> overflow = edit.newNode();
    Node<Int> again = edit.newNode();
    assertSame(owned, overflow);
    assertEquals(FreeType.STORED, edit.freeNode(overflow));
    assertEquals(FreeType.FREELIST_FULL, edit.freeNode(again));
    assertEquals(1, pool.size());
  }

  @Test
  void concurrentReleaseNeverExceedsCapacity() throws Exception {
    NodePool<Int> pool = new NodePool<>(16);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int t = 0; t < 8; ++t) {
        futures.add(executor.submit(() -> {
          int accepted = 0;
          for (int i = 0; i < 1000; ++i) {
            if (pool.release(new Node<Int>())) {
              accepted++;
            }
            if (i % 3 == 0 && pool.acquire() != null) {
              accepted--;
            }
          }
          return accepted;
        }));
      }
      for (Future<Integer> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertTrue(pool.size() <= 16);
  }
}
