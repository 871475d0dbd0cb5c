package me.tonsky.cow_btree;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural checks shared by the tree tests.
 */
final class Invariants {
  private Invariants() {
  }

  static <Key> void check(BTree<Key> tree) {
    Node<Key> root = tree._root;
    if (root == null) {
      assertEquals(0, tree.len(), "empty root with items counted");
      return;
    }
    int[] leafDepth = new int[] { -1 };
    int count = check(root, true, null, null, tree._settings, tree._cmp, 0, leafDepth);
    assertEquals(tree.len(), count, "length out of sync with stored items");
  }

  private static <Key> int check(Node<Key> node, boolean isRoot, Key lo, Key hi, Settings settings, Comparator<Key> cmp, int depth, int[] leafDepth) {
    int len = node.len();
    assertTrue(len <= settings.maxItems(), "node over capacity: " + len);
    if (!isRoot) {
      assertTrue(len >= settings.minItems(), "node under capacity: " + len);
    }
    for (int i = 0; i < len; ++i) {
      Key item = node._items.get(i);
      if (i > 0) {
        assertTrue(cmp.compare(node._items.get(i - 1), item) < 0, "items not strictly increasing");
      }
      if (lo != null) {
        assertTrue(cmp.compare(lo, item) < 0, "item below its separator");
      }
      if (hi != null) {
        assertTrue(cmp.compare(item, hi) < 0, "item above its separator");
      }
    }
    if (node.leaf()) {
      if (leafDepth[0] < 0) {
        leafDepth[0] = depth;
      }
      assertEquals(leafDepth[0], depth, "leaves at different depths");
      return len;
    }
    assertEquals(len + 1, node._children.len(), "branch child count");
    int count = len;
    for (int i = 0; i <= len; ++i) {
      Key childLo = i == 0 ? lo : node._items.get(i - 1);
      Key childHi = i == len ? hi : node._items.get(i);
      count += check(node._children.get(i), false, childLo, childHi, settings, cmp, depth + 1, leafDepth);
    }
    return count;
  }

  static <Key> List<Key> ascending(BTree<Key> tree) {
    List<Key> out = new ArrayList<>();
    tree.ascend(item -> out.add(item));
    return out;
  }

  static <Key> List<Key> descending(BTree<Key> tree) {
    List<Key> out = new ArrayList<>();
    tree.descend(item -> out.add(item));
    return out;
  }

  static <Key> int countNodes(Node<Key> node) {
    if (node == null) {
      return 0;
    }
    int count = 1;
    for (int i = 0; i < node._children.len(); ++i) {
      count += countNodes(node._children.get(i));
    }
    return count;
  }

  static List<Int> ints(long... values) {
    List<Int> out = new ArrayList<>();
    for (long v : values) {
      out.add(Int.of(v));
    }
    return out;
  }
}
