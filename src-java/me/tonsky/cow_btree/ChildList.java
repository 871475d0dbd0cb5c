package me.tonsky.cow_btree;

/**
 * Child references of one branch, ordered by the separating items of the
 * owning node. Empty for leaves.
 */
public class ChildList<Key> extends AList<Node<Key>> {
  public ChildList() {
    super(5);
  }

  public Node<Key> last() {
    return get(_len - 1);
  }
}
