package me.tonsky.cow_btree;

import java.util.*;

@SuppressWarnings("unchecked")
class JavaIter<Key> implements Iterator<Key> {
  Seq<Key> _seq;

  JavaIter(Seq<Key> seq) {
    _seq = seq;
  }

  public boolean hasNext() {
    return _seq != null;
  }

  public Key next() {
    if (_seq == null) {
      throw new NoSuchElementException();
    }
    Key res = (Key) _seq.first();
    _seq = _seq.next();
    return res;
  }
}
