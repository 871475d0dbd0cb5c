package me.tonsky.cow_btree;

public final class Int implements Item<Int> {
  public final long _value;

  public Int(long value) {
    _value = value;
  }

  public static Int of(long value) {
    return new Int(value);
  }

  public long value() {
    return _value;
  }

  @Override
  public boolean less(Int than) {
    return _value < than._value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Int && ((Int) o)._value == _value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(_value);
  }

  @Override
  public String toString() {
    return Long.toString(_value);
  }
}
