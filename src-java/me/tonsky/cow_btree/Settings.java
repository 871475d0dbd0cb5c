package me.tonsky.cow_btree;

public class Settings {
  public static final int DEFAULT_DEGREE = 32;

  public final int _degree;

  public Settings() {
    this(DEFAULT_DEGREE);
  }

  public Settings(int degree) {
    if (degree <= 1) {
      throw new IllegalArgumentException("Bad degree " + degree + ", expected > 1");
    }
    _degree = degree;
  }

  public int degree() {
    return _degree;
  }

  public int maxItems() {
    return _degree * 2 - 1;
  }

  public int minItems() {
    return _degree - 1;
  }

  @Override
  public String toString() {
    return "Settings{degree=" + _degree + "}";
  }
}
