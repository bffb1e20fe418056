package io.fretline.tab;

/** Direction of a horizontal or staff-to-staff move. */
public enum Direction {
  FORWARD(1),
  BACKWARD(-1);

  private final int sign;

  Direction(int sign) {
    this.sign = sign;
  }

  public int sign() {
    return sign;
  }
}
