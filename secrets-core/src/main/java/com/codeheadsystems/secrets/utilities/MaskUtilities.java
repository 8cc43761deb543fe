package com.codeheadsystems.secrets.utilities;

/**
 * Display masking of secrets. The output is for humans only, never store or compare it.
 */
public class MaskUtilities {

  /**
   * The constant MASK.
   */
  public static final String MASK = "••••••••";
  /**
   * Values shorter than this are masked completely.
   */
  public static final int MINIMUM_LENGTH = 8;
  /**
   * The constant DEFAULT_VISIBLE_TAIL.
   */
  public static final int DEFAULT_VISIBLE_TAIL = 4;

  private MaskUtilities() {
  }

  /**
   * Mask with the default visible tail.
   *
   * @param value the value
   * @return the string
   */
  public static String mask(final String value) {
    return mask(value, DEFAULT_VISIBLE_TAIL);
  }

  /**
   * Mask the value, leaving the last {@code visibleTail} code points readable.
   *
   * @param value       the value
   * @param visibleTail number of trailing code points to show
   * @return the masked string
   */
  public static String mask(final String value, final int visibleTail) {
    if (visibleTail < 0) {
      throw new IllegalArgumentException("visibleTail must not be negative");
    }
    if (value == null) {
      return MASK;
    }
    final int codePoints = value.codePointCount(0, value.length());
    if (codePoints < MINIMUM_LENGTH) {
      return MASK;
    }
    final int start = value.offsetByCodePoints(value.length(), -Math.min(visibleTail, codePoints));
    return MASK + value.substring(start);
  }

}
