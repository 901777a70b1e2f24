package com.flamingo.ai.graphrag.domain.enums;

/** How the neighbor discount factor applies to nodes more than one hop away from their seed. */
public enum HopDiscountPolicy {
  /** {@code discount ^ hop}: every additional hop costs another factor. */
  COMPOUND,

  /** {@code discount} once, regardless of hop distance. */
  FLAT;

  public double factor(double discount, int hop) {
    return this == FLAT ? discount : Math.pow(discount, Math.max(1, hop));
  }
}
