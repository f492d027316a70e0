/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.layout.analysis;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.math.LongMath;
import net.hydromatic.layout.ir.Ir;

/**
 * Proves that integer values are multiples of a constant.
 *
 * <p>The analysis walks backwards from a value through the operations that
 * compute it. It is sound: if it says that a value is divisible, then every
 * execution produces a multiple of the divisor, provided that
 * {@code assume_multiple} assertions are true. It is incomplete: it may fail
 * to prove a value that is in fact always divisible.
 *
 * <p>Each step costs fuel, which bounds the work. With more fuel the analysis
 * proves at least as much as with less.
 */
public final class Divisibility {
  private Divisibility() {}

  /**
   * Returns whether {@code value} is guaranteed to be a multiple of
   * {@code divisor}.
   *
   * <p>A {@code false} result means "not proven", not "not divisible".
   * With positive fuel, every integer value is proven to be a multiple of 1,
   * even a value whose definition is opaque.
   *
   * @param value Value
   * @param divisor Divisor; must be positive
   * @param fuel Search budget; if zero or negative, nothing is proven
   */
  public static boolean isGuaranteedDivisible(Ir.Node value, long divisor,
      int fuel) {
    checkArgument(divisor > 0, "divisor must be positive: %s", divisor);
    return fuel > 0 && knownFactor(value, divisor, fuel) == divisor;
  }

  /**
   * Returns the largest factor of {@code divisor} that {@code value} is known
   * to be a multiple of. Returns 1 if nothing is known, and {@code divisor}
   * if the value is known to be divisible.
   *
   * <p>Factors of a product combine: if {@code x} is a multiple of 3 and
   * {@code y} of 4, then {@code x * y} is a multiple of 12.
   */
  public static long knownFactor(Ir.Node value, long divisor, int fuel) {
    checkArgument(divisor > 0, "divisor must be positive: %s", divisor);
    if (fuel <= 0) {
      return 1;
    }
    switch (value.op) {
    case ASSUME_MULTIPLE:
      return commonFactor(((Ir.AssumeMultiple) value).multiple, divisor);

    case MULI:
      final Ir.MulI mul = (Ir.MulI) value;
      // Constants are canonically on the right, so try the right first.
      final long rightFactor = knownFactor(mul.rhs, divisor, fuel / 2);
      if (rightFactor == divisor) {
        return divisor;
      }
      final long leftFactor = knownFactor(mul.lhs, divisor, (fuel + 1) / 2);
      // leftFactor divides divisor, so gcd(leftFactor * rightFactor, divisor)
      // is leftFactor * gcd(rightFactor, divisor / leftFactor), which cannot
      // overflow.
      return leftFactor
          * LongMath.gcd(rightFactor, divisor / leftFactor);

    case CONSTANT:
      final Long c = ((Ir.Constant) value).intValue();
      return c == null ? 1 : commonFactor(c, divisor);

    case INDEX_CAST:
      return knownFactor(((Ir.IndexCast) value).input, divisor, fuel - 1);

    default:
      return 1;
    }
  }

  /** Returns the greatest common divisor of {@code n} and a positive
   * {@code divisor}; {@code divisor} if {@code n} is zero. */
  private static long commonFactor(long n, long divisor) {
    return LongMath.gcd(Math.floorMod(n, divisor), divisor);
  }
}

// End Divisibility.java
