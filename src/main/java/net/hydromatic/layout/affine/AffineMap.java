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
package net.hydromatic.layout.affine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Function from a tuple of {@code numDims} integers to a tuple of
 * {@link #numResults()} integers, each result an {@link AffineExpr} over the
 * inputs.
 *
 * <p>For example, {@code (d0, d1) -> (d0 floordiv 8, d1 floordiv 128,
 * d0 mod 8, d1 mod 128)} maps an element of an array to the index of its
 * tile followed by its position within the tile.
 *
 * <p>Maps are immutable, and are combined using {@link #compose}.
 */
public final class AffineMap {
  public final int numDims;
  public final ImmutableList<AffineExpr> results;

  private AffineMap(int numDims, ImmutableList<AffineExpr> results) {
    this.numDims = numDims;
    this.results = results;
  }

  /** Creates a map. Every dimension used by a result must be less than
   * {@code numDims}. */
  public static AffineMap of(int numDims, List<? extends AffineExpr> results) {
    checkArgument(numDims >= 0, "negative dimension count %s", numDims);
    for (AffineExpr result : results) {
      checkArgument(result.maxDim() < numDims,
          "expression %s uses a dimension out of range [0, %s)", result,
          numDims);
    }
    return new AffineMap(numDims, ImmutableList.copyOf(results));
  }

  /** Returns the identity map {@code (d0, ..., dn-1) -> (d0, ..., dn-1)}. */
  public static AffineMap identity(int numDims) {
    final ImmutableList.Builder<AffineExpr> b = ImmutableList.builder();
    for (int i = 0; i < numDims; i++) {
      b.add(AffineExpr.dim(i));
    }
    return new AffineMap(numDims, b.build());
  }

  /** Returns the number of results. */
  public int numResults() {
    return results.size();
  }

  /** Returns the {@code i}th result. */
  public AffineExpr result(int i) {
    return results.get(i);
  }

  /** Returns whether this is an identity map. */
  public boolean isIdentity() {
    return equals(identity(numDims));
  }

  /**
   * Composes this map with another; the other map is applied first.
   *
   * <p>The result has the dimensions of {@code map} and the results of this
   * map: {@code this.compose(map).apply(x)} equals
   * {@code this.apply(map.apply(x))}.
   */
  public AffineMap compose(AffineMap map) {
    checkArgument(numDims == map.numResults(),
        "cannot compose %s with %s: %s results feed %s dimensions", this, map,
        map.numResults(), numDims);
    final ImmutableList.Builder<AffineExpr> b = ImmutableList.builder();
    for (AffineExpr result : results) {
      b.add(result.replaceDims(map.results));
    }
    return new AffineMap(map.numDims, b.build());
  }

  /**
   * Applies this map to a point.
   *
   * @throws ArithmeticException if an intermediate result overflows
   */
  public long[] apply(long... point) {
    checkArgument(point.length == numDims,
        "expected %s coordinates, got %s", numDims, point.length);
    final long[] values = new long[results.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = results.get(i).evaluate(point);
    }
    return values;
  }

  @Override public int hashCode() {
    return Objects.hash(numDims, results);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof AffineMap
        && numDims == ((AffineMap) o).numDims
        && results.equals(((AffineMap) o).results);
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder("(");
    for (int i = 0; i < numDims; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append('d').append(i);
    }
    buf.append(") -> (");
    for (int i = 0; i < results.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      results.get(i).unparse(buf);
    }
    return buf.append(')').toString();
  }
}

// End AffineMap.java
