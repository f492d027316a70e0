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
package net.hydromatic.layout.layout;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.ImmutableLongArray;
import net.hydromatic.layout.parse.AsmPrinter;

/**
 * One level of tiling: the size of a block in each of the innermost
 * dimensions of an array.
 *
 * <p>For example, {@code (8,128)} divides the two minor dimensions into
 * blocks of 8 rows and 128 columns. A tile of rank 0, {@code ()}, is legal
 * and leaves every dimension untouched.
 */
public final class Tile {
  private final ImmutableLongArray dimensions;

  private Tile(ImmutableLongArray dimensions) {
    for (int i = 0; i < dimensions.length(); i++) {
      checkArgument(dimensions.get(i) > 0,
          "tile dimension must be positive: %s", dimensions.get(i));
    }
    this.dimensions = dimensions.trimmed();
  }

  /** Creates a tile. */
  public static Tile of(long... dimensions) {
    return new Tile(ImmutableLongArray.copyOf(dimensions));
  }

  /** Creates a tile. */
  public static Tile of(ImmutableLongArray dimensions) {
    return new Tile(dimensions);
  }

  /** Returns the block size in each tiled dimension, major to minor. */
  public ImmutableLongArray dimensions() {
    return dimensions;
  }

  /** Returns the block size of the {@code i}th tiled dimension. */
  public long dimension(int i) {
    return dimensions.get(i);
  }

  /** Returns the number of dimensions that this tile divides. */
  public int rank() {
    return dimensions.length();
  }

  @Override public int hashCode() {
    return dimensions.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Tile
        && dimensions.equals(((Tile) o).dimensions);
  }

  @Override public String toString() {
    final AsmPrinter printer = new AsmPrinter();
    print(printer);
    return printer.toString();
  }

  /** Writes this tile as {@code (d0,d1,...)}. */
  public void print(AsmPrinter printer) {
    printer.append('(').appendList(dimensions).append(')');
  }
}

// End Tile.java
