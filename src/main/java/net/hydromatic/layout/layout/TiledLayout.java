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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableLongArray;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.layout.affine.AffineExpr;
import net.hydromatic.layout.affine.AffineMap;
import net.hydromatic.layout.parse.AsmParser;
import net.hydromatic.layout.parse.AsmPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Layout of an array whose minor dimensions are divided into nested tiles.
 *
 * <p>The text form is {@code <} tiles {@code ,[} strides {@code ]>}, for
 * example {@code <(8,128)(1,128),[1,8]>}: the two minor dimensions are first
 * divided into 8 x 128 blocks, and each of those is divided again into
 * 1 x 128 blocks. Tiles are listed outermost first. There is one tile stride
 * per dimension of the untiled array.
 */
public final class TiledLayout implements Attribute {
  public final ImmutableList<Tile> tiles;
  public final ImmutableLongArray tileStrides;

  private TiledLayout(ImmutableList<Tile> tiles,
      ImmutableLongArray tileStrides) {
    this.tiles = requireNonNull(tiles);
    this.tileStrides = tileStrides.trimmed();
  }

  /** Returns the interned layout with the given tiles and strides. */
  public static TiledLayout get(AttributeContext context, List<Tile> tiles,
      ImmutableLongArray tileStrides) {
    return context.intern(
        new TiledLayout(ImmutableList.copyOf(tiles), tileStrides));
  }

  /** Returns the interned layout with the given tiles and strides. */
  public static TiledLayout get(AttributeContext context, List<Tile> tiles,
      long... tileStrides) {
    return get(context, tiles, ImmutableLongArray.copyOf(tileStrides));
  }

  /**
   * Parses a tiled layout, starting at its opening '{@code <}'.
   *
   * <p>Returns null if the text is malformed; the reason is recorded in the
   * parser. Never returns a partially built layout.
   */
  public static @Nullable TiledLayout parse(AsmParser parser,
      AttributeContext context) {
    if (!parser.parseLess()) {
      return null;
    }
    final List<Tile> tiles = new ArrayList<>();
    while (parser.parseOptionalLParen()) {
      final ImmutableLongArray dimensions = parser.parseIntegerList(')');
      if (dimensions == null) {
        return null;
      }
      for (int i = 0; i < dimensions.length(); i++) {
        if (dimensions.get(i) <= 0) {
          parser.emitError("tile dimension must be positive: "
              + dimensions.get(i));
          return null;
        }
      }
      tiles.add(Tile.of(dimensions));
    }
    if (!parser.parseComma()) {
      return null;
    }
    if (!parser.parseOptionalLSquare()) {
      parser.emitError("expected '['");
      return null;
    }
    final ImmutableLongArray tileStrides = parser.parseIntegerList(']');
    if (tileStrides == null) {
      return null;
    }
    if (!parser.parseGreater()) {
      return null;
    }
    return get(context, tiles, tileStrides);
  }

  /** Returns the number of dimensions of the untiled array. */
  public int rank() {
    return tileStrides.length();
  }

  /**
   * Returns the map from an index into the untiled array to an index into
   * the tiled array.
   *
   * <p>Starting from the identity over {@link #rank()} dimensions, each tile
   * of rank k replaces the last k results {@code e} of the map so far with
   * {@code e floordiv t} followed by {@code e mod t}. For
   * {@code <(8,128),[1,1]>} the result is {@code (d0, d1) -> (d0 floordiv 8,
   * d1 floordiv 128, d0 mod 8, d1 mod 128)}.
   *
   * <p>The map is computed on each call.
   *
   * @throws AssertionError if a tile has more dimensions than the map it
   *     applies to
   */
  public AffineMap getAffineMap() {
    AffineMap map = AffineMap.identity(tileStrides.length());
    final List<AffineExpr> exprs = new ArrayList<>();
    for (Tile tile : tiles) {
      exprs.clear();
      final int untiledDims = map.numResults() - tile.rank();
      if (untiledDims < 0) {
        throw new AssertionError("Invalid tiled layout " + this + ": tile "
            + tile + " has more dimensions than " + map);
      }
      for (int i = 0; i < untiledDims; i++) {
        exprs.add(AffineExpr.dim(i));
      }
      for (int i = 0; i < tile.rank(); i++) {
        exprs.add(
            AffineExpr.dim(untiledDims + i).floorDiv(tile.dimension(i)));
      }
      for (int i = 0; i < tile.rank(); i++) {
        exprs.add(AffineExpr.dim(untiledDims + i).mod(tile.dimension(i)));
      }
      final AffineMap tileMap = AffineMap.of(map.numResults(), exprs);
      map = tileMap.compose(map);
    }
    return map;
  }

  @Override public String mnemonic() {
    return "tiled";
  }

  @Override public void print(AsmPrinter printer) {
    printer.append('<');
    for (Tile tile : tiles) {
      tile.print(printer);
    }
    printer.append(",[").appendList(tileStrides).append("]>");
  }

  @Override public int hashCode() {
    return Objects.hash(tiles, tileStrides);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TiledLayout
        && tiles.equals(((TiledLayout) o).tiles)
        && tileStrides.equals(((TiledLayout) o).tileStrides);
  }

  @Override public String toString() {
    final AsmPrinter printer = new AsmPrinter();
    print(printer);
    return printer.toString();
  }
}

// End TiledLayout.java
