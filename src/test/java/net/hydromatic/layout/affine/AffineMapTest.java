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

import static net.hydromatic.layout.affine.AffineExpr.constant;
import static net.hydromatic.layout.affine.AffineExpr.dim;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.layout.layout.AttributeContext;
import net.hydromatic.layout.layout.Tile;
import net.hydromatic.layout.layout.TiledLayout;
import net.hydromatic.layout.parse.AsmParser;
import org.junit.jupiter.api.Test;

/** Tests {@link AffineExpr}, {@link AffineMap}, and
 * {@link TiledLayout#getAffineMap()}. */
class AffineMapTest {
  final AttributeContext context = AttributeContext.create();

  private TiledLayout layout(String text) {
    final TiledLayout layout = TiledLayout.parse(AsmParser.of(text), context);
    if (layout == null) {
      throw new AssertionError("invalid: " + text);
    }
    return layout;
  }

  @Test
  void testExprToString() {
    assertThat(dim(0), hasToString("d0"));
    assertThat(constant(-5), hasToString("-5"));
    assertThat(dim(0).floorDiv(8), hasToString("d0 floordiv 8"));
    assertThat(dim(1).ceilDiv(8), hasToString("d1 ceildiv 8"));
    assertThat(dim(1).mod(128), hasToString("d1 mod 128"));
    assertThat(dim(0).plus(-3), hasToString("d0 - 3"));
    assertThat(dim(0).plus(dim(1).times(8)), hasToString("d0 + d1 * 8"));
    assertThat(dim(0).plus(dim(1)).plus(dim(2)),
        hasToString("d0 + d1 + d2"));
    assertThat(dim(0).plus(dim(1).plus(dim(2))),
        hasToString("d0 + (d1 + d2)"));
    assertThat(dim(0).plus(dim(1)).times(4), hasToString("(d0 + d1) * 4"));
    assertThat(dim(0).mod(8).mod(3), hasToString("(d0 mod 8) mod 3"));
  }

  @Test
  void testExprSimplify() {
    assertThat(dim(0).floorDiv(1), is(dim(0)));
    assertThat(dim(0).ceilDiv(1), is(dim(0)));
    assertThat(dim(0).mod(1), is(constant(0)));
    assertThat(dim(0).times(1), is(dim(0)));
    assertThat(dim(0).times(0), is(constant(0)));
    assertThat(dim(0).plus(0), is(dim(0)));
    assertThat(constant(3).times(dim(1)), is(dim(1).times(3)));
    assertThat(constant(3).plus(dim(1)), is(dim(1).plus(3)));
    assertThat(dim(0).floorDiv(4).floorDiv(2), is(dim(0).floorDiv(8)));
    assertThat(dim(0).mod(8).mod(4), is(dim(0).mod(4)));
    assertThat(dim(0).mod(8).mod(16), is(dim(0).mod(8)));
    assertThat(dim(0).mod(8).floorDiv(8), is(constant(0)));
    assertThat(dim(0).mod(8).floorDiv(4),
        hasToString("(d0 mod 8) floordiv 4"));

    // Constant folding uses floor semantics.
    assertThat(constant(-7).floorDiv(2), is(constant(-4)));
    assertThat(constant(-7).ceilDiv(2), is(constant(-3)));
    assertThat(constant(7).ceilDiv(2), is(constant(4)));
    assertThat(constant(-7).mod(2), is(constant(1)));
    assertThat(constant(6).times(constant(7)), is(constant(42)));
    assertThat(constant(6).plus(constant(-7)), is(constant(-1)));
  }

  @Test
  void testExprInvalid() {
    assertThrows(IllegalArgumentException.class, () -> dim(0).floorDiv(0));
    assertThrows(IllegalArgumentException.class, () -> dim(0).mod(-4));
    assertThrows(IllegalArgumentException.class, () -> dim(0).ceilDiv(-1));
    assertThrows(IllegalArgumentException.class, () -> dim(-1));
    assertThrows(IllegalArgumentException.class,
        () -> dim(0).times(dim(1)));
    assertThrows(ArithmeticException.class,
        () -> constant(Long.MAX_VALUE).plus(constant(1)));
  }

  @Test
  void testExprEvaluate() {
    final long[] dims = {-9, 20};
    assertThat(dim(0).floorDiv(8).evaluate(dims), is(-2L));
    assertThat(dim(0).ceilDiv(8).evaluate(dims), is(-1L));
    assertThat(dim(0).mod(8).evaluate(dims), is(7L));
    assertThat(dim(1).ceilDiv(8).evaluate(dims), is(3L));
    assertThat(dim(0).plus(dim(1).times(3)).evaluate(dims), is(51L));
    assertThrows(ArithmeticException.class,
        () -> dim(0).times(Long.MAX_VALUE).evaluate(dims));
  }

  @Test
  void testMap() {
    final AffineMap identity = AffineMap.identity(2);
    assertThat(identity, hasToString("(d0, d1) -> (d0, d1)"));
    assertThat(identity.isIdentity(), is(true));
    assertThat(AffineMap.identity(0), hasToString("() -> ()"));

    final AffineMap map =
        AffineMap.of(2, ImmutableList.of(dim(1), dim(0).plus(1)));
    assertThat(map, hasToString("(d0, d1) -> (d1, d0 + 1)"));
    assertThat(map.isIdentity(), is(false));
    assertThat(map.numDims, is(2));
    assertThat(map.numResults(), is(2));
    assertThat(map.apply(3, 4), is(new long[] {4, 4}));

    assertThrows(IllegalArgumentException.class,
        () -> AffineMap.of(1, ImmutableList.of(dim(1))));
    assertThrows(IllegalArgumentException.class, () -> map.apply(1));
  }

  /** {@code f.compose(g)} applies {@code g} first. */
  @Test
  void testCompose() {
    final AffineMap swap =
        AffineMap.of(2, ImmutableList.of(dim(1), dim(0)));
    final AffineMap split = AffineMap.of(2,
        ImmutableList.of(dim(0).floorDiv(4), dim(1), dim(0).mod(4)));
    final AffineMap composed = split.compose(swap);
    assertThat(composed,
        hasToString("(d0, d1) -> (d1 floordiv 4, d0, d1 mod 4)"));
    assertThat(composed.apply(5, 9), is(split.apply(swap.apply(5, 9))));
    assertThat(swap.compose(swap).isIdentity(), is(true));

    final AffineMap identity3 = AffineMap.identity(3);
    assertThat(identity3.compose(split), is(split));

    assertThrows(IllegalArgumentException.class,
        () -> split.compose(identity3));
  }

  @Test
  void testLayoutMapOneTile() {
    final AffineMap map = layout("<(8,128),[1,1]>").getAffineMap();
    assertThat(map,
        hasToString("(d0, d1) -> (d0 floordiv 8, d1 floordiv 128, "
            + "d0 mod 8, d1 mod 128)"));
    assertThat(map.apply(13, 300), is(new long[] {1, 2, 5, 44}));
    assertThat(map.apply(-1, -1), is(new long[] {-1, -1, 7, 127}));
  }

  /** A tile of lower rank than the array leaves the major dimensions
   * untiled. */
  @Test
  void testLayoutMapUntiledPrefix() {
    final AffineMap map = layout("<(8,128),[1,1,1]>").getAffineMap();
    assertThat(map,
        hasToString("(d0, d1, d2) -> (d0, d1 floordiv 8, d2 floordiv 128, "
            + "d1 mod 8, d2 mod 128)"));
  }

  @Test
  void testLayoutMapTwoTiles() {
    final TiledLayout layout = layout("<(8,128)(1,128),[1,8]>");
    final AffineMap map = layout.getAffineMap();
    assertThat(map,
        hasToString("(d0, d1) -> (d0 floordiv 8, d1 floordiv 128, "
            + "d0 mod 8, 0, 0, d1 mod 128)"));
    assertThat(map.numDims, is(2));
    assertThat(map.numResults(), is(6));
    assertThat(map.apply(13, 300), is(new long[] {1, 2, 5, 0, 0, 44}));

    // The map is recomputed, not cached, but is equal each time.
    assertThat(layout.getAffineMap(), is(map));
  }

  /** Each tile's map is applied to the result of the tiles before it, so the
   * second tile divides the in-tile coordinates of the first. */
  @Test
  void testLayoutMapNested() {
    final AffineMap map = layout("<(16)(4),[1]>").getAffineMap();
    assertThat(map,
        hasToString("(d0) -> (d0 floordiv 16, (d0 mod 16) floordiv 4, "
            + "d0 mod 4)"));
    for (long i = -40; i < 40; i++) {
      final long[] r = map.apply(i);
      assertThat(r[0] * 16 + r[1] * 4 + r[2], is(i));
    }
  }

  /** The output arity is the rank plus the rank of every tile. */
  @Test
  void testLayoutMapRank() {
    final String[] texts = {
        "<,[]>", "<,[1,1,1]>", "<(2),[1]>", "<(2)(2,2),[1]>",
        "<(8,128)(2,1)(1),[1,1,1]>", "<(4)(4)(4)(4),[1,1]>"
    };
    for (String text : texts) {
      final TiledLayout layout = layout(text);
      int expectedResults = layout.rank();
      for (Tile tile : layout.tiles) {
        expectedResults += tile.rank();
      }
      final AffineMap map = layout.getAffineMap();
      assertThat(text, map.numDims, is(layout.rank()));
      assertThat(text, map.numResults(), is(expectedResults));
    }
  }

  /** A tile of rank 0 is a level that divides nothing, so the map is as if
   * the tile were absent. */
  @Test
  void testLayoutMapEmptyTile() {
    assertThat(layout("<(),[1,1]>").getAffineMap().isIdentity(), is(true));
    assertThat(layout("<()(8,128)(),[1,1]>").getAffineMap(),
        is(layout("<(8,128),[1,1]>").getAffineMap()));
    assertThat(layout("<,[1,1]>").getAffineMap(),
        is(AffineMap.identity(2)));
    assertThat(layout("<(),[]>").getAffineMap(),
        is(AffineMap.identity(0)));
  }

  /** A tile with more dimensions than the map so far is a broken invariant,
   * and is fatal. */
  @Test
  void testLayoutMapInvalid() {
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> layout("<(8,128),[1]>").getAffineMap());
    assertThat(e.getMessage(),
        is("Invalid tiled layout <(8,128),[1]>: tile (8,128) has more "
            + "dimensions than (d0) -> (d0)"));

    // The second tile sees the 2 results of the first; 3 is too many.
    assertThrows(AssertionError.class,
        () -> layout("<(2)(2,2,2),[1]>").getAffineMap());
    assertThat(layout("<(2)(2,2),[1]>").getAffineMap().numResults(), is(4));

    assertThrows(AssertionError.class,
        () -> layout("<(1),[]>").getAffineMap());
  }

  /** Nested divisions whose divisors multiply beyond the range of a
   * {@code long} are not folded, so a huge tile still yields a map. */
  @Test
  void testLayoutMapHugeTile() {
    final long big = 1L << 62;
    assertThat(dim(0).floorDiv(big).floorDiv(4),
        hasToString("(d0 floordiv 4611686018427387904) floordiv 4"));
    assertThat(dim(0).floorDiv(big).floorDiv(1),
        is(dim(0).floorDiv(big)));
    assertThat(dim(0).floorDiv(1L << 31).floorDiv(1L << 31),
        is(dim(0).floorDiv(big)));

    final AffineMap map =
        layout("<(4611686018427387904)(4,1),[1]>").getAffineMap();
    assertThat(map.numDims, is(1));
    assertThat(map.numResults(), is(4));
    assertThat(map,
        hasToString("(d0) -> ((d0 floordiv 4611686018427387904) floordiv 4, "
            + "d0 mod 4611686018427387904, "
            + "(d0 floordiv 4611686018427387904) mod 4, 0)"));
    assertThat(map.apply(Long.MAX_VALUE),
        is(new long[] {0, big - 1, 1, 0}));
    assertThat(map.apply(-1), is(new long[] {-1, big - 1, 3, 0}));
  }

  /** The tiled coordinates can be linearized by composing with a map built
   * from the strides of the tiled array. */
  @Test
  void testLinearize() {
    // 16 x 256 array in 8 x 128 tiles: a 2 x 2 grid of 1024-element tiles.
    final AffineMap tiled = layout("<(8,128),[1,1]>").getAffineMap();
    final AffineMap linear = AffineMap.of(4,
        ImmutableList.of(
            dim(0).times(2048)
                .plus(dim(1).times(1024))
                .plus(dim(2).times(128))
                .plus(dim(3))));
    final AffineMap offset = linear.compose(tiled);
    assertThat(offset.numDims, is(2));
    assertThat(offset.apply(9, 130), is(new long[] {3202}));
    assertThat(offset.apply(0, 0), is(new long[] {0}));
    assertThat(offset.apply(7, 127), is(new long[] {1023}));
    assertThat(offset.apply(8, 0), is(new long[] {2048}));
    assertThat(offset, not(is(tiled)));
  }
}

// End AffineMapTest.java
