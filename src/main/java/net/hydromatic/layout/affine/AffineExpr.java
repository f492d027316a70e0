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
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Objects;

/**
 * Affine expression over dimension identifiers {@code d0}, {@code d1}, ....
 *
 * <p>Expressions are immutable and compare structurally. The factory methods
 * fold constants and apply a few local simplifications that hold for every
 * value of the dimensions, so two expressions built in different orders often,
 * but not always, end up equal.
 *
 * <p>Division and modulo use floor semantics and require a positive constant
 * divisor.
 */
public abstract class AffineExpr {
  public final Kind kind;

  AffineExpr(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns an expression for the {@code position}th dimension. */
  public static AffineExpr dim(int position) {
    checkArgument(position >= 0, "negative dimension %s", position);
    return new Dim(position);
  }

  /** Returns a constant expression. */
  public static AffineExpr constant(long value) {
    return new Constant(value);
  }

  /** Returns {@code this + e}. */
  public AffineExpr plus(AffineExpr e) {
    return add(this, e);
  }

  /** Returns {@code this + c}. */
  public AffineExpr plus(long c) {
    return add(this, constant(c));
  }

  /** Returns {@code this * e}; one of the operands must be constant. */
  public AffineExpr times(AffineExpr e) {
    return mul(this, e);
  }

  /** Returns {@code this * c}. */
  public AffineExpr times(long c) {
    return mul(this, constant(c));
  }

  /** Returns {@code this floordiv c}. */
  public AffineExpr floorDiv(long c) {
    checkDivisor(c);
    if (this instanceof Constant) {
      return constant(Math.floorDiv(((Constant) this).value, c));
    }
    if (c == 1) {
      return this;
    }
    if (kind == Kind.FLOOR_DIV
        && ((Binary) this).divisor() <= Long.MAX_VALUE / c) {
      // (e floordiv a) floordiv c = e floordiv (a * c); if a * c overflows,
      // the nested form is kept
      final Binary b = (Binary) this;
      return b.lhs.floorDiv(b.divisor() * c);
    }
    if (kind == Kind.MOD && ((Binary) this).divisor() <= c) {
      // 0 <= e mod a < a <= c
      return constant(0);
    }
    return new Binary(Kind.FLOOR_DIV, this, constant(c));
  }

  /** Returns {@code this ceildiv c}. */
  public AffineExpr ceilDiv(long c) {
    checkDivisor(c);
    if (this instanceof Constant) {
      final long value = ((Constant) this).value;
      return constant(
          Math.negateExact(Math.floorDiv(Math.negateExact(value), c)));
    }
    if (c == 1) {
      return this;
    }
    return new Binary(Kind.CEIL_DIV, this, constant(c));
  }

  /** Returns {@code this mod c}. */
  public AffineExpr mod(long c) {
    checkDivisor(c);
    if (this instanceof Constant) {
      return constant(Math.floorMod(((Constant) this).value, c));
    }
    if (c == 1) {
      return constant(0);
    }
    if (kind == Kind.MOD) {
      final Binary b = (Binary) this;
      final long a = b.divisor();
      if (a <= c) {
        // 0 <= e mod a < a <= c
        return this;
      }
      if (a % c == 0) {
        return b.lhs.mod(c);
      }
    }
    return new Binary(Kind.MOD, this, constant(c));
  }

  private static void checkDivisor(long c) {
    checkArgument(c > 0, "divisor must be positive: %s", c);
  }

  private static AffineExpr add(AffineExpr lhs, AffineExpr rhs) {
    if (lhs instanceof Constant && rhs instanceof Constant) {
      return constant(
          Math.addExact(((Constant) lhs).value, ((Constant) rhs).value));
    }
    if (lhs instanceof Constant) {
      // Constants go on the right.
      return add(rhs, lhs);
    }
    if (rhs instanceof Constant && ((Constant) rhs).value == 0) {
      return lhs;
    }
    return new Binary(Kind.ADD, lhs, rhs);
  }

  private static AffineExpr mul(AffineExpr lhs, AffineExpr rhs) {
    if (lhs instanceof Constant && rhs instanceof Constant) {
      return constant(
          Math.multiplyExact(((Constant) lhs).value, ((Constant) rhs).value));
    }
    if (lhs instanceof Constant) {
      return mul(rhs, lhs);
    }
    checkArgument(rhs instanceof Constant,
        "product of non-constant expressions is not affine: %s * %s",
        lhs, rhs);
    final long c = ((Constant) rhs).value;
    if (c == 0) {
      return rhs;
    }
    if (c == 1) {
      return lhs;
    }
    return new Binary(Kind.MUL, lhs, rhs);
  }

  /** Evaluates this expression for given values of the dimensions.
   *
   * @throws ArithmeticException if an intermediate result overflows
   */
  public abstract long evaluate(long[] dims);

  /** Returns the largest dimension position used, or -1 if none. */
  public abstract int maxDim();

  /** Replaces each dimension {@code di} with {@code replacements.get(i)}. */
  public abstract AffineExpr replaceDims(List<AffineExpr> replacements);

  abstract StringBuilder unparse(StringBuilder buf);

  @Override public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Kind of affine expression. */
  public enum Kind {
    DIM(null),
    CONSTANT(null),
    ADD(" + "),
    MUL(" * "),
    FLOOR_DIV(" floordiv "),
    CEIL_DIV(" ceildiv "),
    MOD(" mod ");

    final String symbol;

    Kind(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Dimension identifier. */
  public static class Dim extends AffineExpr {
    public final int position;

    Dim(int position) {
      super(Kind.DIM);
      this.position = position;
    }

    @Override public long evaluate(long[] dims) {
      return dims[position];
    }

    @Override public int maxDim() {
      return position;
    }

    @Override public AffineExpr replaceDims(List<AffineExpr> replacements) {
      return replacements.get(position);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append('d').append(position);
    }

    @Override public int hashCode() {
      return position;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Dim
          && position == ((Dim) o).position;
    }
  }

  /** Integer constant. */
  public static class Constant extends AffineExpr {
    public final long value;

    Constant(long value) {
      super(Kind.CONSTANT);
      this.value = value;
    }

    @Override public long evaluate(long[] dims) {
      return value;
    }

    @Override public int maxDim() {
      return -1;
    }

    @Override public AffineExpr replaceDims(List<AffineExpr> replacements) {
      return this;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(value);
    }

    @Override public int hashCode() {
      return Long.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
          && value == ((Constant) o).value;
    }
  }

  /** Binary expression. The right operand of {@code *}, {@code floordiv},
   * {@code ceildiv} and {@code mod} is always a {@link Constant}. */
  public static class Binary extends AffineExpr {
    public final AffineExpr lhs;
    public final AffineExpr rhs;

    Binary(Kind kind, AffineExpr lhs, AffineExpr rhs) {
      super(kind);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    long divisor() {
      return ((Constant) rhs).value;
    }

    @Override public long evaluate(long[] dims) {
      final long a = lhs.evaluate(dims);
      final long b = rhs.evaluate(dims);
      switch (kind) {
      case ADD:
        return Math.addExact(a, b);
      case MUL:
        return Math.multiplyExact(a, b);
      case FLOOR_DIV:
        return Math.floorDiv(a, b);
      case CEIL_DIV:
        return Math.negateExact(Math.floorDiv(Math.negateExact(a), b));
      case MOD:
        return Math.floorMod(a, b);
      default:
        throw new AssertionError(kind);
      }
    }

    @Override public int maxDim() {
      return Math.max(lhs.maxDim(), rhs.maxDim());
    }

    @Override public AffineExpr replaceDims(List<AffineExpr> replacements) {
      final AffineExpr lhs2 = lhs.replaceDims(replacements);
      final AffineExpr rhs2 = rhs.replaceDims(replacements);
      switch (kind) {
      case ADD:
        return lhs2.plus(rhs2);
      case MUL:
        return lhs2.times(rhs2);
      case FLOOR_DIV:
        return lhs2.floorDiv(divisor());
      case CEIL_DIV:
        return lhs2.ceilDiv(divisor());
      case MOD:
        return lhs2.mod(divisor());
      default:
        throw new AssertionError(kind);
      }
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      if (kind == Kind.ADD
          && rhs instanceof Constant
          && ((Constant) rhs).value < 0) {
        lhs.unparse(buf).append(" - ");
        // Negate as a string, so that Long.MIN_VALUE survives.
        return buf.append(Long.toString(((Constant) rhs).value).substring(1));
      }
      // "+" binds loosest and associates to the left.
      unparseOperand(buf, lhs, kind != Kind.ADD);
      buf.append(kind.symbol);
      return unparseOperand(buf, rhs,
          kind != Kind.ADD || rhs.kind == Kind.ADD);
    }

    private static StringBuilder unparseOperand(StringBuilder buf,
        AffineExpr e, boolean parenthesize) {
      if (parenthesize && e instanceof Binary) {
        return e.unparse(buf.append('(')).append(')');
      }
      return e.unparse(buf);
    }

    @Override public int hashCode() {
      return Objects.hash(kind, lhs, rhs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
          && kind == ((Binary) o).kind
          && lhs.equals(((Binary) o).lhs)
          && rhs.equals(((Binary) o).rhs);
    }
  }
}

// End AffineExpr.java
