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
package net.hydromatic.layout.ir;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.layout.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nodes of an expression graph.
 *
 * <p>Each node is a value together with the operation that defines it; its
 * operands are the nodes it was computed from. Nodes are immutable and are
 * compared by identity: two arguments with the same name are still distinct
 * values.
 *
 * <p>This class functions as a namespace. Use {@link IrBuilder} to create
 * nodes.
 */
public class Ir {
  private Ir() {}

  /** Abstract base class of nodes. */
  public abstract static class Node {
    public final Op op;
    public final Type type;

    Node(Op op, Type type) {
      this.op = requireNonNull(op);
      this.type = requireNonNull(type);
    }

    /** Returns the operands, in order. */
    public List<Node> operands() {
      return ImmutableList.of();
    }

    /** Returns the {@code i}th operand. */
    public Node operand(int i) {
      return operands().get(i);
    }

    abstract StringBuilder unparse(StringBuilder buf);

    @Override public final String toString() {
      return unparse(new StringBuilder()).toString();
    }

    /** Appends an operation name and its operands as a call. */
    StringBuilder unparseCall(StringBuilder buf, String name,
        @Nullable Object extra) {
      buf.append(name).append('(');
      final List<Node> operands = operands();
      for (int i = 0; i < operands.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        operands.get(i).unparse(buf);
      }
      if (extra != null) {
        buf.append(operands.isEmpty() ? "" : ", ").append(extra);
      }
      return buf.append(')');
    }
  }

  /** Argument of the enclosing block, such as {@code %y}. */
  public static class Argument extends Node {
    public final String name;

    Argument(String name, Type type) {
      super(Op.ARGUMENT, type);
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append('%').append(name);
    }
  }

  /** Constant. Integer constants hold a {@link Long}; floating-point
   * constants hold a {@link Double}. */
  public static class Constant extends Node {
    public final Number value;

    Constant(Number value, Type type) {
      super(Op.CONSTANT, type);
      this.value = requireNonNull(value);
    }

    /** Returns the value if this is an integer constant, otherwise null. */
    public @Nullable Long intValue() {
      return value instanceof Long ? (Long) value : null;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(value);
    }
  }

  /** Integer multiplication. */
  public static class MulI extends Node {
    public final Node lhs;
    public final Node rhs;

    MulI(Node lhs, Node rhs) {
      super(Op.MULI, lhs.type);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override public List<Node> operands() {
      return ImmutableList.of(lhs, rhs);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return unparseCall(buf, op.opName, null);
    }
  }

  /** Conversion between {@code index} and an integer type. */
  public static class IndexCast extends Node {
    public final Node input;

    IndexCast(Node input, Type type) {
      super(Op.INDEX_CAST, type);
      this.input = requireNonNull(input);
    }

    @Override public List<Node> operands() {
      return ImmutableList.of(input);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return unparseCall(buf, op.opName, null);
    }
  }

  /** Assertion that a value is a multiple of a constant. The value of the
   * node is the value of its input. */
  public static class AssumeMultiple extends Node {
    public final Node input;
    public final long multiple;

    AssumeMultiple(Node input, long multiple) {
      super(Op.ASSUME_MULTIPLE, input.type);
      this.input = requireNonNull(input);
      this.multiple = multiple;
    }

    @Override public List<Node> operands() {
      return ImmutableList.of(input);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return unparseCall(buf, op.opName, multiple);
    }
  }

  /** Memref whose layout has been removed from its type. */
  public static class EraseLayout extends Node {
    public final Node input;

    EraseLayout(Node input, Type type) {
      super(Op.ERASE_LAYOUT, type);
      this.input = requireNonNull(input);
    }

    @Override public List<Node> operands() {
      return ImmutableList.of(input);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return unparseCall(buf, op.opName, null);
    }
  }

  /** Operation that analyses do not look inside, such as
   * {@code arith.addi}. */
  public static class Opaque extends Node {
    public final String name;
    public final ImmutableList<Node> inputs;

    Opaque(String name, Type type, ImmutableList<Node> inputs) {
      super(Op.OPAQUE, type);
      this.name = requireNonNull(name);
      this.inputs = requireNonNull(inputs);
    }

    @Override public List<Node> operands() {
      return inputs;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return unparseCall(buf, name, null);
    }
  }
}

// End Ir.java
