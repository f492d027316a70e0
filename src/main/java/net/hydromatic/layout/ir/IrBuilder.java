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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import net.hydromatic.layout.type.MemRefType;
import net.hydromatic.layout.type.PrimitiveType;
import net.hydromatic.layout.type.Type;

/** Builds {@link Ir} nodes, checking that operand types are valid. */
public enum IrBuilder {
  /** The singleton instance of the IR builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ir;

  /** Creates a block argument. */
  public Ir.Argument argument(String name, Type type) {
    return new Ir.Argument(name, type);
  }

  /** Creates an integer constant. */
  public Ir.Constant constant(long value, Type type) {
    checkArgument(type.isInteger(), "not an integer type: %s", type);
    return new Ir.Constant(value, type);
  }

  /** Creates a constant of type {@code index}. */
  public Ir.Constant indexConstant(long value) {
    return constant(value, PrimitiveType.INDEX);
  }

  /** Creates a floating-point constant. */
  public Ir.Constant floatConstant(double value, Type type) {
    checkArgument(!type.isInteger() && !(type instanceof MemRefType),
        "not a floating-point type: %s", type);
    return new Ir.Constant(value, type);
  }

  /** Creates a product of two integers of the same type. */
  public Ir.MulI muli(Ir.Node lhs, Ir.Node rhs) {
    checkArgument(lhs.type.isInteger(), "not an integer: %s", lhs);
    checkArgument(lhs.type.equals(rhs.type),
        "operand types differ: %s vs %s", lhs.type, rhs.type);
    return new Ir.MulI(lhs, rhs);
  }

  /** Converts between {@code index} and another integer type. */
  public Ir.IndexCast indexCast(Ir.Node input, Type type) {
    checkArgument(input.type.isInteger() && type.isInteger(),
        "index_cast requires integer types: %s to %s", input.type, type);
    checkArgument(input.type == PrimitiveType.INDEX
            || type == PrimitiveType.INDEX,
        "index_cast requires index on one side: %s to %s", input.type, type);
    return new Ir.IndexCast(input, type);
  }

  /** Asserts that an integer is a multiple of a constant. */
  public Ir.AssumeMultiple assumeMultiple(Ir.Node input, long multiple) {
    checkArgument(input.type.isInteger(), "not an integer: %s", input);
    return new Ir.AssumeMultiple(input, multiple);
  }

  /** Removes the layout from a memref. */
  public Ir.EraseLayout eraseLayout(Ir.Node input) {
    checkArgument(input.type instanceof MemRefType,
        "erase_layout requires a memref: %s", input.type);
    return new Ir.EraseLayout(input,
        ((MemRefType) input.type).withoutLayout());
  }

  /** Creates an operation that analyses treat as opaque. */
  public Ir.Opaque opaque(String name, Type type, Ir.Node... inputs) {
    return new Ir.Opaque(name, type, ImmutableList.copyOf(inputs));
  }
}

// End IrBuilder.java
