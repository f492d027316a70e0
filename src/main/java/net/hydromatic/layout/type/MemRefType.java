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
package net.hydromatic.layout.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.primitives.ImmutableLongArray;
import java.util.Objects;
import net.hydromatic.layout.layout.Attribute;
import net.hydromatic.layout.parse.AsmPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type of a reference to an array in memory, optionally with a layout.
 *
 * <p>Described as {@code memref<8x128xf32, #tpu.tiled<(8,128),[1,1]>>}; a
 * memref without a layout is {@code memref<8x128xf32>}.
 */
public final class MemRefType implements Type {
  public final ImmutableLongArray shape;
  public final Type elementType;
  public final @Nullable Attribute layout;

  private MemRefType(ImmutableLongArray shape, Type elementType,
      @Nullable Attribute layout) {
    for (int i = 0; i < shape.length(); i++) {
      checkArgument(shape.get(i) >= 0, "negative extent %s", shape.get(i));
    }
    checkArgument(!(elementType instanceof MemRefType),
        "memref of memref is not allowed");
    this.shape = shape.trimmed();
    this.elementType = requireNonNull(elementType);
    this.layout = layout;
  }

  /** Creates a memref type with no layout. */
  public static MemRefType of(Type elementType, long... shape) {
    return new MemRefType(ImmutableLongArray.copyOf(shape), elementType, null);
  }

  /** Returns a copy of this type with a given layout. */
  public MemRefType withLayout(@Nullable Attribute layout) {
    return Objects.equals(layout, this.layout)
        ? this
        : new MemRefType(shape, elementType, layout);
  }

  /** Returns a copy of this type without its layout. */
  public MemRefType withoutLayout() {
    return withLayout(null);
  }

  /** Returns the number of dimensions. */
  public int rank() {
    return shape.length();
  }

  @Override public boolean isInteger() {
    return false;
  }

  @Override public String describe() {
    final StringBuilder buf = new StringBuilder("memref<");
    for (int i = 0; i < shape.length(); i++) {
      buf.append(shape.get(i)).append('x');
    }
    buf.append(elementType.describe());
    if (layout != null) {
      final AsmPrinter printer = new AsmPrinter();
      layout.print(printer);
      buf.append(", #tpu.").append(layout.mnemonic()).append(printer);
    }
    return buf.append('>').toString();
  }

  @Override public int hashCode() {
    return Objects.hash(shape, elementType, layout);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof MemRefType
        && shape.equals(((MemRefType) o).shape)
        && elementType.equals(((MemRefType) o).elementType)
        && Objects.equals(layout, ((MemRefType) o).layout);
  }

  @Override public String toString() {
    return describe();
  }
}

// End MemRefType.java
