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
import net.hydromatic.layout.parse.AsmParser;
import net.hydromatic.layout.parse.AsmPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Layout of a single vector value, a flat list of non-negative integers such
 * as {@code <8,128>}.
 *
 * <p>Values are separated by commas, so that the text form can be parsed.
 */
public final class VectorLayout implements Attribute {
  public final ImmutableLongArray values;

  private VectorLayout(ImmutableLongArray values) {
    for (int i = 0; i < values.length(); i++) {
      checkArgument(values.get(i) >= 0,
          "layout value must not be negative: %s", values.get(i));
    }
    this.values = values.trimmed();
  }

  /** Returns the interned layout with the given values. */
  public static VectorLayout get(AttributeContext context, long... values) {
    return context.intern(new VectorLayout(ImmutableLongArray.copyOf(values)));
  }

  /** Returns the interned layout with the given values. */
  public static VectorLayout get(AttributeContext context,
      ImmutableLongArray values) {
    return context.intern(new VectorLayout(values));
  }

  /** Parses a vector layout, starting at its opening '{@code <}'. Returns
   * null if the text is malformed. */
  public static @Nullable VectorLayout parse(AsmParser parser,
      AttributeContext context) {
    if (!parser.parseLess()) {
      return null;
    }
    final ImmutableLongArray values = parser.parseIntegerList('>');
    if (values == null) {
      return null;
    }
    for (int i = 0; i < values.length(); i++) {
      if (values.get(i) < 0) {
        parser.emitError("layout value must not be negative: "
            + values.get(i));
        return null;
      }
    }
    return get(context, values);
  }

  @Override public String mnemonic() {
    return "vpad";
  }

  @Override public void print(AsmPrinter printer) {
    printer.append('<').appendList(values).append('>');
  }

  @Override public int hashCode() {
    return values.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof VectorLayout
        && values.equals(((VectorLayout) o).values);
  }

  @Override public String toString() {
    final AsmPrinter printer = new AsmPrinter();
    print(printer);
    return printer.toString();
  }
}

// End VectorLayout.java
