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

import net.hydromatic.layout.ir.Ir;
import net.hydromatic.layout.ir.Op;
import net.hydromatic.layout.type.MemRefType;
import net.hydromatic.layout.type.TypeException;

/** Utilities for values of memref type. */
public final class MemRefs {
  private MemRefs() {}

  /**
   * Returns the type of a memref, looking through one
   * {@code erase_layout} operation so that the layout it removed is visible.
   *
   * @throws TypeException if the value is not a memref
   */
  public static MemRefType getMemRefType(Ir.Node value) {
    if (value.op == Op.ERASE_LAYOUT) {
      value = ((Ir.EraseLayout) value).input;
    }
    if (!(value.type instanceof MemRefType)) {
      throw new TypeException("expected memref, got " + value.type.describe()
          + " for value " + value);
    }
    return (MemRefType) value.type;
  }
}

// End MemRefs.java
