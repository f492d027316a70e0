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

/** Kinds of {@link Ir.Node}. */
public enum Op {
  /** Argument of the enclosing function or block. Nothing is known about its
   * value. */
  ARGUMENT("argument"),
  /** {@code arith.constant}. */
  CONSTANT("constant"),
  /** {@code arith.muli}, integer multiplication. */
  MULI("muli"),
  /** {@code arith.index_cast}, conversion between {@code index} and a
   * fixed-width integer type. */
  INDEX_CAST("index_cast"),
  /** {@code tpu.assume_multiple}, a trusted assertion that its operand is a
   * multiple of a constant. */
  ASSUME_MULTIPLE("assume_multiple"),
  /** {@code tpu.erase_memref_layout}, removes the layout from the type of a
   * memref without changing the data it refers to. */
  ERASE_LAYOUT("erase_layout"),
  /** Any other operation. */
  OPAQUE("opaque");

  /** Name used when printing a node. */
  public final String opName;

  Op(String opName) {
    this.opName = opName;
  }
}

// End Op.java
