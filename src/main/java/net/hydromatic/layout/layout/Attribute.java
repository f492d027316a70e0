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

import net.hydromatic.layout.parse.AsmPrinter;

/**
 * Layout metadata attached to an array-like value.
 *
 * <p>Attributes are immutable, have value semantics, and are interned by an
 * {@link AttributeContext}.
 */
public interface Attribute {
  /** Returns the name under which the attribute appears in a type, for
   * example "tiled" in {@code #tpu.tiled<(8,128),[1,1]>}. */
  String mnemonic();

  /** Writes the canonical text of this attribute. */
  void print(AsmPrinter printer);
}

// End Attribute.java
