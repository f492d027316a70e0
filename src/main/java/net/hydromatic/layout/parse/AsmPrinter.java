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
package net.hydromatic.layout.parse;

import com.google.common.primitives.ImmutableLongArray;

/** Writes the textual form of attributes.
 *
 * <p>Output is canonical: no whitespace is ever emitted, so that printing a
 * parsed attribute reproduces its canonical text exactly. */
public class AsmPrinter {
  private final StringBuilder buf = new StringBuilder();

  public AsmPrinter append(char c) {
    buf.append(c);
    return this;
  }

  public AsmPrinter append(String s) {
    buf.append(s);
    return this;
  }

  public AsmPrinter append(long value) {
    buf.append(value);
    return this;
  }

  /** Appends a list of integers separated by commas, with no brackets. */
  public AsmPrinter appendList(ImmutableLongArray values) {
    for (int i = 0; i < values.length(); i++) {
      if (i > 0) {
        buf.append(',');
      }
      buf.append(values.get(i));
    }
    return this;
  }

  @Override public String toString() {
    return buf.toString();
  }
}

// End AsmPrinter.java
