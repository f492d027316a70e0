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

import static java.util.Objects.requireNonNull;

/** Exception thrown when the text of a layout attribute is malformed. */
public class LayoutParseException extends RuntimeException {
  private final String input;
  private final int offset;

  public LayoutParseException(String message, String input, int offset) {
    super(message);
    this.input = requireNonNull(input);
    this.offset = offset;
  }

  /** Returns the text that was being parsed. */
  public String input() {
    return input;
  }

  /** Returns the 0-based offset in the input where the error occurred. */
  public int offset() {
    return offset;
  }

  @Override public String toString() {
    return super.toString() + " at offset " + offset;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(input)
        .append(':')
        .append(offset)
        .append(" Error: ")
        .append(getMessage());
  }
}

// End LayoutParseException.java
