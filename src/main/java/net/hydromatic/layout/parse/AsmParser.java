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

import com.google.common.primitives.ImmutableLongArray;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads the tokens of the attribute syntax from a string.
 *
 * <p>A {@code parseXxx} method either consumes its token and succeeds, or
 * leaves the position where the token was expected, records an error, and
 * fails. A {@code parseOptionalXxx} method is a probe: it consumes the token
 * if present and never records an error.
 *
 * <p>Only the first error is kept; it is the one that caused the enclosing
 * parse to give up. Whitespace between tokens is skipped.
 */
public class AsmParser {
  private final String input;
  private int offset;
  private @Nullable String errorMessage;
  private int errorOffset = -1;

  private AsmParser(String input) {
    this.input = requireNonNull(input);
  }

  /** Creates a parser positioned at the start of a string. */
  public static AsmParser of(String input) {
    return new AsmParser(input);
  }

  /** Returns the text being parsed. */
  public String input() {
    return input;
  }

  /** Returns the current offset in the input. */
  public int offset() {
    return offset;
  }

  /** Returns whether all input, other than trailing whitespace, has been
   * consumed. */
  public boolean atEnd() {
    skipWhitespace();
    return offset == input.length();
  }

  /** Returns the message of the first error, or null if there has been no
   * error. */
  public @Nullable String errorMessage() {
    return errorMessage;
  }

  /** Returns the offset of the first error, or -1. */
  public int errorOffset() {
    return errorOffset;
  }

  /** Returns whether an error has been recorded. */
  public boolean failed() {
    return errorMessage != null;
  }

  /**
   * Converts the recorded error into an exception.
   *
   * @throws IllegalStateException if no error has been recorded
   */
  public LayoutParseException toException() {
    if (errorMessage == null) {
      throw new IllegalStateException("no error");
    }
    return new LayoutParseException(errorMessage, input, errorOffset);
  }

  /** Records an error at the current offset, unless there is already an
   * error. Always returns false, so that callers can write
   * {@code return parser.emitError(...)}. */
  public boolean emitError(String message) {
    if (errorMessage == null) {
      errorMessage = message;
      errorOffset = offset;
    }
    return false;
  }

  /** Parses a mandatory '{@code <}'. */
  public boolean parseLess() {
    return parseChar('<');
  }

  /** Parses a mandatory '{@code >}'. */
  public boolean parseGreater() {
    return parseChar('>');
  }

  /** Parses a mandatory '{@code ,}'. */
  public boolean parseComma() {
    return parseChar(',');
  }

  /** Parses an optional '{@code (}'. */
  public boolean parseOptionalLParen() {
    return parseOptionalChar('(');
  }

  /** Parses an optional '{@code )}'. */
  public boolean parseOptionalRParen() {
    return parseOptionalChar(')');
  }

  /** Parses an optional '{@code [}'. */
  public boolean parseOptionalLSquare() {
    return parseOptionalChar('[');
  }

  /** Parses an optional '{@code ]}'. */
  public boolean parseOptionalRSquare() {
    return parseOptionalChar(']');
  }

  /** Parses an optional '{@code >}'. */
  public boolean parseOptionalGreater() {
    return parseOptionalChar('>');
  }

  /** Parses a mandatory punctuation character. */
  public boolean parseChar(char c) {
    if (parseOptionalChar(c)) {
      return true;
    }
    return emitError("expected '" + c + "'");
  }

  /** Parses an optional punctuation character. */
  public boolean parseOptionalChar(char c) {
    skipWhitespace();
    if (offset < input.length() && input.charAt(offset) == c) {
      ++offset;
      return true;
    }
    return false;
  }

  /**
   * Parses a mandatory, optionally negative, decimal integer.
   *
   * <p>Returns null and records an error if there is no integer at the
   * current position, or if its value does not fit in a {@code long}.
   */
  public @Nullable Long parseInteger() {
    skipWhitespace();
    final int start = offset;
    int i = start;
    if (i < input.length() && input.charAt(i) == '-') {
      ++i;
    }
    final int digitStart = i;
    while (i < input.length() && isDigit(input.charAt(i))) {
      ++i;
    }
    if (i == digitStart) {
      emitError("expected integer");
      return null;
    }
    final String s = input.substring(start, i);
    final long value;
    try {
      value = Long.parseLong(s);
    } catch (NumberFormatException e) {
      emitError("integer out of range: " + s);
      return null;
    }
    offset = i;
    return value;
  }

  /**
   * Parses a comma-separated list of integers, up to and including a closing
   * punctuation character. The opening character, if any, must already have
   * been consumed. The list may be empty.
   *
   * <p>Returns null and records an error if an element is not an integer, if
   * two elements are not separated by a comma, or if the closing character is
   * missing.
   */
  public @Nullable ImmutableLongArray parseIntegerList(char close) {
    final ImmutableLongArray.Builder builder = ImmutableLongArray.builder();
    boolean first = true;
    while (!parseOptionalChar(close)) {
      if (!first && !parseComma()) {
        return null;
      }
      first = false;
      final Long value = parseInteger();
      if (value == null) {
        return null;
      }
      builder.add(value);
    }
    return builder.build();
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private void skipWhitespace() {
    while (offset < input.length()
        && Character.isWhitespace(input.charAt(offset))) {
      ++offset;
    }
  }

  @Override public String toString() {
    return input.substring(0, offset) + "^" + input.substring(offset);
  }
}

// End AsmParser.java
