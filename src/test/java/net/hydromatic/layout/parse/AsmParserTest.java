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

import static net.hydromatic.layout.Matchers.failedWith;
import static net.hydromatic.layout.Matchers.succeeded;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.primitives.ImmutableLongArray;
import org.junit.jupiter.api.Test;

/** Tests {@link AsmParser} and {@link AsmPrinter}. */
class AsmParserTest {
  @Test
  void testPunctuation() {
    final AsmParser p = AsmParser.of("<(,)>");
    assertThat(p.parseLess(), is(true));
    assertThat(p.parseOptionalLSquare(), is(false));
    assertThat(p.parseOptionalLParen(), is(true));
    assertThat(p.parseComma(), is(true));
    assertThat(p.parseOptionalRParen(), is(true));
    assertThat(p.parseOptionalGreater(), is(true));
    assertThat(p.atEnd(), is(true));
    assertThat(p, succeeded());
  }

  /** An optional token that is absent does not record an error; a mandatory
   * one does. */
  @Test
  void testOptionalDoesNotFail() {
    final AsmParser p = AsmParser.of("abc");
    assertThat(p.parseOptionalLParen(), is(false));
    assertThat(p.parseOptionalRSquare(), is(false));
    assertThat(p, succeeded());
    assertThat(p.parseGreater(), is(false));
    assertThat(p, failedWith("expected '>'", 0));
    assertThat(p.offset(), is(0));
  }

  @Test
  void testWhitespace() {
    final AsmParser p = AsmParser.of("  <\n 12 \t, -3 >  ");
    assertThat(p.parseLess(), is(true));
    assertThat(p.parseInteger(), is(12L));
    assertThat(p.parseComma(), is(true));
    assertThat(p.parseInteger(), is(-3L));
    assertThat(p.parseGreater(), is(true));
    assertThat(p.atEnd(), is(true));
  }

  @Test
  void testInteger() {
    assertThat(AsmParser.of("0").parseInteger(), is(0L));
    assertThat(AsmParser.of("9223372036854775807").parseInteger(),
        is(Long.MAX_VALUE));
    assertThat(AsmParser.of("-9223372036854775808").parseInteger(),
        is(Long.MIN_VALUE));
    assertThat(AsmParser.of("128)").parseInteger(), is(128L));

    final AsmParser p = AsmParser.of("9223372036854775808");
    assertThat(p.parseInteger(), nullValue());
    assertThat(p,
        failedWith("integer out of range: 9223372036854775808", 0));

    final AsmParser p2 = AsmParser.of("(-)");
    assertThat(p2.parseOptionalLParen(), is(true));
    assertThat(p2.parseInteger(), nullValue());
    assertThat(p2, failedWith("expected integer", 1));

    final AsmParser p3 = AsmParser.of("x1");
    assertThat(p3.parseInteger(), nullValue());
    assertThat(p3, failedWith("expected integer", 0));
  }

  @Test
  void testIntegerList() {
    assertThat(AsmParser.of("1,2,3)").parseIntegerList(')'),
        is(ImmutableLongArray.of(1, 2, 3)));
    assertThat(AsmParser.of("]").parseIntegerList(']'),
        is(ImmutableLongArray.of()));
    assertThat(AsmParser.of(" 7 ]").parseIntegerList(']'),
        is(ImmutableLongArray.of(7)));

    final AsmParser p = AsmParser.of("1 2)");
    assertThat(p.parseIntegerList(')'), nullValue());
    assertThat(p, failedWith("expected ','", 2));

    final AsmParser p2 = AsmParser.of("1,)");
    assertThat(p2.parseIntegerList(')'), nullValue());
    assertThat(p2, failedWith("expected integer", 2));

    final AsmParser p3 = AsmParser.of("1,2");
    assertThat(p3.parseIntegerList(')'), nullValue());
    assertThat(p3, failedWith("expected ','", 3));
  }

  /** Only the first error is kept. */
  @Test
  void testFirstErrorWins() {
    final AsmParser p = AsmParser.of("x");
    assertThat(p.parseComma(), is(false));
    assertThat(p.emitError("something else"), is(false));
    assertThat(p, failedWith("expected ','", 0));

    final LayoutParseException e = p.toException();
    assertThat(e.getMessage(), is("expected ','"));
    assertThat(e.offset(), is(0));
    assertThat(e.input(), is("x"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("x:0 Error: expected ','"));
  }

  @Test
  void testToExceptionWithoutError() {
    final AsmParser p = AsmParser.of("<");
    assertThrows(IllegalStateException.class, p::toException);
  }

  @Test
  void testToString() {
    final AsmParser p = AsmParser.of("<1>");
    p.parseLess();
    assertThat(p, hasToString("<^1>"));
  }

  @Test
  void testPrinter() {
    final AsmPrinter printer = new AsmPrinter();
    printer.append('<')
        .appendList(ImmutableLongArray.of(8, -1, 0))
        .append(",[")
        .appendList(ImmutableLongArray.of())
        .append("]>")
        .append(42L);
    assertThat(printer, hasToString("<8,-1,0,[]>42"));
  }
}

// End AsmParserTest.java
