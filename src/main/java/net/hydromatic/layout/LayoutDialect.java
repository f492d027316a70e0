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
package net.hydromatic.layout;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.layout.affine.AffineMap;
import net.hydromatic.layout.analysis.Divisibility;
import net.hydromatic.layout.analysis.MemRefs;
import net.hydromatic.layout.ir.Ir;
import net.hydromatic.layout.layout.Attribute;
import net.hydromatic.layout.layout.AttributeContext;
import net.hydromatic.layout.layout.TiledLayout;
import net.hydromatic.layout.layout.VectorLayout;
import net.hydromatic.layout.parse.AsmParser;
import net.hydromatic.layout.parse.AsmPrinter;
import net.hydromatic.layout.parse.LayoutParseException;
import net.hydromatic.layout.type.MemRefType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry point for a host compiler.
 *
 * <p>A dialect parses and prints layout attributes, interning them in its
 * {@link AttributeContext}; lowers tiled layouts to affine maps; and answers
 * divisibility queries. It reports what it does to a {@link Tracer}.
 *
 * <p>A dialect is immutable, and may be shared between threads if its tracer
 * may be.
 */
public class LayoutDialect {
  public final AttributeContext context;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  private LayoutDialect(AttributeContext context, Map<Prop, Object> propMap,
      Tracer tracer) {
    this.context = requireNonNull(context);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a dialect with default properties and no tracing. */
  public static LayoutDialect create() {
    return create(ImmutableMap.of(), Tracers.empty());
  }

  /** Creates a dialect. */
  public static LayoutDialect create(Map<Prop, Object> propMap,
      Tracer tracer) {
    return new LayoutDialect(AttributeContext.create(), propMap, tracer);
  }

  /** Returns a copy of this dialect with a different tracer, sharing this
   * dialect's attribute context. */
  public LayoutDialect withTracer(Tracer tracer) {
    return new LayoutDialect(context, propMap, tracer);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(propMap);
  }

  /**
   * Parses a tiled layout such as {@code <(8,128),[1,1]>}.
   *
   * <p>Returns null if the text is malformed, after notifying the tracer.
   */
  public @Nullable TiledLayout parseTiledLayout(String text) {
    final AsmParser parser = AsmParser.of(text);
    return complete(parser, TiledLayout.parse(parser, context));
  }

  /**
   * Parses a vector layout such as {@code <8,128>}.
   *
   * <p>Returns null if the text is malformed, after notifying the tracer.
   */
  public @Nullable VectorLayout parseVectorLayout(String text) {
    final AsmParser parser = AsmParser.of(text);
    return complete(parser, VectorLayout.parse(parser, context));
  }

  /**
   * Parses a tiled layout.
   *
   * @throws LayoutParseException if the text is malformed
   */
  public TiledLayout tiledLayout(String text) {
    final AsmParser parser = AsmParser.of(text);
    final TiledLayout layout =
        complete(parser, TiledLayout.parse(parser, context));
    if (layout == null) {
      throw parser.toException();
    }
    return layout;
  }

  /** Checks that a parser that produced an attribute has no trailing input,
   * and reports the error if there is one. */
  private <A extends Attribute> @Nullable A complete(AsmParser parser,
      @Nullable A attribute) {
    if (attribute != null
        && Prop.REQUIRE_COMPLETE_INPUT.booleanValue(propMap)
        && !parser.atEnd()) {
      parser.emitError("unexpected text after attribute");
    }
    if (parser.failed()) {
      tracer.onParseError(parser.toException());
      return null;
    }
    return attribute;
  }

  /** Returns the canonical text of an attribute. */
  public String print(Attribute attribute) {
    final AsmPrinter printer = new AsmPrinter();
    attribute.print(printer);
    return printer.toString();
  }

  /** Returns the affine map of a tiled layout. */
  public AffineMap affineMap(TiledLayout layout) {
    final AffineMap map = layout.getAffineMap();
    tracer.onAffineMap(layout, map);
    return map;
  }

  /** Returns whether a value is guaranteed to be a multiple of
   * {@code divisor}, searching with the fuel given by
   * {@link Prop#DIVISIBILITY_FUEL}. */
  public boolean isGuaranteedDivisible(Ir.Node value, long divisor) {
    return isGuaranteedDivisible(value, divisor,
        Prop.DIVISIBILITY_FUEL.intValue(propMap));
  }

  /** Returns whether a value is guaranteed to be a multiple of
   * {@code divisor}. */
  public boolean isGuaranteedDivisible(Ir.Node value, long divisor,
      int fuel) {
    final boolean proven =
        Divisibility.isGuaranteedDivisible(value, divisor, fuel);
    tracer.onDivisibility(value, divisor, fuel, proven);
    return proven;
  }

  /** Returns the type of a memref, looking through
   * {@code erase_layout}.
   *
   * @see MemRefs#getMemRefType */
  public MemRefType getMemRefType(Ir.Node value) {
    return MemRefs.getMemRefType(value);
  }
}

// End LayoutDialect.java
