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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.layout.affine.AffineMap;
import net.hydromatic.layout.ir.Ir;
import net.hydromatic.layout.layout.TiledLayout;
import net.hydromatic.layout.parse.LayoutParseException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a parse error,
   * then calls the underlying tracer. */
  public static Tracer withOnParseError(Tracer tracer,
      Consumer<LayoutParseException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onParseError(LayoutParseException e) {
        consumer.accept(e);
        super.onParseError(e);
      }
    };
  }

  /** Returns a tracer that performs the given action on each affine map,
   * then calls the underlying tracer. */
  public static Tracer withOnAffineMap(Tracer tracer,
      BiConsumer<TiledLayout, AffineMap> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAffineMap(TiledLayout layout, AffineMap map) {
        consumer.accept(layout, map);
        super.onAffineMap(layout, map);
      }
    };
  }

  /** Returns a tracer that performs the given action on the value of each
   * divisibility query that was proven, then calls the underlying tracer. */
  public static Tracer withOnProven(Tracer tracer, Consumer<Ir.Node> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDivisibility(Ir.Node value, long divisor,
          int fuel, boolean proven) {
        if (proven) {
          consumer.accept(value);
        }
        super.onDivisibility(value, divisor, fuel, proven);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onParseError(LayoutParseException e) {
    }

    @Override public void onAffineMap(TiledLayout layout, AffineMap map) {
    }

    @Override public void onDivisibility(Ir.Node value, long divisor,
        int fuel, boolean proven) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onParseError(LayoutParseException e) {
      tracer.onParseError(e);
    }

    @Override public void onAffineMap(TiledLayout layout, AffineMap map) {
      tracer.onAffineMap(layout, map);
    }

    @Override public void onDivisibility(Ir.Node value, long divisor,
        int fuel, boolean proven) {
      tracer.onDivisibility(value, divisor, fuel, proven);
    }
  }
}

// End Tracers.java
