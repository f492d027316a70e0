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

import net.hydromatic.layout.affine.AffineMap;
import net.hydromatic.layout.ir.Ir;
import net.hydromatic.layout.layout.TiledLayout;
import net.hydromatic.layout.parse.LayoutParseException;

/** Receives notification of the work done by a {@link LayoutDialect}. */
public interface Tracer {
  /** Called when the text of an attribute cannot be parsed. */
  void onParseError(LayoutParseException e);

  /** Called when the affine map of a layout has been computed. */
  void onAffineMap(TiledLayout layout, AffineMap map);

  /** Called with the outcome of a divisibility query. */
  void onDivisibility(Ir.Node value, long divisor, int fuel, boolean proven);
}

// End Tracer.java
