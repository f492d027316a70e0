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
package net.hydromatic.layout.type;

import static java.util.Objects.requireNonNull;

/** Scalar types. */
public enum PrimitiveType implements Type {
  INDEX("index", true),
  I1("i1", true),
  I8("i8", true),
  I16("i16", true),
  I32("i32", true),
  I64("i64", true),
  BF16("bf16", false),
  F32("f32", false);

  public final String name;
  private final boolean integer;

  PrimitiveType(String name, boolean integer) {
    this.name = requireNonNull(name);
    this.integer = integer;
  }

  @Override public boolean isInteger() {
    return integer;
  }

  @Override public String describe() {
    return name;
  }
}

// End PrimitiveType.java
