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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Constructs and interns attributes.
 *
 * <p>Two attributes that are equal are represented by the same object once
 * they have been interned by the same context. The context is safe to use from
 * several threads.
 */
public class AttributeContext {
  private final Interner<Attribute> interner = Interners.newWeakInterner();

  private AttributeContext() {}

  /** Creates an empty context. */
  public static AttributeContext create() {
    return new AttributeContext();
  }

  /** Returns the canonical instance of an attribute. */
  @SuppressWarnings("unchecked")
  public <A extends Attribute> A intern(A attribute) {
    return (A) interner.intern(attribute);
  }
}

// End AttributeContext.java
