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
package net.hydromatic.cykgen.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import java.util.Map;

/**
 * Property that controls code generation.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that has no
 * value in the map has its default value.
 */
public enum Prop {
  /** String property "procedureName" is the name of the generated
   * procedure. Default is "cyk". */
  PROCEDURE_NAME("procedureName", String.class, "cyk"),

  /**
   * Integer property "tileSize" is the width of a tile in the parallel
   * traversal, unless the tile size macro overrides it when the generated
   * code is compiled. Default is 32.
   */
  TILE_SIZE("tileSize", Integer.class, 32),

  /**
   * Boolean property "parallel" is whether the generated code will be
   * compiled with OpenMP. If true, programs whose tables cannot be filled in
   * parallel are rejected; if false (the default), their parallel branch
   * contains an {@code #error} directive.
   */
  PARALLEL("parallel", Boolean.class, false),

  /** String property "parallelMacro" is the macro that is defined when the
   * generated code is compiled with OpenMP. Default is "_OPENMP". */
  PARALLEL_MACRO("parallelMacro", String.class, "_OPENMP"),

  /** String property "tileSizeMacro" is the macro that overrides the tile
   * size. Default is "TILE_SIZE". */
  TILE_SIZE_MACRO("tileSizeMacro", String.class, "TILE_SIZE"),

  /** String property "mutexName" is the shared mutex that guards
   * checkpoints. Default is "mutex". */
  MUTEX_NAME("mutexName", String.class, "mutex"),

  /** Integer property "indent" is the number of spaces per level of
   * indentation in the generated code. Default is 2. */
  INDENT("indent", Integer.class, 2);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, Object value) {
    requireNonNull(value, camelName);
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must have type " + type.getSimpleName());
    }
    map.put(this, value);
  }
}

// End Prop.java
