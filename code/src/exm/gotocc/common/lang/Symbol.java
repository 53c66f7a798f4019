/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotocc.common.lang;

import exm.gotocc.common.lang.Types.Type;

/**
 * Symbol table entry.  Expressions refer to symbols by name only.
 */
public class Symbol {
  private final String name;
  private final String baseName;
  private final Type type;
  private final String mode;
  private final SourceLocation location;
  private final boolean staticLifetime;
  /* Generated by the compiler rather than declared by the user */
  private final boolean auxiliary;
  private final Expr value;

  public Symbol(String name, String baseName, Type type, String mode,
      SourceLocation location, boolean staticLifetime, boolean auxiliary,
      Expr value) {
    assert(name != null);
    assert(type != null);
    this.name = name;
    this.baseName = baseName;
    this.type = type;
    this.mode = mode;
    this.location = location == null ? SourceLocation.NIL : location;
    this.staticLifetime = staticLifetime;
    this.auxiliary = auxiliary;
    this.value = value;
  }

  public String name() {
    return name;
  }

  public String baseName() {
    return baseName;
  }

  public Type type() {
    return type;
  }

  public String mode() {
    return mode;
  }

  public SourceLocation location() {
    return location;
  }

  public boolean isStaticLifetime() {
    return staticLifetime;
  }

  public boolean isAuxiliary() {
    return auxiliary;
  }

  /**
   * @return initial value, null if none recorded
   */
  public Expr value() {
    return value;
  }

  /**
   * @return expression referring to this symbol
   */
  public Expr symbolExpr() {
    return Expr.symbol(name, type);
  }

  @Override
  public String toString() {
    return name + " : " + type.toString() +
          (staticLifetime ? " (static)" : "");
  }
}
