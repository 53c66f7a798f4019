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
package exm.gotocc.frontend;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.common.lang.Symbol;
import exm.gotocc.common.lang.Types.Type;

/**
 * Global symbol table.  Symbols are registered before use and never
 * removed.
 */
public class SymbolTable {
  private final Map<String, Symbol> symbols =
                        new LinkedHashMap<String, Symbol>();

  /** Suffix counter for fresh auxiliary symbols */
  private long nextSuffix = 1;

  public void add(Symbol sym) {
    if (symbols.containsKey(sym.name())) {
      throw new GotoCCRuntimeError("Symbol " + sym.name() +
                                   " already in symbol table");
    }
    symbols.put(sym.name(), sym);
  }

  /**
   * @param name
   * @return the symbol, or null if not present
   */
  public Symbol lookup(String name) {
    return symbols.get(name);
  }

  public boolean contains(String name) {
    return symbols.containsKey(name);
  }

  public Collection<Symbol> symbols() {
    return Collections.unmodifiableCollection(symbols.values());
  }

  public int size() {
    return symbols.size();
  }

  /**
   * Create and register a compiler-generated symbol with a name that is
   * not yet used: prefix::purpose$n
   * @param type
   * @param prefix
   * @param purpose short description, e.g. "if_expr"
   * @param location
   * @param mode language mode
   * @param staticLifetime
   * @param value initial value, may be null
   * @return the new symbol
   */
  public Symbol freshAuxSymbol(Type type, String prefix, String purpose,
      SourceLocation location, String mode, boolean staticLifetime,
      Expr value) {
    String name;
    String baseName;
    do {
      baseName = purpose + "$" + nextSuffix;
      name = prefix + "::" + baseName;
      nextSuffix++;
    } while (symbols.containsKey(name));

    Symbol sym = new Symbol(name, baseName, type, mode, location,
                            staticLifetime, true, value);
    add(sym);
    return sym;
  }
}
