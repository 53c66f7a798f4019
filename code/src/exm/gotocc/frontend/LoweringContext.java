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

import exm.gotocc.common.Settings;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.program.GotoProgram;

/**
 * State threaded through the lowering of one unit: symbol table,
 * language mode, lifetime policy for new objects and the stack of open
 * blocks.  Not shared between threads.
 */
public class LoweringContext {
  private final SymbolTable symbolTable;
  private final String mode;
  private final ScopeStack scopeStack;
  private Lifetime lifetime;
  private SourceLocation location = SourceLocation.NIL;

  public LoweringContext(SymbolTable symbolTable, String mode,
                         Lifetime lifetime) {
    assert(symbolTable != null);
    assert(mode != null);
    this.symbolTable = symbolTable;
    this.mode = mode;
    this.lifetime = lifetime;
    this.scopeStack = new ScopeStack();
  }

  /**
   * Context for function bodies, in the configured language mode
   * @param symbolTable
   * @return
   */
  public static LoweringContext create(SymbolTable symbolTable) {
    return new LoweringContext(symbolTable, Settings.get(Settings.MODE),
                               Lifetime.AUTOMATIC_LOCAL);
  }

  public SymbolTable symbolTable() {
    return symbolTable;
  }

  public String mode() {
    return mode;
  }

  public Lifetime lifetime() {
    return lifetime;
  }

  /**
   * Switch lifetime policy, e.g. while converting static initialisers
   * @param lifetime
   * @return previous lifetime
   */
  public Lifetime setLifetime(Lifetime lifetime) {
    Lifetime old = this.lifetime;
    this.lifetime = lifetime;
    return old;
  }

  public ScopeStack scopeStack() {
    return scopeStack;
  }

  public void openScope() {
    scopeStack.push();
  }

  /**
   * Close innermost block, emitting DEAD instructions for its locals
   * @param dest
   */
  public void closeScope(GotoProgram dest) {
    scopeStack.pop(dest);
  }

  /**
   * Nesting depth, used for log indentation
   */
  public int getLevel() {
    return scopeStack.depth();
  }

  public void syncLocation(SourceLocation loc) {
    if (loc != null && !loc.isNil()) {
      this.location = loc;
    }
  }

  /**
   * @return location prefix for log messages
   */
  public String getLocation() {
    if (location.isNil()) {
      return "";
    }
    return location.toString() + ": ";
  }
}
