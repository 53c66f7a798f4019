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

import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.common.lang.Symbol;
import exm.gotocc.common.lang.Types.Type;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;

/**
 * This module contains logic to create compiler temporaries, so that
 * they are consistently registered, declared and retired.
 */
public class VarCreator {
  private final String tmpPrefix;

  public VarCreator(String tmpPrefix) {
    this.tmpPrefix = tmpPrefix;
  }

  /**
   * Creates a new block-scoped temporary: registers it in the symbol
   * table, declares it in dest and schedules its DEAD for the end of the
   * enclosing block.
   * @param context
   * @param type
   * @param purpose
   * @param dest
   * @param location
   * @return the new symbol
   */
  public Symbol newTmpSymbol(LoweringContext context, Type type,
      String purpose, GotoProgram dest, SourceLocation location) {
    Symbol tmp = createAuxSymbol(context, type, purpose, location, false,
                                 null);
    Expr sym = tmp.symbolExpr().at(location);
    dest.add(Instruction.makeDecl(sym, location));
    context.scopeStack().add(Code.dead(sym).at(location));
    return tmp;
  }

  /**
   * Register a new auxiliary symbol without emitting anything
   * @param context
   * @param type
   * @param purpose
   * @param location
   * @param staticLifetime
   * @param value initial value, may be null
   * @return
   */
  public Symbol createAuxSymbol(LoweringContext context, Type type,
      String purpose, SourceLocation location, boolean staticLifetime,
      Expr value) {
    Symbol sym = context.symbolTable().freshAuxSymbol(type, tmpPrefix,
          purpose, location, context.mode(), staticLifetime, value);
    LogHelper.debug(context, "Create tmp " + sym);
    return sym;
  }
}
