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

import java.util.Set;

import exm.gotocc.common.exceptions.InvariantViolation;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;

/**
 * Sanity checks for lowered programs
 */
public class GotoProgramChecker {

  /**
   * Check that jumps stay inside the program and that instructions only
   * contain pure expressions
   * @param program
   * @throws InvariantViolation
   */
  public static void check(GotoProgram program) {
    Set<Instruction> members = program.instructionSet();
    for (Instruction i: program.instructions()) {
      if (i.isGoto()) {
        if (i.target() == null || !members.contains(i.target())) {
          throw new InvariantViolation(i.location(),
              "jump target not in program", i.toString());
        }
      }
      checkPure(i.guard());
      if (i.code() != null) {
        for (Expr e: i.code().operands()) {
          // e.g. call without result
          if (e != null) {
            checkPure(e);
          }
        }
      }
    }
  }

  public static void checkPure(Expr expr) {
    if (ExprCleaner.needsCleaning(expr)) {
      throw new InvariantViolation(expr.findSourceLocation(),
          "expression was not lowered", expr.toString());
    }
  }
}
