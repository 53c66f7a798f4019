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

import exm.gotocc.common.lang.Expr;
import exm.gotocc.program.GotoProgram;

/**
 * Outcome of lowering one expression: instructions to run first, then
 * the residual pure expression standing in for the original value.
 */
public class CleanResult {
  private final GotoProgram program;
  private final Expr residual;

  public CleanResult(GotoProgram program, Expr residual) {
    this.program = program;
    this.residual = residual;
  }

  public GotoProgram program() {
    return program;
  }

  /**
   * @return residual expression, null if value was discarded
   */
  public Expr residual() {
    return residual;
  }

  @Override
  public String toString() {
    return program.toString() + "residual: " +
           (residual == null ? "<none>" : residual.toString());
  }
}
