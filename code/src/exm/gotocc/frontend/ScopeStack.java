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

import java.util.ArrayList;
import java.util.List;

import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.CodeKind;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;

/**
 * Stack of open blocks.  Each block collects the DEAD statements for the
 * locals that go out of scope when it is left.
 */
public class ScopeStack {

  private final List<List<Code>> scopes = new ArrayList<List<Code>>();

  public ScopeStack() {
    // Outermost scope always exists
    scopes.add(new ArrayList<Code>());
  }

  /**
   * Register a cleanup to run when the innermost block is left
   * @param dead DEAD statement for a block-scoped symbol
   */
  public void add(Code dead) {
    if (dead.kind() != CodeKind.DEAD) {
      throw new GotoCCRuntimeError("Expected DEAD cleanup, got " + dead.kind());
    }
    current().add(dead);
  }

  public void push() {
    scopes.add(new ArrayList<Code>());
  }

  /**
   * Leave innermost block, emitting its cleanups in reverse order of
   * registration
   * @param dest
   */
  public void pop(GotoProgram dest) {
    if (scopes.size() <= 1) {
      throw new GotoCCRuntimeError("Tried to pop outermost scope");
    }
    List<Code> cleanups = scopes.remove(scopes.size() - 1);
    emitCleanups(cleanups, dest);
  }

  /**
   * Emit the cleanups of the outermost scope and clear it.  Used when the
   * statement being converted is itself the whole unit.
   * @param dest
   */
  public void finish(GotoProgram dest) {
    if (scopes.size() != 1) {
      throw new GotoCCRuntimeError("Unbalanced scopes: " +
                                    (scopes.size() - 1) + " still open");
    }
    List<Code> cleanups = new ArrayList<Code>(current());
    current().clear();
    emitCleanups(cleanups, dest);
  }

  /**
   * @return pending cleanups of innermost block, in registration order
   */
  public List<Code> pending() {
    return new ArrayList<Code>(current());
  }

  /**
   * @return number of open blocks not counting the outermost scope
   */
  public int depth() {
    return scopes.size() - 1;
  }

  private List<Code> current() {
    return scopes.get(scopes.size() - 1);
  }

  private static void emitCleanups(List<Code> cleanups, GotoProgram dest) {
    for (int i = cleanups.size() - 1; i >= 0; i--) {
      Code dead = cleanups.get(i);
      dest.add(Instruction.makeDead(dead.symbol(), dead.location()));
    }
  }
}
