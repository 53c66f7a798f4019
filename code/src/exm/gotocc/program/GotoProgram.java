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
package exm.gotocc.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * An ordered, mutable sequence of goto program instructions.  Fragments
 * are built independently and spliced together with
 * {@link #destructiveAppend(GotoProgram)}.
 */
public class GotoProgram {
  private static final String LABEL_PAD = "    ";

  private final ArrayList<Instruction> instructions =
                                    new ArrayList<Instruction>();

  /**
   * Append an instruction
   * @param i
   * @return the instruction
   */
  public Instruction add(Instruction i) {
    instructions.add(i);
    return i;
  }

  /**
   * Move all instructions of other to the end of this program, leaving
   * other empty
   * @param other
   */
  public void destructiveAppend(GotoProgram other) {
    assert(other != this);
    instructions.addAll(other.instructions);
    other.instructions.clear();
  }

  /**
   * Move all instructions of other to the front of this program, leaving
   * other empty
   * @param other
   */
  public void destructiveInsertFront(GotoProgram other) {
    assert(other != this);
    instructions.addAll(0, other.instructions);
    other.instructions.clear();
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  public boolean isEmpty() {
    return instructions.isEmpty();
  }

  public int size() {
    return instructions.size();
  }

  public Instruction first() {
    return instructions.get(0);
  }

  public Instruction last() {
    return instructions.get(instructions.size() - 1);
  }

  public Instruction get(int index) {
    return instructions.get(index);
  }

  /**
   * @param i
   * @return position of instruction, compared by identity, or -1
   */
  public int indexOf(Instruction i) {
    for (int ix = 0; ix < instructions.size(); ix++) {
      if (instructions.get(ix) == i) {
        return ix;
      }
    }
    return -1;
  }

  public boolean contains(Instruction i) {
    return indexOf(i) >= 0;
  }

  /**
   * @return the instructions as a set compared by identity, for repeated
   *         membership queries
   */
  public Set<Instruction> instructionSet() {
    Set<Instruction> result = Collections.newSetFromMap(
                  new IdentityHashMap<Instruction, Boolean>());
    result.addAll(instructions);
    return result;
  }

  /**
   * Number all jump targets in program order, starting from 1
   */
  public void computeTargetNumbers() {
    Map<Instruction, Boolean> targets =
                  new IdentityHashMap<Instruction, Boolean>();
    for (Instruction i: instructions) {
      if (i.isGoto() && i.target() != null) {
        targets.put(i.target(), Boolean.TRUE);
      }
    }
    int next = 1;
    for (Instruction i: instructions) {
      if (targets.containsKey(i)) {
        i.setTargetNumber(next++);
      } else {
        i.setTargetNumber(-1);
      }
    }
  }

  /**
   * Successors of the instruction at position ix: the next instruction
   * unless this is an unconditional jump, plus the jump target.
   * @param ix
   * @return
   */
  public List<Instruction> successors(int ix) {
    Instruction i = instructions.get(ix);
    List<Instruction> result = new ArrayList<Instruction>(2);
    if (!i.isUnconditionalGoto() && ix + 1 < instructions.size()) {
      result.add(instructions.get(ix + 1));
    }
    if (i.isGoto() && i.target() != null && !i.guard().isFalse()) {
      result.add(i.target());
    }
    return result;
  }

  /**
   * @return map from each instruction to its predecessors
   */
  public ListMultimap<Instruction, Instruction> computeIncomingEdges() {
    // Instruction uses identity equality, which the multimap relies on
    ListMultimap<Instruction, Instruction> incoming =
                                    ArrayListMultimap.create();
    for (int ix = 0; ix < instructions.size(); ix++) {
      Instruction pred = instructions.get(ix);
      for (Instruction succ: successors(ix)) {
        incoming.put(succ, pred);
      }
    }
    return incoming;
  }

  public void prettyPrint(StringBuilder sb) {
    computeTargetNumbers();
    for (Instruction i: instructions) {
      if (i.isTarget()) {
        String label = i.targetNumber() + ": ";
        sb.append(StringUtils.leftPad(label, LABEL_PAD.length()));
      } else {
        sb.append(LABEL_PAD);
      }
      i.prettyPrint(sb);
      sb.append('\n');
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
