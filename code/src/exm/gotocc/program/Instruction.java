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

import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.CodeKind;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.ExprPrinter;
import exm.gotocc.common.lang.SourceLocation;

/**
 * A single goto program instruction.  Jump targets are references to
 * other instructions, so instructions use identity equality.
 */
public class Instruction {
  private final InstructionType type;
  private final Code code;
  private final Expr guard;
  private Instruction target;
  private final SourceLocation location;

  /** Label number, assigned by GotoProgram.computeTargetNumbers() */
  private int targetNumber = -1;

  private Instruction(InstructionType type, Code code, Expr guard,
                      Instruction target, SourceLocation location) {
    this.type = type;
    this.code = code;
    this.guard = guard == null ? Expr.trueExpr() : guard;
    this.target = target;
    this.location = location == null ? SourceLocation.NIL : location;
  }

  public static Instruction makeDecl(Expr symbol, SourceLocation loc) {
    assert(symbol.isSymbol()) : symbol;
    return new Instruction(InstructionType.DECL, Code.decl(symbol), null,
                           null, loc);
  }

  public static Instruction makeDead(Expr symbol, SourceLocation loc) {
    assert(symbol.isSymbol()) : symbol;
    return new Instruction(InstructionType.DEAD, Code.dead(symbol), null,
                           null, loc);
  }

  public static Instruction makeAssignment(Expr lhs, Expr rhs,
                                           SourceLocation loc) {
    return new Instruction(InstructionType.ASSIGN, Code.assign(lhs, rhs),
                           null, null, loc);
  }

  public static Instruction makeFunctionCall(Code call, SourceLocation loc) {
    assert(call.kind() == CodeKind.FUNCTION_CALL);
    return new Instruction(InstructionType.FUNCTION_CALL, call, null, null,
                           loc);
  }

  /**
   * @param target may be null if filled in later with setTarget()
   * @param guard jump condition, null for unconditional
   */
  public static Instruction makeGoto(Instruction target, Expr guard,
                                     SourceLocation loc) {
    return new Instruction(InstructionType.GOTO, null, guard, target, loc);
  }

  public static Instruction makeAssertion(Expr cond, SourceLocation loc) {
    return new Instruction(InstructionType.ASSERT, null, cond, null, loc);
  }

  public static Instruction makeAssumption(Expr cond, SourceLocation loc) {
    return new Instruction(InstructionType.ASSUME, null, cond, null, loc);
  }

  public static Instruction makeSkip(SourceLocation loc) {
    return new Instruction(InstructionType.SKIP, null, null, null, loc);
  }

  public static Instruction makeOther(Code code, SourceLocation loc) {
    assert(code.kind() == CodeKind.EXPRESSION);
    return new Instruction(InstructionType.OTHER, code, null, null, loc);
  }

  public InstructionType type() {
    return type;
  }

  /**
   * @return DECL, DEAD, ASSIGN, FUNCTION_CALL or EXPRESSION code,
   *         null for other instruction types
   */
  public Code code() {
    return code;
  }

  public Expr guard() {
    return guard;
  }

  public Instruction target() {
    return target;
  }

  public void setTarget(Instruction target) {
    assert(type == InstructionType.GOTO);
    this.target = target;
  }

  public SourceLocation location() {
    return location;
  }

  public boolean isGoto() {
    return type == InstructionType.GOTO;
  }

  /**
   * @return true if jump is taken regardless of state
   */
  public boolean isUnconditionalGoto() {
    return isGoto() && guard.isTrue();
  }

  public int targetNumber() {
    return targetNumber;
  }

  void setTargetNumber(int targetNumber) {
    this.targetNumber = targetNumber;
  }

  public boolean isTarget() {
    return targetNumber >= 0;
  }

  /**
   * Print instruction without label
   */
  public void prettyPrint(StringBuilder sb) {
    switch (type) {
      case DECL:
        sb.append("DECL ");
        ExprPrinter.print(sb, code.symbol());
        sb.append(" : ");
        sb.append(code.symbol().type().toString());
        break;
      case DEAD:
        sb.append("DEAD ");
        ExprPrinter.print(sb, code.symbol());
        break;
      case ASSIGN:
        sb.append("ASSIGN ");
        ExprPrinter.print(sb, code.lhs());
        sb.append(" := ");
        ExprPrinter.print(sb, code.rhs());
        break;
      case FUNCTION_CALL:
        sb.append("CALL ");
        if (code.lhs() != null) {
          ExprPrinter.print(sb, code.lhs());
          sb.append(" := ");
        }
        ExprPrinter.print(sb, code.callFunction());
        sb.append('(');
        boolean first = true;
        for (Expr arg: code.callArguments()) {
          if (!first) {
            sb.append(", ");
          }
          ExprPrinter.print(sb, arg);
          first = false;
        }
        sb.append(')');
        break;
      case GOTO:
        if (!guard.isTrue()) {
          sb.append("IF ");
          ExprPrinter.print(sb, guard);
          sb.append(" THEN ");
        }
        sb.append("GOTO ");
        sb.append(target == null ? "?" : labelOf(target));
        break;
      case ASSERT:
        sb.append("ASSERT ");
        ExprPrinter.print(sb, guard);
        break;
      case ASSUME:
        sb.append("ASSUME ");
        ExprPrinter.print(sb, guard);
        break;
      case SKIP:
        sb.append("SKIP");
        break;
      case OTHER:
        sb.append("OTHER ");
        ExprPrinter.print(sb, code.expression());
        break;
      default:
        sb.append(type.toString());
    }
  }

  private static String labelOf(Instruction i) {
    return i.isTarget() ? Integer.toString(i.targetNumber) : "<unnumbered>";
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
