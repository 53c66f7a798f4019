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
import exm.gotocc.common.exceptions.InvariantViolation;
import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.ExprKind;
import exm.gotocc.common.lang.SideEffectKind;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.common.lang.Symbol;
import exm.gotocc.common.lang.Types;
import exm.gotocc.common.lang.Types.Type;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;

/**
 * This module contains the logic to remove side effects, short-circuit
 * operators, conditional and comma expressions and compound literals from
 * expressions, generating goto program instructions that must run before
 * the residual expression is evaluated.
 *
 * Handled here:
 *   && || ==> ?: , (control dependency)
 *   compound literals and the address of object constructors
 *   GCC a ?: b
 * Assignment, increment/decrement, function calls and statement
 * expressions are passed on to {@link SideEffectRemover}.
 */
public class ExprCleaner {

  private final GotoConverter converter;
  private final VarCreator varCreator;
  private final SideEffectRemover sideEffects;

  public ExprCleaner(GotoConverter converter, VarCreator varCreator,
                     SideEffectRemover sideEffects) {
    this.converter = converter;
    this.varCreator = varCreator;
    this.sideEffects = sideEffects;
  }

  /**
   * Returns true for expressions that may change the program state.
   * Expressions that may trigger undefined behaviour (dereference, index,
   * division) are not included.
   *
   * Quantified expressions are never cleaned: the body may refer to bound
   * variables that are not visible outside the quantifier, so hoisting
   * parts of it into temporaries would be unsound.
   */
  public static boolean needsCleaning(Expr expr) {
    switch (expr.kind()) {
      case SIDE_EFFECT:
      case COMPOUND_LITERAL:
      case COMMA:
        return true;
      case FORALL:
      case EXISTS:
        return false;
      default:
        for (Expr op: expr.operands()) {
          if (needsCleaning(op)) {
            return true;
          }
        }
        return false;
    }
  }

  /**
   * Rewrite boolean connective into nested ?:
   *   a ==> b  to  a ? b : true
   *   a && b   to  a ? (b ? true : false) : false
   *   a || b   to  a ? true : (b ? true : false)
   * The chain is built from the last operand, so operands are still
   * evaluated left to right with short-circuiting.
   * @param expr AND, OR or IMPLIES node
   * @return IF node with same meaning
   */
  public Expr rewriteBoolean(Expr expr) {
    ExprKind kind = expr.kind();
    if (!kind.isBooleanConnective()) {
      throw new InvariantViolation(expr.findSourceLocation(),
          "expected boolean connective, got " + kind, expr.toString());
    }
    if (!expr.isBoolean()) {
      throw new InvariantViolation(expr.findSourceLocation(),
          "'" + kind.operator() + "' must be Boolean, but got " +
          expr.type(), expr.toString());
    }

    for (Expr op: expr.operands()) {
      if (!op.isBoolean()) {
        throw new InvariantViolation(expr.findSourceLocation(),
            "boolean operators must have only boolean operands",
            expr.toString());
      }
    }

    SourceLocation loc = expr.location();
    if (kind == ExprKind.IMPLIES) {
      checkArity(expr, 2);
      return Expr.ifExpr(expr.operand(0), expr.operand(1), Expr.trueExpr(),
                         Types.BOOL).at(loc);
    }

    Expr tmp = Expr.boolConstant(kind == ExprKind.AND);

    List<Expr> ops = expr.operands();
    for (int i = ops.size() - 1; i >= 0; i--) {
      Expr op = ops.get(i);
      if (kind == ExprKind.AND) {
        tmp = Expr.ifExpr(op, tmp, Expr.falseExpr(), Types.BOOL);
      } else {
        tmp = Expr.ifExpr(op, Expr.trueExpr(), tmp, Types.BOOL);
      }
    }

    return tmp.at(loc);
  }

  /**
   * Lower expression.
   *
   * @param context
   * @param expr expression to lower
   * @param dest instructions to evaluate side effects are appended here
   * @param resultIsUsed if false, only the side effects matter
   * @return residual pure expression, or null if resultIsUsed is false and
   *         the expression needed cleaning.  Any value left over in the
   *         discarded case is kept as an expression statement in dest.
   */
  public Expr cleanExpr(LoweringContext context, Expr expr, GotoProgram dest,
                        boolean resultIsUsed) {
    if (expr.kind().isQuantifier()) {
      if (expr.hasSideEffect()) {
        throw new InvariantViolation(expr.findSourceLocation(),
            "the front-end should check quantified expressions for " +
            "side-effects", expr.toString());
      }
      return expr;
    }

    if (!needsCleaning(expr)) {
      return expr;
    }

    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(context, "clean " + expr.kind() + " " + expr +
                      (resultIsUsed ? "" : " (discarded)"));
    }

    Expr result = dispatch(context, expr, dest, resultIsUsed);

    if (!resultIsUsed && result != null) {
      // Leftover value becomes an expression statement
      converter.convert(context,
          Code.expression(result).at(expr.findSourceLocation()), dest);
      return null;
    }
    return result;
  }

  private Expr dispatch(LoweringContext context, Expr expr, GotoProgram dest,
                        boolean resultIsUsed) {
    switch (expr.kind()) {
      case AND:
      case OR:
      case IMPLIES:
        return cleanExpr(context, rewriteBoolean(expr), dest, resultIsUsed);

      case IF:
        return cleanIf(context, expr, dest, resultIsUsed);

      case COMMA:
        return cleanComma(context, expr, dest, resultIsUsed);

      case TYPECAST:
        return cleanTypecast(context, expr, dest, resultIsUsed);

      case ADDRESS_OF: {
        checkArity(expr, 1);
        Expr object = cleanExprAddressOf(context, expr.operand(0), dest);
        return expr.withOperand(0, object);
      }

      case SIDE_EFFECT:
        return cleanSideEffect(context, expr, dest, resultIsUsed);

      case FORALL:
      case EXISTS:
        // Checked in cleanExpr
        return expr;

      case SYMBOL:
      case CONSTANT:
      case STRING_CONSTANT:
      case NOT:
      case UNARY_MINUS:
      case PLUS:
      case MINUS:
      case MULT:
      case DIV:
      case MOD:
      case EQUAL:
      case NOTEQUAL:
      case LT:
      case LE:
      case GT:
      case GE:
      case COMPOUND_LITERAL:
      case INDEX:
      case DEREFERENCE:
      case MEMBER:
      case STRUCT:
      case ARRAY:
        return cleanOperands(context, expr, dest, resultIsUsed);

      default:
        throw new GotoCCRuntimeError("Unexpected expression kind: " +
                                     expr.kind());
    }
  }

  private Expr cleanIf(LoweringContext context, Expr expr, GotoProgram dest,
                       boolean resultIsUsed) {
    checkArity(expr, 3);
    if (!expr.operand(0).isBoolean()) {
      throw new InvariantViolation(expr.findSourceLocation(),
          "condition for an 'if' must be boolean", expr.toString());
    }

    Expr cond = cleanExpr(context, expr.operand(0), dest, true);

    Expr trueCase = expr.operand(1);
    Expr falseCase = expr.operand(2);

    // Only the condition had side effects
    if (!needsCleaning(trueCase) && !needsCleaning(falseCase)) {
      return expr.withOperand(0, cond);
    }

    SourceLocation loc = expr.findSourceLocation();

    GotoProgram tmpTrue = new GotoProgram();
    trueCase = cleanExpr(context, trueCase, tmpTrue, resultIsUsed);

    GotoProgram tmpFalse = new GotoProgram();
    falseCase = cleanExpr(context, falseCase, tmpFalse, resultIsUsed);

    Expr result;
    if (resultIsUsed) {
      Symbol tmp = varCreator.newTmpSymbol(context, expr.type(), "if_expr",
                                           dest, loc);
      Expr tmpExpr = tmp.symbolExpr().at(loc);

      converter.convertAssign(context,
          Code.assign(tmpExpr, trueCase).at(loc), tmpTrue);
      converter.convertAssign(context,
          Code.assign(tmpExpr, falseCase).at(loc), tmpFalse);

      result = tmpExpr;
    } else {
      // Pure branch values are kept as (void) statements
      if (trueCase != null) {
        converter.convert(context, Code.expression(
            Expr.typecast(trueCase, Types.VOID)).at(loc), tmpTrue);
      }
      if (falseCase != null) {
        converter.convert(context, Code.expression(
            Expr.typecast(falseCase, Types.VOID)).at(loc), tmpFalse);
      }
      result = null;
    }

    converter.generateIfThenElse(context, cond, tmpTrue, tmpFalse, loc, dest);

    return result;
  }

  private Expr cleanComma(LoweringContext context, Expr expr,
                          GotoProgram dest, boolean resultIsUsed) {
    List<Expr> ops = expr.operands();
    if (ops.isEmpty()) {
      throw new InvariantViolation(expr.findSourceLocation(),
          "comma expression without operands");
    }

    Expr result = null;
    for (int i = 0; i < ops.size(); i++) {
      Expr op = ops.get(i);
      boolean last = (i == ops.size() - 1);
      if (last && resultIsUsed) {
        result = cleanExpr(context, op, dest, true);
      } else {
        emitForSideEffects(context, op, dest);
      }
    }
    return result;
  }

  private Expr cleanTypecast(LoweringContext context, Expr expr,
                             GotoProgram dest, boolean resultIsUsed) {
    checkArity(expr, 1);
    // preserve resultIsUsed
    Expr op = cleanExpr(context, expr.operand(0), dest, resultIsUsed);
    if (op == null) {
      return null;
    }
    return expr.withOperand(0, op);
  }

  private Expr cleanSideEffect(LoweringContext context, Expr expr,
                               GotoProgram dest, boolean resultIsUsed) {
    SideEffectKind statement = expr.statement();
    if (statement == SideEffectKind.GCC_CONDITIONAL_EXPRESSION) {
      return removeGccConditionalExpression(context, expr, dest,
                                            resultIsUsed);
    } else if (statement == SideEffectKind.STATEMENT_EXPRESSION) {
      // operands of the body must not be cleaned here
      return sideEffects.removeStatementExpression(context, expr, dest,
                                                   resultIsUsed);
    } else if (statement == SideEffectKind.ASSIGN) {
      checkArity(expr, 2);
      if (expr.operand(1).isSideEffect(SideEffectKind.FUNCTION_CALL)) {
        return cleanAssignFunctionCall(context, expr, dest, resultIsUsed);
      }
    }
    return cleanOperands(context, expr, dest, resultIsUsed);
  }

  /**
   * x = f(...): the call can write straight into x unless writing x may
   * itself be observable, in which case the result goes through a
   * temporary.
   */
  private Expr cleanAssignFunctionCall(LoweringContext context, Expr expr,
                              GotoProgram dest, boolean resultIsUsed) {
    Expr lhs = cleanExpr(context, expr.operand(0), dest, true);
    Expr rhs = expr.operand(1);

    boolean mustUseRhs = assignmentLhsNeedsTemporary(lhs);
    if (mustUseRhs) {
      rhs = sideEffects.removeFunctionCall(context, rhs, dest, true);
    }

    Expr newLhs = Expr.skipTypecast(lhs);
    Expr newRhs = Expr.conditionalCast(rhs, newLhs.type());
    converter.convertAssign(context,
        Code.assign(newLhs, newRhs).at(expr.findSourceLocation()), dest);

    if (resultIsUsed) {
      return mustUseRhs ? newRhs : lhs;
    } else {
      return null;
    }
  }

  /**
   * Default case: clean operands left to right, then remove the node's own
   * side effect or strip the compound literal wrapper.
   */
  private Expr cleanOperands(LoweringContext context, Expr expr,
                             GotoProgram dest, boolean resultIsUsed) {
    List<Expr> ops = new ArrayList<Expr>(expr.operandCount());
    for (Expr op: expr.operands()) {
      Expr cleaned = cleanExpr(context, op, dest, true);
      if (cleaned == null) {
        throw new InvariantViolation(op.findSourceLocation(),
            "operand has no value", op.toString());
      }
      ops.add(cleaned);
    }
    Expr result = expr.withOperands(ops);

    if (result.isSideEffect()) {
      return sideEffects.removeSideEffect(context, result, dest, resultIsUsed,
                                          false);
    } else if (result.kind() == ExprKind.COMPOUND_LITERAL) {
      checkArity(result, 1);
      return result.operand(0);
    }
    return result;
  }

  /**
   * Clean an expression whose address is being taken.  Object constructors
   * are turned into variables so they have an address.
   * @param context
   * @param expr operand of address-of
   * @param dest
   * @return cleaned operand
   */
  public Expr cleanExprAddressOf(LoweringContext context, Expr expr,
                                 GotoProgram dest) {
    switch (expr.kind()) {
      case COMPOUND_LITERAL: {
        checkArity(expr, 1);
        Expr value = cleanExpr(context, expr.operand(0), dest, true);
        return makeCompoundLiteral(context, value, dest);
      }
      case STRING_CONSTANT:
        // Already an object
        return expr;
      case INDEX: {
        checkArity(expr, 2);
        Expr array = cleanExprAddressOf(context, expr.operand(0), dest);
        Expr index = cleanExpr(context, expr.operand(1), dest, true);
        List<Expr> ops = new ArrayList<Expr>(2);
        ops.add(array);
        ops.add(index);
        return expr.withOperands(ops);
      }
      case DEREFERENCE: {
        checkArity(expr, 1);
        Expr pointer = cleanExpr(context, expr.operand(0), dest, true);
        return expr.withOperand(0, pointer);
      }
      case COMMA: {
        List<Expr> ops = expr.operands();
        if (ops.isEmpty()) {
          throw new InvariantViolation(expr.findSourceLocation(),
              "comma expression without operands");
        }
        for (int i = 0; i < ops.size() - 1; i++) {
          emitForSideEffects(context, ops.get(i), dest);
        }
        return cleanExprAddressOf(context, ops.get(ops.size() - 1), dest);
      }
      case SIDE_EFFECT:
        return cleanSideEffectAddressOf(context, expr, dest);
      default: {
        List<Expr> ops = new ArrayList<Expr>(expr.operandCount());
        for (Expr op: expr.operands()) {
          ops.add(cleanExprAddressOf(context, op, dest));
        }
        return expr.withOperands(ops);
      }
    }
  }

  private Expr cleanSideEffectAddressOf(LoweringContext context, Expr expr,
                                        GotoProgram dest) {
    SideEffectKind statement = expr.statement();
    if (statement != SideEffectKind.STATEMENT_EXPRESSION &&
        statement != SideEffectKind.GCC_CONDITIONAL_EXPRESSION) {
      List<Expr> ops = new ArrayList<Expr>(expr.operandCount());
      for (Expr op: expr.operands()) {
        ops.add(cleanExpr(context, op, dest, true));
      }
      expr = expr.withOperands(ops);
    }
    return sideEffects.removeSideEffect(context, expr, dest, true, true);
  }

  /**
   * Turn a compound literal value into a named object.
   * @param context
   * @param value the literal's (cleaned) value
   * @param dest
   * @return reference to the new symbol
   */
  public Expr makeCompoundLiteral(LoweringContext context, Expr value,
                                  GotoProgram dest) {
    SourceLocation loc = value.findSourceLocation();
    boolean staticLifetime = context.lifetime() != Lifetime.AUTOMATIC_LOCAL;

    Symbol sym = varCreator.createAuxSymbol(context, value.type(), "literal",
                                            loc, staticLifetime, value);
    Expr result = sym.symbolExpr().at(loc);

    // Block-scoped objects need DECL and DEAD
    if (!staticLifetime) {
      dest.add(Instruction.makeDecl(result, loc));
    }

    converter.convertAssign(context, Code.assign(result, value).at(loc), dest);

    if (!staticLifetime) {
      context.scopeStack().add(Code.dead(result).at(loc));
    }
    return result;
  }

  /**
   * a ?: b becomes (bool)a ? a : b; a is cleaned first so that it can be
   * duplicated.
   */
  public Expr removeGccConditionalExpression(LoweringContext context,
      Expr expr, GotoProgram dest, boolean resultIsUsed) {
    checkArity(expr, 2);

    Expr cond = cleanExpr(context, expr.operand(0), dest, true);

    Expr ifExpr = Expr.ifExpr(Expr.conditionalCast(cond, Types.BOOL), cond,
                              expr.operand(1), expr.type())
                      .at(expr.location());

    // b may still need lowering
    return cleanExpr(context, ifExpr, dest, resultIsUsed);
  }

  /**
   * Do we need a temporary for the value of an assignment to lhs?
   * Anything but a plain symbol may change value when its operands
   * change, and writes to volatile or bit-field objects are not
   * transparent reads of the value written.
   */
  public static boolean assignmentLhsNeedsTemporary(Expr lhs) {
    if (lhs.kind() != ExprKind.SYMBOL) {
      return true;
    }
    Type t = lhs.type();
    return t.isVolatile() || Types.isBitField(t);
  }

  /**
   * Lower an operand whose value is discarded, keeping whatever value
   * remains as an expression statement
   */
  private void emitForSideEffects(LoweringContext context, Expr op,
                                  GotoProgram dest) {
    Expr cleaned = cleanExpr(context, op, dest, false);
    if (cleaned != null) {
      converter.convert(context,
          Code.expression(cleaned).at(op.findSourceLocation()), dest);
    }
  }

  static void checkArity(Expr expr, int expected) {
    if (expr.operandCount() != expected) {
      throw new InvariantViolation(expr.findSourceLocation(),
          expr.kind() + (expr.isSideEffect() ? " " + expr.statement() : "") +
          " expressions must have " + expected + " operands, got " +
          expr.operandCount(), expr.toString());
    }
  }
}
