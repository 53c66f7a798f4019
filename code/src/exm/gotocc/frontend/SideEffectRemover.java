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
import exm.gotocc.common.lang.CodeKind;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.ExprKind;
import exm.gotocc.common.lang.SideEffectKind;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.common.lang.Symbol;
import exm.gotocc.common.lang.Types;
import exm.gotocc.common.lang.Types.Type;
import exm.gotocc.program.GotoProgram;

/**
 * Removes the side effect at the root of an expression whose operands have
 * already been cleaned.
 */
public class SideEffectRemover {

  private final GotoConverter converter;
  private final VarCreator varCreator;

  public SideEffectRemover(GotoConverter converter, VarCreator varCreator) {
    this.converter = converter;
    this.varCreator = varCreator;
  }

  /**
   * @param context
   * @param expr SIDE_EFFECT node
   * @param dest
   * @param resultIsUsed
   * @param addressOf true if the address of the result will be taken, so
   *              the result must be an lvalue
   * @return residual expression, null if result not used
   */
  public Expr removeSideEffect(LoweringContext context, Expr expr,
      GotoProgram dest, boolean resultIsUsed, boolean addressOf) {
    if (!expr.isSideEffect()) {
      throw new GotoCCRuntimeError("Expected side effect: " + expr);
    }
    SideEffectKind statement = expr.statement();
    switch (statement) {
      case ASSIGN:
      case ASSIGN_PLUS:
      case ASSIGN_MINUS:
      case ASSIGN_MULT:
        return removeAssignment(context, expr, dest, resultIsUsed,
                                addressOf);
      case PREINCREMENT:
      case PREDECREMENT:
        return removePreIncrement(context, expr, dest, resultIsUsed,
                                  addressOf);
      case POSTINCREMENT:
      case POSTDECREMENT:
        return removePostIncrement(context, expr, dest, resultIsUsed,
                                   addressOf);
      case FUNCTION_CALL:
        return removeFunctionCall(context, expr, dest, resultIsUsed);
      case STATEMENT_EXPRESSION:
        return removeStatementExpression(context, expr, dest, resultIsUsed);
      case GCC_CONDITIONAL_EXPRESSION:
        return converter.exprCleaner().removeGccConditionalExpression(
                              context, expr, dest, resultIsUsed);
      default:
        throw new GotoCCRuntimeError("Unknown side effect: " + statement);
    }
  }

  private Expr removeAssignment(LoweringContext context, Expr expr,
      GotoProgram dest, boolean resultIsUsed, boolean addressOf) {
    ExprCleaner.checkArity(expr, 2);
    SourceLocation loc = expr.findSourceLocation();
    Expr lhs = expr.operand(0);
    Expr rhs = expr.operand(1);

    SideEffectKind statement = expr.statement();
    if (statement != SideEffectKind.ASSIGN) {
      // Pointer arithmetic keeps an integer offset
      Expr operand = Types.isPointer(lhs.type()) ? rhs :
                              Expr.conditionalCast(rhs, lhs.type());
      rhs = Expr.binary(statement.arithmetic(), lhs, operand).at(loc);
    }
    rhs = Expr.conditionalCast(rhs, Expr.skipTypecast(lhs).type());

    if (resultIsUsed && !addressOf &&
        ExprCleaner.assignmentLhsNeedsTemporary(lhs)) {
      // Re-reading lhs would not give back the value written
      Symbol tmp = varCreator.newTmpSymbol(context, lhs.type(), "assign",
                                           dest, loc);
      Expr tmpExpr = tmp.symbolExpr().at(loc);
      converter.convertAssign(context, Code.assign(tmpExpr, rhs).at(loc),
                              dest);
      converter.convertAssign(context, Code.assign(Expr.skipTypecast(lhs),
                              tmpExpr).at(loc), dest);
      return tmpExpr;
    }

    converter.convertAssign(context,
          Code.assign(Expr.skipTypecast(lhs), rhs).at(loc), dest);
    return resultIsUsed ? lhs : null;
  }

  /**
   * ++x is x += 1
   */
  private Expr removePreIncrement(LoweringContext context, Expr expr,
      GotoProgram dest, boolean resultIsUsed, boolean addressOf) {
    ExprCleaner.checkArity(expr, 1);
    Expr lhs = expr.operand(0);
    SideEffectKind assign = expr.statement() == SideEffectKind.PREINCREMENT ?
                    SideEffectKind.ASSIGN_PLUS : SideEffectKind.ASSIGN_MINUS;
    Expr rewritten = Expr.compoundAssign(assign, lhs, one(lhs.type()))
                         .at(expr.location());
    return removeAssignment(context, rewritten, dest, resultIsUsed,
                            addressOf);
  }

  private Expr removePostIncrement(LoweringContext context, Expr expr,
      GotoProgram dest, boolean resultIsUsed, boolean addressOf) {
    ExprCleaner.checkArity(expr, 1);
    SourceLocation loc = expr.findSourceLocation();
    if (addressOf) {
      throw new InvariantViolation(loc,
          "cannot take the address of " + expr.statement(), expr.toString());
    }
    Expr lhs = expr.operand(0);

    Expr result = null;
    if (resultIsUsed) {
      Symbol tmp = varCreator.newTmpSymbol(context, lhs.type(), "postfix",
                                           dest, loc);
      result = tmp.symbolExpr().at(loc);
      converter.convertAssign(context, Code.assign(result, lhs).at(loc), dest);
    }

    Expr rhs = Expr.binary(expr.statement().arithmetic(), lhs,
                           one(lhs.type())).at(loc);
    converter.convertAssign(context,
          Code.assign(Expr.skipTypecast(lhs), rhs).at(loc), dest);
    return result;
  }

  private static Expr one(Type type) {
    if (Types.isPointer(type)) {
      return Expr.intConstant(1);
    }
    return Expr.intConstant(1, type);
  }

  /**
   * Hoist a function call out of an expression
   * @param context
   * @param call FUNCTION_CALL side effect with cleaned operands
   * @param dest
   * @param resultIsUsed
   * @return temporary holding the return value, or null if not used
   */
  public Expr removeFunctionCall(LoweringContext context, Expr call,
      GotoProgram dest, boolean resultIsUsed) {
    if (!call.isSideEffect(SideEffectKind.FUNCTION_CALL)) {
      throw new GotoCCRuntimeError("Expected function call: " + call);
    }
    SourceLocation loc = call.findSourceLocation();
    Expr function = call.callFunction();
    List<Expr> args = call.callArguments();

    if (!resultIsUsed) {
      converter.convertFunctionCall(context, null, function, args, dest, loc);
      return null;
    }

    if (Types.isEmpty(call.type())) {
      throw new InvariantViolation(loc,
          "result of void function is used", call.toString());
    }

    String purpose = "return_value";
    if (function.kind() == ExprKind.SYMBOL) {
      purpose += "_" + function.identifier();
    }
    Symbol tmp = varCreator.newTmpSymbol(context, call.type(), purpose, dest,
                                         loc);
    Expr result = tmp.symbolExpr().at(loc);
    converter.convertFunctionCall(context, result, function, args, dest, loc);
    return result;
  }

  /**
   * GCC statement expression ({ s1; ...; e; }): the value is that of the
   * final expression statement
   */
  public Expr removeStatementExpression(LoweringContext context, Expr expr,
      GotoProgram dest, boolean resultIsUsed) {
    Code body = expr.code();
    SourceLocation loc = expr.findSourceLocation();
    if (body == null || body.kind() != CodeKind.BLOCK) {
      throw new InvariantViolation(loc,
          "statement expression expected to have a block as body",
          expr.toString());
    }

    if (!resultIsUsed) {
      converter.convert(context, body, dest);
      return null;
    }

    List<Code> statements = body.statements();
    if (statements.isEmpty() ||
        statements.get(statements.size() - 1).kind() != CodeKind.EXPRESSION) {
      throw new InvariantViolation(loc,
          "statement expression expected to end in an expression",
          expr.toString());
    }

    Code last = statements.get(statements.size() - 1);
    Symbol tmp = varCreator.newTmpSymbol(context, expr.type(),
                                   "statement_expression", dest, loc);
    Expr result = tmp.symbolExpr().at(loc);

    List<Code> newStatements = new ArrayList<Code>(statements);
    Expr value = Expr.conditionalCast(last.expression(), expr.type());
    newStatements.set(statements.size() - 1,
              Code.assign(result, value).at(last.location()));
    converter.convert(context, body.withStatements(newStatements), dest);
    return result;
  }
}
