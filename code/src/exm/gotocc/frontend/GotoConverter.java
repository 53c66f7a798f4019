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

import exm.gotocc.common.Settings;
import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.exceptions.InvalidOptionException;
import exm.gotocc.common.exceptions.InvariantViolation;
import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.ExprKind;
import exm.gotocc.common.lang.SideEffectKind;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;

/**
 * Converts statements into goto program instructions, lowering the
 * expressions they contain.  This is the entry point of the front end:
 * {@link #clean(LoweringContext, Expr, boolean)} lowers one expression,
 * {@link #convert(LoweringContext, Code, GotoProgram)} one statement.
 *
 * Not thread safe: all state lives in the context and output programs
 * passed in.
 */
public class GotoConverter {

  private final VarCreator varCreator;
  private final SideEffectRemover sideEffects;
  private final ExprCleaner exprCleaner;
  private final boolean checkLowered;

  public GotoConverter(VarCreator varCreator, boolean checkLowered) {
    this.varCreator = varCreator;
    this.checkLowered = checkLowered;
    this.sideEffects = new SideEffectRemover(this, varCreator);
    this.exprCleaner = new ExprCleaner(this, varCreator, sideEffects);
  }

  /**
   * Converter configured from {@link Settings}
   * @throws InvalidOptionException
   */
  public static GotoConverter fromSettings() throws InvalidOptionException {
    VarCreator varCreator = new VarCreator(Settings.get(Settings.TMP_PREFIX));
    return new GotoConverter(varCreator,
                             Settings.getBoolean(Settings.CHECK_LOWERED));
  }

  public ExprCleaner exprCleaner() {
    return exprCleaner;
  }

  public SideEffectRemover sideEffects() {
    return sideEffects;
  }

  public VarCreator varCreator() {
    return varCreator;
  }

  /**
   * Lower a single expression into a fresh program
   * @param context
   * @param expr
   * @param resultIsUsed
   * @return instructions plus residual expression
   */
  public CleanResult clean(LoweringContext context, Expr expr,
                           boolean resultIsUsed) {
    context.syncLocation(expr.findSourceLocation());
    GotoProgram dest = new GotoProgram();
    Expr residual = exprCleaner.cleanExpr(context, expr, dest, resultIsUsed);
    if (checkLowered) {
      GotoProgramChecker.check(dest);
      if (residual != null) {
        GotoProgramChecker.checkPure(residual);
      }
    }
    LogHelper.debug(context, "Lowered " + expr + " to " + dest.size() +
                    " instructions");
    return new CleanResult(dest, residual);
  }

  /**
   * Convert a statement, appending instructions to dest
   * @param context
   * @param code
   * @param dest
   */
  public void convert(LoweringContext context, Code code, GotoProgram dest) {
    context.syncLocation(code.location());
    switch (code.kind()) {
      case BLOCK:
        convertBlock(context, code, dest);
        break;
      case DECL:
        convertDecl(context, code, dest);
        break;
      case DEAD:
        dest.add(Instruction.makeDead(code.symbol(), code.location()));
        break;
      case ASSIGN:
        convertAssign(context, code, dest);
        break;
      case EXPRESSION:
        convertExpression(context, code, dest);
        break;
      case IFTHENELSE:
        convertIfThenElse(context, code, dest);
        break;
      case ASSERT: {
        Expr cond = exprCleaner.cleanExpr(context, code.cond(), dest, true);
        dest.add(Instruction.makeAssertion(cond, code.location()));
        break;
      }
      case ASSUME: {
        Expr cond = exprCleaner.cleanExpr(context, code.cond(), dest, true);
        dest.add(Instruction.makeAssumption(cond, code.location()));
        break;
      }
      case FUNCTION_CALL:
        convertFunctionCall(context, code.lhs(), code.callFunction(),
                            code.callArguments(), dest, code.location());
        break;
      case SKIP:
        dest.add(Instruction.makeSkip(code.location()));
        break;
      default:
        throw new GotoCCRuntimeError("Unexpected statement kind: " +
                                     code.kind());
    }
  }

  private void convertBlock(LoweringContext context, Code block,
                            GotoProgram dest) {
    context.openScope();
    for (Code stmt: block.statements()) {
      convert(context, stmt, dest);
    }
    context.closeScope(dest);
  }

  private void convertDecl(LoweringContext context, Code decl,
                           GotoProgram dest) {
    Expr sym = decl.symbol();
    if (!sym.isSymbol()) {
      throw new InvariantViolation(decl.location(),
          "declaration must declare a symbol", sym.toString());
    }
    SourceLocation loc = decl.location();
    dest.add(Instruction.makeDecl(sym, loc));
    Expr init = decl.initialValue();
    if (init != null) {
      convertAssign(context, Code.assign(sym, init).at(loc), dest);
    }
    context.scopeStack().add(Code.dead(sym).at(loc));
  }

  /**
   * Convert lhs = rhs.  A function call on the right writes directly
   * into the cleaned left hand side.
   * @param context
   * @param assign ASSIGN statement
   * @param dest
   */
  public void convertAssign(LoweringContext context, Code assign,
                            GotoProgram dest) {
    Expr lhs = assign.lhs();
    Expr rhs = assign.rhs();
    SourceLocation loc = assign.location();

    if (rhs.isSideEffect(SideEffectKind.FUNCTION_CALL)) {
      convertFunctionCall(context, lhs, rhs.callFunction(),
                          rhs.callArguments(), dest, loc);
      return;
    }

    Expr newLhs = exprCleaner.cleanExpr(context, lhs, dest, true);
    Expr newRhs = exprCleaner.cleanExpr(context, rhs, dest, true);
    dest.add(Instruction.makeAssignment(newLhs, newRhs, loc));
  }

  private void convertExpression(LoweringContext context, Code code,
                                 GotoProgram dest) {
    Expr expr = code.expression();
    if (expr.isSideEffect(SideEffectKind.FUNCTION_CALL)) {
      convertFunctionCall(context, null, expr.callFunction(),
                          expr.callArguments(), dest, code.location());
      return;
    }

    Expr residual = exprCleaner.cleanExpr(context, expr, dest, false);
    if (residual != null) {
      dest.add(Instruction.makeOther(Code.expression(residual)
                                         .at(code.location()),
                                     code.location()));
    }
  }

  private void convertIfThenElse(LoweringContext context, Code code,
                                 GotoProgram dest) {
    Expr cond = exprCleaner.cleanExpr(context, code.cond(), dest, true);

    GotoProgram tmpThen = new GotoProgram();
    convert(context, code.thenCase(), tmpThen);

    GotoProgram tmpElse = new GotoProgram();
    if (code.elseCase() != null) {
      convert(context, code.elseCase(), tmpElse);
    }

    generateIfThenElse(context, cond, tmpThen, tmpElse, code.location(),
                       dest);
  }

  /**
   * Emit a call instruction after cleaning all of its operands
   * @param context
   * @param lhs where the return value goes, null to discard it
   * @param function
   * @param args
   * @param dest
   * @param loc
   */
  public void convertFunctionCall(LoweringContext context, Expr lhs,
      Expr function, List<Expr> args, GotoProgram dest, SourceLocation loc) {
    Expr newLhs = null;
    if (lhs != null) {
      newLhs = exprCleaner.cleanExpr(context, lhs, dest, true);
    }
    Expr newFunction = exprCleaner.cleanExpr(context, function, dest, true);
    List<Expr> newArgs = new ArrayList<Expr>(args.size());
    for (Expr arg: args) {
      newArgs.add(exprCleaner.cleanExpr(context, arg, dest, true));
    }
    Code call = Code.functionCall(newLhs, newFunction, newArgs).at(loc);
    dest.add(Instruction.makeFunctionCall(call, loc));
  }

  /**
   * Generate code for
   *   if (guard) trueCase else falseCase
   * as follows:
   * <pre>
   *  v: IF !guard GOTO z
   *     trueCase
   *  w: GOTO y
   *  z: falseCase
   *  y: SKIP
   * </pre>
   * Both fragments are moved into dest and left empty.
   */
  public void generateIfThenElse(LoweringContext context, Expr guard,
      GotoProgram trueCase, GotoProgram falseCase, SourceLocation loc,
      GotoProgram dest) {
    if (trueCase.isEmpty() && falseCase.isEmpty()) {
      dest.add(Instruction.makeSkip(loc));
      return;
    }

    Instruction y = Instruction.makeSkip(loc);

    if (trueCase.isEmpty()) {
      // IF guard GOTO y; falseCase; y: SKIP
      dest.add(Instruction.makeGoto(y, guard, loc));
      dest.destructiveAppend(falseCase);
      dest.add(y);
      return;
    }

    if (falseCase.isEmpty()) {
      // IF !guard GOTO y; trueCase; y: SKIP
      dest.add(Instruction.makeGoto(y, negate(guard), loc));
      dest.destructiveAppend(trueCase);
      dest.add(y);
      return;
    }

    Instruction z = falseCase.first();
    dest.add(Instruction.makeGoto(z, negate(guard), loc));
    dest.destructiveAppend(trueCase);
    dest.add(Instruction.makeGoto(y, Expr.trueExpr(), loc));
    dest.destructiveAppend(falseCase);
    dest.add(y);
  }

  static Expr negate(Expr guard) {
    if (guard.isTrue()) {
      return Expr.falseExpr();
    } else if (guard.isFalse()) {
      return Expr.trueExpr();
    } else if (guard.kind() == ExprKind.NOT) {
      return guard.operand(0);
    }
    return Expr.not(guard).at(guard.location());
  }
}
