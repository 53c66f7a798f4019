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
package exm.gotocc.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable statement tree handed to the statement converter.
 *
 * Operand layout:
 * <ul>
 *   <li>ASSIGN: lhs, rhs</li>
 *   <li>EXPRESSION, ASSERT, ASSUME: the expression</li>
 *   <li>DECL: symbol, optional initial value</li>
 *   <li>DEAD: symbol</li>
 *   <li>IFTHENELSE: condition; statements are then case, optional else case</li>
 *   <li>FUNCTION_CALL: lhs (may be null), function, arguments</li>
 *   <li>BLOCK: no operands, statements</li>
 * </ul>
 */
public class Code {
  private final CodeKind kind;
  private final List<Expr> operands;
  private final List<Code> statements;
  private final SourceLocation location;

  private Code(CodeKind kind, List<Expr> operands, List<Code> statements,
               SourceLocation location) {
    this.kind = kind;
    this.operands = Collections.unmodifiableList(new ArrayList<Expr>(operands));
    this.statements = Collections.unmodifiableList(
                                  new ArrayList<Code>(statements));
    this.location = location == null ? SourceLocation.NIL : location;
  }

  private static Code make(CodeKind kind, Expr ...operands) {
    return new Code(kind, Arrays.asList(operands),
                    Collections.<Code>emptyList(), null);
  }

  public CodeKind kind() {
    return kind;
  }

  public List<Expr> operands() {
    return operands;
  }

  public Expr operand(int i) {
    return operands.get(i);
  }

  public List<Code> statements() {
    return statements;
  }

  public SourceLocation location() {
    return location;
  }

  public Code at(SourceLocation loc) {
    return new Code(kind, operands, statements, loc);
  }

  public Code withOperands(List<Expr> newOperands) {
    return new Code(kind, newOperands, statements, location);
  }

  public Code withStatements(List<Code> newStatements) {
    return new Code(kind, operands, newStatements, location);
  }

  public static Code assign(Expr lhs, Expr rhs) {
    return make(CodeKind.ASSIGN, lhs, rhs);
  }

  public static Code expression(Expr e) {
    return make(CodeKind.EXPRESSION, e);
  }

  public static Code decl(Expr symbol) {
    return make(CodeKind.DECL, symbol);
  }

  public static Code decl(Expr symbol, Expr initialValue) {
    return make(CodeKind.DECL, symbol, initialValue);
  }

  public static Code dead(Expr symbol) {
    return make(CodeKind.DEAD, symbol);
  }

  public static Code block(List<Code> statements) {
    return new Code(CodeKind.BLOCK, Collections.<Expr>emptyList(), statements,
                    null);
  }

  public static Code block(Code ...statements) {
    return block(Arrays.asList(statements));
  }

  public static Code ifThenElse(Expr cond, Code thenCase, Code elseCase) {
    List<Code> branches = new ArrayList<Code>(2);
    branches.add(thenCase);
    if (elseCase != null) {
      branches.add(elseCase);
    }
    return new Code(CodeKind.IFTHENELSE, Arrays.asList(cond), branches, null);
  }

  public static Code assertion(Expr cond) {
    return make(CodeKind.ASSERT, cond);
  }

  public static Code assumption(Expr cond) {
    return make(CodeKind.ASSUME, cond);
  }

  /**
   * @param lhs where to put the return value, null to discard
   */
  public static Code functionCall(Expr lhs, Expr function, List<Expr> args) {
    List<Expr> ops = new ArrayList<Expr>(args.size() + 2);
    ops.add(lhs);
    ops.add(function);
    ops.addAll(args);
    return new Code(CodeKind.FUNCTION_CALL, ops,
                    Collections.<Code>emptyList(), null);
  }

  public static Code skip() {
    return make(CodeKind.SKIP);
  }

  public Expr lhs() {
    assert(kind == CodeKind.ASSIGN || kind == CodeKind.FUNCTION_CALL);
    return operands.get(0);
  }

  public Expr rhs() {
    assert(kind == CodeKind.ASSIGN);
    return operands.get(1);
  }

  public Expr expression() {
    assert(kind == CodeKind.EXPRESSION);
    return operands.get(0);
  }

  public Expr cond() {
    assert(kind == CodeKind.IFTHENELSE || kind == CodeKind.ASSERT ||
           kind == CodeKind.ASSUME);
    return operands.get(0);
  }

  public Code thenCase() {
    assert(kind == CodeKind.IFTHENELSE);
    return statements.get(0);
  }

  /**
   * @return else branch, null if none
   */
  public Code elseCase() {
    assert(kind == CodeKind.IFTHENELSE);
    return statements.size() > 1 ? statements.get(1) : null;
  }

  public Expr symbol() {
    assert(kind == CodeKind.DECL || kind == CodeKind.DEAD);
    return operands.get(0);
  }

  /**
   * @return initial value of declaration, null if none
   */
  public Expr initialValue() {
    assert(kind == CodeKind.DECL);
    return operands.size() > 1 ? operands.get(1) : null;
  }

  public Expr callFunction() {
    assert(kind == CodeKind.FUNCTION_CALL);
    return operands.get(1);
  }

  public List<Expr> callArguments() {
    assert(kind == CodeKind.FUNCTION_CALL);
    return operands.subList(2, operands.size());
  }

  @Override
  public int hashCode() {
    return (kind.hashCode() * 31 + operands.hashCode()) * 31 +
           statements.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Code))
      return false;
    Code other = (Code) obj;
    return kind == other.kind && operands.equals(other.operands) &&
           statements.equals(other.statements);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    ExprPrinter.printCode(sb, this, "");
    return sb.toString();
  }
}
