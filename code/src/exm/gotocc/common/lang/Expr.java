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

import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.lang.Types.ArrayType;
import exm.gotocc.common.lang.Types.StructType;
import exm.gotocc.common.lang.Types.Type;

/**
 * Immutable expression tree node.
 *
 * Rewrites never modify a node: they build a new one with
 * {@link #withOperands(List)} and friends.  Equality is structural and
 * ignores source locations.
 *
 * Operand layout for the kinds that need explanation:
 * <ul>
 *   <li>IF: condition, true case, false case</li>
 *   <li>INDEX: array, index</li>
 *   <li>MEMBER: compound operand, field name in {@link #identifier()}</li>
 *   <li>FORALL/EXISTS: bound symbol, body</li>
 *   <li>SIDE_EFFECT FUNCTION_CALL: function, then the arguments</li>
 *   <li>SIDE_EFFECT STATEMENT_EXPRESSION: no operands, body in {@link #code()}</li>
 * </ul>
 */
public class Expr {
  private final ExprKind kind;
  private final Type type;
  private final List<Expr> operands;
  /* Symbol name, constant value, string text or member name */
  private final String identifier;
  private final SideEffectKind statement;
  private final Code code;
  private final SourceLocation location;

  private Expr(ExprKind kind, Type type, List<Expr> operands,
      String identifier, SideEffectKind statement, Code code,
      SourceLocation location) {
    assert(kind != null);
    assert(type != null) : kind;
    assert(kind != ExprKind.SIDE_EFFECT || statement != null);
    this.kind = kind;
    this.type = type;
    this.operands = Collections.unmodifiableList(new ArrayList<Expr>(operands));
    for (Expr op: this.operands) {
      if (op == null) {
        throw new GotoCCRuntimeError("null operand for " + kind);
      }
    }
    this.identifier = identifier;
    this.statement = statement;
    this.code = code;
    this.location = location == null ? SourceLocation.NIL : location;
  }

  private static Expr make(ExprKind kind, Type type, Expr ...operands) {
    return new Expr(kind, type, Arrays.asList(operands), null, null, null,
                    null);
  }

  private static Expr make(ExprKind kind, Type type, List<Expr> operands) {
    return new Expr(kind, type, operands, null, null, null, null);
  }

  public ExprKind kind() {
    return kind;
  }

  public Type type() {
    return type;
  }

  public List<Expr> operands() {
    return operands;
  }

  public Expr operand(int i) {
    return operands.get(i);
  }

  public int operandCount() {
    return operands.size();
  }

  public String identifier() {
    return identifier;
  }

  /**
   * @return side effect sub-kind, null if not a side effect
   */
  public SideEffectKind statement() {
    return statement;
  }

  /**
   * @return body of statement expression, otherwise null
   */
  public Code code() {
    return code;
  }

  public SourceLocation location() {
    return location;
  }

  public boolean isBoolean() {
    return Types.isBool(type);
  }

  public boolean isTrue() {
    return kind == ExprKind.CONSTANT && isBoolean() &&
           identifier.equals("true");
  }

  public boolean isFalse() {
    return kind == ExprKind.CONSTANT && isBoolean() &&
           identifier.equals("false");
  }

  public boolean isSymbol() {
    return kind == ExprKind.SYMBOL;
  }

  public boolean isSideEffect() {
    return kind == ExprKind.SIDE_EFFECT;
  }

  public boolean isSideEffect(SideEffectKind sk) {
    return kind == ExprKind.SIDE_EFFECT && statement == sk;
  }

  /**
   * @return true if this node or any node below it is a side effect,
   *        including inside quantifiers and statement expressions
   */
  public boolean hasSideEffect() {
    if (kind == ExprKind.SIDE_EFFECT) {
      return true;
    }
    for (Expr op: operands) {
      if (op.hasSideEffect()) {
        return true;
      }
    }
    return false;
  }

  public Expr withOperands(List<Expr> newOperands) {
    return new Expr(kind, type, newOperands, identifier, statement, code,
                    location);
  }

  public Expr withOperand(int i, Expr newOperand) {
    List<Expr> ops = new ArrayList<Expr>(operands);
    ops.set(i, newOperand);
    return withOperands(ops);
  }

  /**
   * @param loc
   * @return copy of expression tagged with given location
   */
  public Expr at(SourceLocation loc) {
    return new Expr(kind, type, operands, identifier, statement, code, loc);
  }

  /**
   * Find a source location, looking into operands if this node has none
   * @return
   */
  public SourceLocation findSourceLocation() {
    if (!location.isNil()) {
      return location;
    }
    for (Expr op: operands) {
      SourceLocation l = op.findSourceLocation();
      if (!l.isNil()) {
        return l;
      }
    }
    return SourceLocation.NIL;
  }

  /*
   * Factory methods
   */

  public static Expr symbol(String name, Type type) {
    return new Expr(ExprKind.SYMBOL, type, Collections.<Expr>emptyList(),
                    name, null, null, null);
  }

  public static Expr constant(String value, Type type) {
    return new Expr(ExprKind.CONSTANT, type, Collections.<Expr>emptyList(),
                    value, null, null, null);
  }

  public static Expr intConstant(long value, Type type) {
    return constant(Long.toString(value), type);
  }

  public static Expr intConstant(long value) {
    return intConstant(value, Types.INT);
  }

  public static Expr trueExpr() {
    return constant("true", Types.BOOL);
  }

  public static Expr falseExpr() {
    return constant("false", Types.BOOL);
  }

  public static Expr boolConstant(boolean value) {
    return value ? trueExpr() : falseExpr();
  }

  public static Expr stringConstant(String text) {
    return new Expr(ExprKind.STRING_CONSTANT,
                    Types.arrayOf(Types.CHAR, text.length() + 1),
                    Collections.<Expr>emptyList(), text, null, null, null);
  }

  public static Expr not(Expr op) {
    return make(ExprKind.NOT, Types.BOOL, op);
  }

  public static Expr and(List<Expr> ops) {
    return make(ExprKind.AND, Types.BOOL, ops);
  }

  public static Expr and(Expr ...ops) {
    return and(Arrays.asList(ops));
  }

  public static Expr or(List<Expr> ops) {
    return make(ExprKind.OR, Types.BOOL, ops);
  }

  public static Expr or(Expr ...ops) {
    return or(Arrays.asList(ops));
  }

  public static Expr implies(Expr lhs, Expr rhs) {
    return make(ExprKind.IMPLIES, Types.BOOL, lhs, rhs);
  }

  /**
   * Arithmetic or relational binary operator.  Relations are boolean,
   * arithmetic takes the type of the left operand.
   */
  public static Expr binary(ExprKind kind, Expr lhs, Expr rhs) {
    if (!kind.isBinaryOperator()) {
      throw new GotoCCRuntimeError("Not a binary operator: " + kind);
    }
    Type t = kind.isRelation() ? Types.BOOL : lhs.type();
    return make(kind, t, lhs, rhs);
  }

  public static Expr ifExpr(Expr cond, Expr trueCase, Expr falseCase,
                            Type type) {
    return make(ExprKind.IF, type, cond, trueCase, falseCase);
  }

  public static Expr ifExpr(Expr cond, Expr trueCase, Expr falseCase) {
    return ifExpr(cond, trueCase, falseCase, trueCase.type());
  }

  public static Expr comma(List<Expr> ops) {
    assert(ops.size() >= 1);
    return make(ExprKind.COMMA, ops.get(ops.size() - 1).type(), ops);
  }

  public static Expr comma(Expr ...ops) {
    return comma(Arrays.asList(ops));
  }

  public static Expr typecast(Expr op, Type type) {
    return make(ExprKind.TYPECAST, type, op);
  }

  /**
   * @return op if it already has the type, otherwise a cast
   */
  public static Expr conditionalCast(Expr op, Type type) {
    if (op.type().equals(type)) {
      return op;
    }
    return typecast(op, type).at(op.location());
  }

  public static Expr skipTypecast(Expr e) {
    while (e.kind() == ExprKind.TYPECAST) {
      e = e.operand(0);
    }
    return e;
  }

  public static Expr compoundLiteral(Expr value) {
    return make(ExprKind.COMPOUND_LITERAL, value.type(), value);
  }

  public static Expr addressOf(Expr object) {
    return make(ExprKind.ADDRESS_OF, Types.pointerTo(object.type()), object);
  }

  public static Expr index(Expr array, Expr index) {
    return make(ExprKind.INDEX, Types.elementType(array.type()), array, index);
  }

  public static Expr dereference(Expr pointer) {
    return make(ExprKind.DEREFERENCE, Types.elementType(pointer.type()),
                pointer);
  }

  public static Expr member(Expr compound, String field) {
    if (!(compound.type() instanceof StructType)) {
      throw new GotoCCRuntimeError("member of non-struct: " + compound.type());
    }
    Type ft = ((StructType)compound.type()).fieldType(field);
    return new Expr(ExprKind.MEMBER, ft, Arrays.asList(compound), field,
                    null, null, null);
  }

  public static Expr struct(List<Expr> values, StructType type) {
    if (values.size() != type.fields().size()) {
      throw new GotoCCRuntimeError("struct " + type.tag() + " has " +
            type.fields().size() + " fields, got " + values.size());
    }
    return make(ExprKind.STRUCT, type, values);
  }

  public static Expr array(List<Expr> values, Type elementType) {
    ArrayType t = Types.arrayOf(elementType, values.size());
    return make(ExprKind.ARRAY, t, values);
  }

  public static Expr forall(Expr boundSymbol, Expr body) {
    return make(ExprKind.FORALL, Types.BOOL, boundSymbol, body);
  }

  public static Expr exists(Expr boundSymbol, Expr body) {
    return make(ExprKind.EXISTS, Types.BOOL, boundSymbol, body);
  }

  public static Expr sideEffect(SideEffectKind sk, List<Expr> ops, Type type) {
    return new Expr(ExprKind.SIDE_EFFECT, type, ops, null, sk, null, null);
  }

  public static Expr assign(Expr lhs, Expr rhs) {
    return sideEffect(SideEffectKind.ASSIGN, Arrays.asList(lhs, rhs),
                      lhs.type());
  }

  public static Expr compoundAssign(SideEffectKind sk, Expr lhs, Expr rhs) {
    assert(sk.isAssignment());
    return sideEffect(sk, Arrays.asList(lhs, rhs), lhs.type());
  }

  public static Expr preIncrement(Expr lhs) {
    return sideEffect(SideEffectKind.PREINCREMENT, Arrays.asList(lhs),
                      lhs.type());
  }

  public static Expr preDecrement(Expr lhs) {
    return sideEffect(SideEffectKind.PREDECREMENT, Arrays.asList(lhs),
                      lhs.type());
  }

  public static Expr postIncrement(Expr lhs) {
    return sideEffect(SideEffectKind.POSTINCREMENT, Arrays.asList(lhs),
                      lhs.type());
  }

  public static Expr postDecrement(Expr lhs) {
    return sideEffect(SideEffectKind.POSTDECREMENT, Arrays.asList(lhs),
                      lhs.type());
  }

  public static Expr functionCall(Expr function, List<Expr> args) {
    List<Expr> ops = new ArrayList<Expr>(args.size() + 1);
    ops.add(function);
    ops.addAll(args);
    return sideEffect(SideEffectKind.FUNCTION_CALL, ops,
                      Types.returnType(function.type()));
  }

  public static Expr functionCall(Expr function, Expr ...args) {
    return functionCall(function, Arrays.asList(args));
  }

  public static Expr statementExpression(Code body, Type type) {
    return new Expr(ExprKind.SIDE_EFFECT, type, Collections.<Expr>emptyList(),
                    null, SideEffectKind.STATEMENT_EXPRESSION, body, null);
  }

  public static Expr gccConditional(Expr cond, Expr otherwise) {
    return sideEffect(SideEffectKind.GCC_CONDITIONAL_EXPRESSION,
                      Arrays.asList(cond, otherwise), otherwise.type());
  }

  /**
   * Function designator of a FUNCTION_CALL side effect
   */
  public Expr callFunction() {
    assert(isSideEffect(SideEffectKind.FUNCTION_CALL));
    return operands.get(0);
  }

  /**
   * Arguments of a FUNCTION_CALL side effect
   */
  public List<Expr> callArguments() {
    assert(isSideEffect(SideEffectKind.FUNCTION_CALL));
    return operands.subList(1, operands.size());
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + type.hashCode();
    result = prime * result + operands.hashCode();
    result = prime * result + (identifier == null ? 0 : identifier.hashCode());
    result = prime * result + (statement == null ? 0 : statement.hashCode());
    result = prime * result + (code == null ? 0 : code.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Expr))
      return false;
    Expr other = (Expr) obj;
    if (kind != other.kind || statement != other.statement) {
      return false;
    }
    if (identifier == null) {
      if (other.identifier != null)
        return false;
    } else if (!identifier.equals(other.identifier)) {
      return false;
    }
    if (code == null) {
      if (other.code != null)
        return false;
    } else if (!code.equals(other.code)) {
      return false;
    }
    return type.equals(other.type) && operands.equals(other.operands);
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
