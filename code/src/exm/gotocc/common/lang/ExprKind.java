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

/**
 * Node kinds of the expression tree
 */
public enum ExprKind {
  // Leaves
  SYMBOL, CONSTANT, STRING_CONSTANT,

  // Unary operators
  NOT("!"), UNARY_MINUS("-"),

  // Boolean connectives, n-ary except for implication
  AND("&&"), OR("||"), IMPLIES("==>"),

  // Arithmetic and relational binary operators
  PLUS("+"), MINUS("-"), MULT("*"), DIV("/"), MOD("%"),
  EQUAL("=="), NOTEQUAL("!="), LT("<"), LE("<="), GT(">"), GE(">="),

  IF, COMMA, TYPECAST,
  COMPOUND_LITERAL,
  ADDRESS_OF, INDEX, DEREFERENCE, MEMBER,

  // Object constructors: { a, b }
  STRUCT, ARRAY,

  // Sub-kind is given by SideEffectKind
  SIDE_EFFECT,

  FORALL, EXISTS,
  ;

  private final String operator;

  private ExprKind() {
    this(null);
  }

  private ExprKind(String operator) {
    this.operator = operator;
  }

  /**
   * @return C operator symbol, null if not a simple operator
   */
  public String operator() {
    return operator;
  }

  public boolean isBooleanConnective() {
    return this == AND || this == OR || this == IMPLIES;
  }

  public boolean isBinaryOperator() {
    switch (this) {
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
        return true;
      default:
        return false;
    }
  }

  public boolean isRelation() {
    switch (this) {
      case EQUAL:
      case NOTEQUAL:
      case LT:
      case LE:
      case GT:
      case GE:
        return true;
      default:
        return false;
    }
  }

  public boolean isQuantifier() {
    return this == FORALL || this == EXISTS;
  }
}
