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
 * Sub-kinds of SIDE_EFFECT expressions
 */
public enum SideEffectKind {
  ASSIGN("="),
  ASSIGN_PLUS("+=", ExprKind.PLUS),
  ASSIGN_MINUS("-=", ExprKind.MINUS),
  ASSIGN_MULT("*=", ExprKind.MULT),
  PREINCREMENT("++", ExprKind.PLUS),
  PREDECREMENT("--", ExprKind.MINUS),
  POSTINCREMENT("++", ExprKind.PLUS),
  POSTDECREMENT("--", ExprKind.MINUS),
  FUNCTION_CALL,
  /* GCC ({ ... }) */
  STATEMENT_EXPRESSION,
  /* GCC a ?: b */
  GCC_CONDITIONAL_EXPRESSION("?:"),
  ;

  private final String operator;
  /* Arithmetic performed by compound assignments and increments */
  private final ExprKind arithmetic;

  private SideEffectKind() {
    this(null, null);
  }

  private SideEffectKind(String operator) {
    this(operator, null);
  }

  private SideEffectKind(String operator, ExprKind arithmetic) {
    this.operator = operator;
    this.arithmetic = arithmetic;
  }

  public String operator() {
    return operator;
  }

  public ExprKind arithmetic() {
    return arithmetic;
  }

  public boolean isAssignment() {
    return this == ASSIGN || this == ASSIGN_PLUS ||
           this == ASSIGN_MINUS || this == ASSIGN_MULT;
  }
}
