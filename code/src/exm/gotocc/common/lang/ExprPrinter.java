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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Render expressions and statements in C-like syntax for logging,
 * diagnostics and goto program listings.
 */
public class ExprPrinter {

  public static String print(Expr e) {
    StringBuilder sb = new StringBuilder();
    print(sb, e);
    return sb.toString();
  }

  public static void print(StringBuilder sb, Expr e) {
    switch (e.kind()) {
      case SYMBOL:
      case CONSTANT:
        sb.append(e.identifier());
        break;
      case STRING_CONSTANT:
        sb.append('"');
        sb.append(escape(e.identifier()));
        sb.append('"');
        break;
      case NOT:
      case UNARY_MINUS:
        sb.append(e.kind().operator());
        printOperand(sb, e.operand(0));
        break;
      case AND:
      case OR:
      case IMPLIES:
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
        printInfix(sb, e.kind().operator(), e.operands());
        break;
      case IF:
        printOperand(sb, e.operand(0));
        sb.append(" ? ");
        printOperand(sb, e.operand(1));
        sb.append(" : ");
        printOperand(sb, e.operand(2));
        break;
      case COMMA:
        sb.append('(');
        sb.append(StringUtils.join(printAll(e.operands()), ", "));
        sb.append(')');
        break;
      case TYPECAST:
        sb.append('(');
        sb.append(e.type().toString());
        sb.append(')');
        printOperand(sb, e.operand(0));
        break;
      case COMPOUND_LITERAL:
        sb.append('(');
        sb.append(e.type().toString());
        sb.append(')');
        print(sb, e.operand(0));
        break;
      case ADDRESS_OF:
        sb.append('&');
        printOperand(sb, e.operand(0));
        break;
      case DEREFERENCE:
        sb.append('*');
        printOperand(sb, e.operand(0));
        break;
      case INDEX:
        printOperand(sb, e.operand(0));
        sb.append('[');
        print(sb, e.operand(1));
        sb.append(']');
        break;
      case MEMBER:
        printOperand(sb, e.operand(0));
        sb.append('.');
        sb.append(e.identifier());
        break;
      case STRUCT:
      case ARRAY:
        sb.append("{ ");
        sb.append(StringUtils.join(printAll(e.operands()), ", "));
        sb.append(" }");
        break;
      case FORALL:
      case EXISTS:
        sb.append(e.kind() == ExprKind.FORALL ? "forall " : "exists ");
        print(sb, e.operand(0));
        sb.append(". ");
        printOperand(sb, e.operand(1));
        break;
      case SIDE_EFFECT:
        printSideEffect(sb, e);
        break;
      default:
        sb.append("<" + e.kind() + ">");
    }
  }

  private static void printSideEffect(StringBuilder sb, Expr e) {
    SideEffectKind sk = e.statement();
    switch (sk) {
      case ASSIGN:
      case ASSIGN_PLUS:
      case ASSIGN_MINUS:
      case ASSIGN_MULT:
      case GCC_CONDITIONAL_EXPRESSION:
        printInfix(sb, sk.operator(), e.operands());
        break;
      case PREINCREMENT:
      case PREDECREMENT:
        sb.append(sk.operator());
        printOperand(sb, e.operand(0));
        break;
      case POSTINCREMENT:
      case POSTDECREMENT:
        printOperand(sb, e.operand(0));
        sb.append(sk.operator());
        break;
      case FUNCTION_CALL:
        printOperand(sb, e.callFunction());
        sb.append('(');
        sb.append(StringUtils.join(printAll(e.callArguments()), ", "));
        sb.append(')');
        break;
      case STATEMENT_EXPRESSION:
        sb.append("({ ");
        for (Code c: e.code().statements()) {
          printCodeInline(sb, c);
          sb.append(' ');
        }
        sb.append("})");
        break;
      default:
        sb.append("<" + sk + ">");
    }
  }

  private static void printInfix(StringBuilder sb, String op,
                                 List<Expr> operands) {
    boolean first = true;
    for (Expr op1: operands) {
      if (!first) {
        sb.append(' ');
        sb.append(op);
        sb.append(' ');
      }
      printOperand(sb, op1);
      first = false;
    }
  }

  /**
   * Print operand, parenthesised unless atomic
   */
  private static void printOperand(StringBuilder sb, Expr e) {
    if (isAtomic(e)) {
      print(sb, e);
    } else {
      sb.append('(');
      print(sb, e);
      sb.append(')');
    }
  }

  private static boolean isAtomic(Expr e) {
    switch (e.kind()) {
      case SYMBOL:
      case CONSTANT:
      case STRING_CONSTANT:
      case INDEX:
      case MEMBER:
      case COMMA:
      case STRUCT:
      case ARRAY:
        return true;
      case SIDE_EFFECT:
        return e.statement() == SideEffectKind.FUNCTION_CALL ||
               e.statement() == SideEffectKind.STATEMENT_EXPRESSION;
      default:
        return false;
    }
  }

  private static List<String> printAll(List<Expr> exprs) {
    List<String> result = new ArrayList<String>(exprs.size());
    for (Expr e: exprs) {
      result.add(print(e));
    }
    return result;
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"")
            .replace("\n", "\\n");
  }

  private static void printCodeInline(StringBuilder sb, Code c) {
    StringBuilder tmp = new StringBuilder();
    printCode(tmp, c, "");
    sb.append(StringUtils.normalizeSpace(tmp.toString()));
  }

  public static void printCode(StringBuilder sb, Code c, String indent) {
    switch (c.kind()) {
      case ASSIGN:
        sb.append(indent);
        print(sb, c.lhs());
        sb.append(" = ");
        print(sb, c.rhs());
        sb.append(";\n");
        break;
      case EXPRESSION:
        sb.append(indent);
        print(sb, c.expression());
        sb.append(";\n");
        break;
      case DECL:
        sb.append(indent);
        sb.append(c.symbol().type().toString());
        sb.append(' ');
        print(sb, c.symbol());
        if (c.initialValue() != null) {
          sb.append(" = ");
          print(sb, c.initialValue());
        }
        sb.append(";\n");
        break;
      case DEAD:
        sb.append(indent);
        sb.append("dead ");
        print(sb, c.symbol());
        sb.append(";\n");
        break;
      case BLOCK:
        sb.append(indent);
        sb.append("{\n");
        for (Code s: c.statements()) {
          printCode(sb, s, indent + "  ");
        }
        sb.append(indent);
        sb.append("}\n");
        break;
      case IFTHENELSE:
        sb.append(indent);
        sb.append("if(");
        print(sb, c.cond());
        sb.append(")\n");
        printCode(sb, c.thenCase(), indent + "  ");
        if (c.elseCase() != null) {
          sb.append(indent);
          sb.append("else\n");
          printCode(sb, c.elseCase(), indent + "  ");
        }
        break;
      case ASSERT:
      case ASSUME:
        sb.append(indent);
        sb.append(c.kind() == CodeKind.ASSERT ? "assert(" : "assume(");
        print(sb, c.cond());
        sb.append(");\n");
        break;
      case FUNCTION_CALL:
        sb.append(indent);
        if (c.lhs() != null) {
          print(sb, c.lhs());
          sb.append(" = ");
        }
        printOperand(sb, c.callFunction());
        sb.append('(');
        sb.append(StringUtils.join(printAll(c.callArguments()), ", "));
        sb.append(");\n");
        break;
      case SKIP:
        sb.append(indent);
        sb.append(";\n");
        break;
      default:
        sb.append(indent);
        sb.append("<" + c.kind() + ">\n");
    }
  }
}
