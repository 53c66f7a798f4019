package exm.gotocc.program;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.Types;

/**
 * Executes goto programs over integer state, recording function calls.
 * Booleans are 0 and 1.  Only what the lowering tests need.
 */
public class GotoInterpreter {
  private static final int MAX_STEPS = 10000;

  private final Map<String, Long> state = new HashMap<String, Long>();
  private final Map<String, Long> returnValues = new HashMap<String, Long>();
  private final List<String> calls = new ArrayList<String>();

  public GotoInterpreter set(String var, long value) {
    state.put(var, value);
    return this;
  }

  /**
   * Set value returned by calls to fn, 0 if not set
   */
  public GotoInterpreter returns(String fn, long value) {
    returnValues.put(fn, value);
    return this;
  }

  public long get(String var) {
    Long val = state.get(var);
    if (val == null) {
      throw new IllegalStateException("no value for " + var);
    }
    return val;
  }

  public boolean isDefined(String var) {
    return state.containsKey(var);
  }

  /**
   * @return names of called functions, in call order
   */
  public List<String> calls() {
    return calls;
  }

  public void run(GotoProgram program) {
    int pc = 0;
    int steps = 0;
    while (pc < program.size()) {
      if (++steps > MAX_STEPS) {
        throw new IllegalStateException("step limit exceeded");
      }
      Instruction i = program.get(pc);
      Code code = i.code();
      switch (i.type()) {
        case DECL:
          state.put(code.symbol().identifier(), 0L);
          break;
        case DEAD:
          state.remove(code.symbol().identifier());
          break;
        case ASSIGN:
          assign(code.lhs(), eval(code.rhs()));
          break;
        case FUNCTION_CALL: {
          for (Expr arg: code.callArguments()) {
            eval(arg);
          }
          String fn = code.callFunction().identifier();
          calls.add(fn);
          if (code.lhs() != null) {
            Long rv = returnValues.get(fn);
            assign(code.lhs(), rv == null ? 0L : rv);
          }
          break;
        }
        case GOTO:
          if (eval(i.guard()) != 0) {
            pc = program.indexOf(i.target());
            if (pc < 0) {
              throw new IllegalStateException("bad jump target");
            }
            continue;
          }
          break;
        case ASSERT:
          if (eval(i.guard()) == 0) {
            throw new AssertionError("assertion failed: " + i);
          }
          break;
        case ASSUME:
          if (eval(i.guard()) == 0) {
            return;
          }
          break;
        case OTHER:
          eval(code.expression());
          break;
        case SKIP:
          break;
        default:
          throw new UnsupportedOperationException(i.toString());
      }
      pc++;
    }
  }

  private void assign(Expr lhs, long value) {
    Expr target = Expr.skipTypecast(lhs);
    if (!target.isSymbol()) {
      throw new UnsupportedOperationException("assignment to " + lhs);
    }
    state.put(target.identifier(), value);
  }

  public long eval(Expr e) {
    switch (e.kind()) {
      case SYMBOL:
        return get(e.identifier());
      case CONSTANT:
        if (e.isTrue()) {
          return 1;
        } else if (e.isFalse()) {
          return 0;
        }
        return Long.parseLong(e.identifier());
      case NOT:
        return eval(e.operand(0)) == 0 ? 1 : 0;
      case UNARY_MINUS:
        return -eval(e.operand(0));
      case AND:
        for (Expr op: e.operands()) {
          if (eval(op) == 0) {
            return 0;
          }
        }
        return 1;
      case OR:
        for (Expr op: e.operands()) {
          if (eval(op) != 0) {
            return 1;
          }
        }
        return 0;
      case IMPLIES:
        return eval(e.operand(0)) == 0 || eval(e.operand(1)) != 0 ? 1 : 0;
      case PLUS:
        return eval(e.operand(0)) + eval(e.operand(1));
      case MINUS:
        return eval(e.operand(0)) - eval(e.operand(1));
      case MULT:
        return eval(e.operand(0)) * eval(e.operand(1));
      case DIV:
        return eval(e.operand(0)) / eval(e.operand(1));
      case MOD:
        return eval(e.operand(0)) % eval(e.operand(1));
      case EQUAL:
        return eval(e.operand(0)) == eval(e.operand(1)) ? 1 : 0;
      case NOTEQUAL:
        return eval(e.operand(0)) != eval(e.operand(1)) ? 1 : 0;
      case LT:
        return eval(e.operand(0)) < eval(e.operand(1)) ? 1 : 0;
      case LE:
        return eval(e.operand(0)) <= eval(e.operand(1)) ? 1 : 0;
      case GT:
        return eval(e.operand(0)) > eval(e.operand(1)) ? 1 : 0;
      case GE:
        return eval(e.operand(0)) >= eval(e.operand(1)) ? 1 : 0;
      case IF:
        return eval(e.operand(0)) != 0 ? eval(e.operand(1))
                                       : eval(e.operand(2));
      case TYPECAST: {
        long val = eval(e.operand(0));
        if (Types.isBool(e.type())) {
          return val != 0 ? 1 : 0;
        }
        return val;
      }
      default:
        throw new UnsupportedOperationException("cannot evaluate " + e);
    }
  }
}
