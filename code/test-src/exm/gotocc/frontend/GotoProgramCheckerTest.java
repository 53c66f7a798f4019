package exm.gotocc.frontend;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.gotocc.common.exceptions.InvariantViolation;
import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.Types;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;

public class GotoProgramCheckerTest {

  private static final Expr A = Expr.symbol("a", Types.BOOL);
  private static final Expr I = Expr.symbol("i", Types.INT);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testValid() {
    GotoProgram program = new GotoProgram();
    Instruction skip = Instruction.makeSkip(null);
    program.add(Instruction.makeGoto(skip, A, null));
    program.add(Instruction.makeAssignment(I, Expr.intConstant(2), null));
    program.add(skip);
    GotoProgramChecker.check(program);
  }

  @Test
  public void testForeignTarget() {
    exception.expect(InvariantViolation.class);
    GotoProgram program = new GotoProgram();
    program.add(Instruction.makeGoto(Instruction.makeSkip(null), A, null));
    GotoProgramChecker.check(program);
  }

  @Test
  public void testSideEffectLeft() {
    exception.expect(InvariantViolation.class);
    GotoProgram program = new GotoProgram();
    program.add(Instruction.makeOther(
        Code.expression(Expr.postIncrement(I)), null));
    GotoProgramChecker.check(program);
  }

  @Test
  public void testImpureGuard() {
    exception.expect(InvariantViolation.class);
    GotoProgram program = new GotoProgram();
    program.add(Instruction.makeAssertion(Expr.comma(I, A), null));
    GotoProgramChecker.check(program);
  }
}
