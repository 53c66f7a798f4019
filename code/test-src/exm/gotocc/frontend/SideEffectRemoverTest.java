package exm.gotocc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.gotocc.common.exceptions.InvariantViolation;
import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.ExprKind;
import exm.gotocc.common.lang.SideEffectKind;
import exm.gotocc.common.lang.Types;
import exm.gotocc.common.lang.Types.Type;
import exm.gotocc.program.GotoInterpreter;
import exm.gotocc.program.GotoProgram;

public class SideEffectRemoverTest {

  private static final Expr I = Expr.symbol("i", Types.INT);
  private static final Expr N = Expr.symbol("n", Types.INT);
  private static final Expr P = Expr.symbol("p", Types.pointerTo(Types.INT));
  private static final Expr H = Expr.symbol("h",
      Types.function(Types.INT, Collections.<Type>emptyList()));

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private SymbolTable symbols;
  private LoweringContext context;
  private GotoConverter converter;

  @Before
  public void setUp() {
    symbols = new SymbolTable();
    context = new LoweringContext(symbols, "C", Lifetime.AUTOMATIC_LOCAL);
    converter = new GotoConverter(new VarCreator("$tmp"), true);
  }

  @Test
  public void testCompoundAssignment() {
    Expr expr = Expr.compoundAssign(SideEffectKind.ASSIGN_MULT, I, N);
    CleanResult res = converter.clean(context, expr, true);
    assertEquals("    ASSIGN i := i * n\n", res.program().toString());
    assertEquals("Plain symbol is its own value", I, res.residual());
  }

  @Test
  public void testPreIncrement() {
    CleanResult res = converter.clean(context,
        Expr.binary(ExprKind.MULT, Expr.preDecrement(I), N), true);
    assertEquals("    ASSIGN i := i - 1\n", res.program().toString());
    assertEquals("i * n", res.residual().toString());

    GotoInterpreter interp = new GotoInterpreter().set("i", 3).set("n", 5);
    interp.run(res.program());
    assertEquals("New value used", 10, interp.eval(res.residual()));
  }

  @Test
  public void testPostDecrementValue() {
    CleanResult res = converter.clean(context,
        Expr.binary(ExprKind.MULT, Expr.postDecrement(I), N), true);
    GotoInterpreter interp = new GotoInterpreter().set("i", 3).set("n", 5);
    interp.run(res.program());
    assertEquals("Old value used", 15, interp.eval(res.residual()));
    assertEquals(2, interp.get("i"));
  }

  @Test
  public void testPointerIncrement() {
    CleanResult res = converter.clean(context, Expr.preIncrement(P), false);
    assertEquals("    ASSIGN p := p + 1\n", res.program().toString());
  }

  @Test
  public void testAssignmentThroughPointer() {
    Expr lhs = Expr.dereference(P);
    CleanResult res = converter.clean(context,
        Expr.binary(ExprKind.PLUS, Expr.assign(lhs, N), I), true);
    assertEquals("    DECL $tmp::assign$1 : int\n" +
                 "    ASSIGN $tmp::assign$1 := n\n" +
                 "    ASSIGN *p := $tmp::assign$1\n",
                 res.program().toString());
    assertEquals("$tmp::assign$1 + i", res.residual().toString());
  }

  @Test
  public void testAssignmentDiscarded() {
    Expr lhs = Expr.dereference(P);
    CleanResult res = converter.clean(context, Expr.assign(lhs, N), false);
    assertEquals("    ASSIGN *p := n\n", res.program().toString());
    assertNull(res.residual());
    assertEquals(0, symbols.size());
  }

  @Test
  public void testChainedAssignment() {
    Expr m = Expr.symbol("m", Types.INT);
    CleanResult res = converter.clean(context,
                        Expr.assign(m, Expr.assign(I, N)), false);
    assertEquals("    ASSIGN i := n\n" +
                 "    ASSIGN m := i\n", res.program().toString());
  }

  @Test
  public void testFunctionCallArguments() {
    Expr g = Expr.symbol("g", Types.function(Types.INT,
                                  Arrays.<Type>asList(Types.INT)));
    Expr call = Expr.functionCall(g, Expr.functionCall(H));
    CleanResult res = converter.clean(context, call, true);
    assertEquals("    DECL $tmp::return_value_h$1 : int\n" +
                 "    CALL $tmp::return_value_h$1 := h()\n" +
                 "    DECL $tmp::return_value_g$2 : int\n" +
                 "    CALL $tmp::return_value_g$2 := " +
                           "g($tmp::return_value_h$1)\n",
                 res.program().toString());
  }

  @Test
  public void testCallThroughPointer() {
    Expr fp = Expr.symbol("fp", Types.pointerTo(
        Types.function(Types.INT, Collections.<Type>emptyList())));
    CleanResult res = converter.clean(context,
        Expr.functionCall(Expr.dereference(fp)), true);
    assertEquals("No function name available", "$tmp::return_value$1",
                 res.residual().toString());
  }

  private static Expr statementExpression(Code ...body) {
    return Expr.statementExpression(Code.block(body), Types.INT);
  }

  @Test
  public void testStatementExpressionUsed() {
    Expr expr = statementExpression(
        Code.assign(I, Expr.binary(ExprKind.PLUS, I, Expr.intConstant(1))),
        Code.expression(I));
    CleanResult res = converter.clean(context, expr, true);
    assertEquals("    DECL $tmp::statement_expression$1 : int\n" +
                 "    ASSIGN i := i + 1\n" +
                 "    ASSIGN $tmp::statement_expression$1 := i\n",
                 res.program().toString());
    assertEquals("$tmp::statement_expression$1", res.residual().toString());
  }

  @Test
  public void testStatementExpressionDiscarded() {
    Expr expr = statementExpression(Code.expression(Expr.functionCall(H)));
    CleanResult res = converter.clean(context, expr, false);
    assertEquals("    CALL h()\n", res.program().toString());
    assertEquals(0, symbols.size());
  }

  @Test
  public void testStatementExpressionLocals() {
    Expr y = Expr.symbol("y", Types.INT);
    Expr expr = statementExpression(Code.decl(y, N), Code.expression(y));
    GotoProgram program = converter.clean(context, expr, true).program();
    assertEquals("Local of body dies with the body",
                 "DEAD y", program.last().toString());
  }

  @Test
  public void testStatementExpressionNoValue() {
    exception.expect(InvariantViolation.class);
    Expr expr = statementExpression(Code.assign(I, N));
    converter.clean(context, expr, true);
  }

  @Test
  public void testStatementExpressionNotBlock() {
    exception.expect(InvariantViolation.class);
    Expr expr = Expr.statementExpression(Code.expression(I), Types.INT);
    converter.clean(context, expr, false);
  }
}
