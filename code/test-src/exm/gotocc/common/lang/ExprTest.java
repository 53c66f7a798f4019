package exm.gotocc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.lang.Types.StructType;
import exm.gotocc.common.lang.Types.StructType.StructField;
import exm.gotocc.common.lang.Types.Type;

public class ExprTest {

  private static final Expr A = Expr.symbol("a", Types.BOOL);
  private static final Expr I = Expr.symbol("i", Types.INT);
  private static final Expr F = Expr.symbol("f",
      Types.function(Types.INT, Arrays.<Type>asList(Types.INT)));

  @Test
  public void testEqualityIgnoresLocation() {
    Expr e1 = Expr.binary(ExprKind.PLUS, I, Expr.intConstant(1));
    Expr e2 = e1.at(SourceLocation.create("t.c", 12));
    assertNotSame(e1, e2);
    assertEquals(e1, e2);
    assertEquals(e1.hashCode(), e2.hashCode());
    assertEquals("t.c:12", e2.location().toString());
  }

  @Test
  public void testFindSourceLocation() {
    SourceLocation loc = SourceLocation.create("t.c", 4);
    Expr e = Expr.not(A.at(loc));
    assertTrue(e.location().isNil());
    assertEquals(loc, e.findSourceLocation());
  }

  @Test
  public void testRebuild() {
    Expr e = Expr.binary(ExprKind.MINUS, I, Expr.intConstant(1));
    Expr replaced = e.withOperand(1, Expr.intConstant(2));
    assertEquals("i - 1", e.toString());
    assertEquals("Original unchanged", "i - 2", replaced.toString());
  }

  @Test
  public void testHasSideEffect() {
    assertFalse(Expr.not(A).hasSideEffect());
    Expr call = Expr.functionCall(F, I);
    assertTrue(call.isSideEffect(SideEffectKind.FUNCTION_CALL));
    assertTrue(Expr.forall(I, Expr.binary(ExprKind.LT, I, call))
                   .hasSideEffect());
    assertSame(F, call.callFunction());
    assertEquals(Arrays.asList(I), call.callArguments());
    assertEquals(Types.INT, call.type());
  }

  @Test
  public void testCasts() {
    Expr same = Expr.conditionalCast(I, Types.INT);
    assertSame(I, same);
    Expr cast = Expr.conditionalCast(I, Types.LONG);
    assertEquals("(long)i", cast.toString());
    assertSame(I, Expr.skipTypecast(Expr.typecast(cast, Types.BOOL)));
  }

  @Test
  public void testPrinting() {
    assertEquals("a ? (i + 1) : 0", Expr.ifExpr(A,
        Expr.binary(ExprKind.PLUS, I, Expr.intConstant(1)),
        Expr.intConstant(0)).toString());
    assertEquals("(a, i)", Expr.comma(A, I).toString());
    assertEquals("f(i++)", Expr.functionCall(F, Expr.postIncrement(I))
                               .toString());
    assertEquals("\"x\\\"y\"", Expr.stringConstant("x\"y").toString());
  }

  @Test
  public void testStructMember() {
    StructType t = Types.struct("s", Arrays.asList(
        new StructField(Types.BOOL, "flag")));
    Expr s = Expr.symbol("v", t);
    Expr m = Expr.member(s, "flag");
    assertEquals(Types.BOOL, m.type());
    assertEquals("v.flag", m.toString());
  }

  @Test(expected=GotoCCRuntimeError.class)
  public void testNullOperand() {
    Expr.not(null);
  }

  @Test(expected=GotoCCRuntimeError.class)
  public void testStructArity() {
    StructType t = Types.struct("s", Collections.<StructField>emptyList());
    Expr.struct(Arrays.asList(I), t);
  }
}
