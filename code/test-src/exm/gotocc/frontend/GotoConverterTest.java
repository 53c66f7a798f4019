package exm.gotocc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.ListMultimap;

import exm.gotocc.common.Logging;
import exm.gotocc.common.lang.Code;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.ExprKind;
import exm.gotocc.common.lang.Symbol;
import exm.gotocc.common.lang.Types;
import exm.gotocc.common.lang.Types.Type;
import exm.gotocc.program.GotoInterpreter;
import exm.gotocc.program.GotoProgram;
import exm.gotocc.program.Instruction;
import exm.gotocc.program.InstructionType;

public class GotoConverterTest {

  private static final Expr A = Expr.symbol("a", Types.BOOL);
  private static final Expr I = Expr.symbol("i", Types.INT);
  private static final Expr N = Expr.symbol("n", Types.INT);
  private static final Expr Y = Expr.symbol("y", Types.INT);
  private static final Expr P = Expr.symbol("p", Types.pointerTo(Types.INT));

  private static final Expr F = Expr.symbol("f",
      Types.function(Types.BOOL, Collections.<Type>emptyList()));
  private static final Expr H = Expr.symbol("h",
      Types.function(Types.INT, Collections.<Type>emptyList()));
  private static final Expr K = Expr.symbol("k",
      Types.function(Types.INT, Collections.<Type>emptyList()));

  private SymbolTable symbols;
  private LoweringContext context;
  private GotoConverter converter;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("GotoConverterTest.gotocc.log", true);
  }

  @Before
  public void setUp() {
    symbols = new SymbolTable();
    context = new LoweringContext(symbols, "C", Lifetime.AUTOMATIC_LOCAL);
    converter = new GotoConverter(new VarCreator("$tmp"), true);
  }

  private GotoProgram convert(Code code) {
    GotoProgram dest = new GotoProgram();
    converter.convert(context, code, dest);
    GotoProgramChecker.check(dest);
    return dest;
  }

  private static GotoProgram fragment(Instruction ...instructions) {
    GotoProgram p = new GotoProgram();
    for (Instruction i: instructions) {
      p.add(i);
    }
    return p;
  }

  private static Instruction assign(Expr lhs, long value) {
    return Instruction.makeAssignment(lhs, Expr.intConstant(value), null);
  }

  @Test
  public void testBlockDeclaration() {
    Code block = Code.block(Code.decl(Y, Expr.functionCall(H)),
                            Code.expression(Expr.postIncrement(Y)));
    GotoProgram program = convert(block);
    assertEquals("    DECL y : int\n" +
                 "    CALL y := h()\n" +
                 "    ASSIGN y := y + 1\n" +
                 "    DEAD y\n", program.toString());
    assertEquals("Scope closed", 0, context.getLevel());
  }

  @Test
  public void testTemporariesDieInReverseOrder() {
    Expr rhs = Expr.binary(ExprKind.PLUS, Expr.postIncrement(I),
                           Expr.functionCall(H));
    GotoProgram program = convert(Code.block(Code.assign(N, rhs)));

    int size = program.size();
    assertEquals("DEAD $tmp::return_value_h$2",
                 program.get(size - 2).toString());
    assertEquals("DEAD $tmp::postfix$1", program.get(size - 1).toString());
    assertEquals("ASSIGN n := $tmp::postfix$1 + $tmp::return_value_h$2",
                 program.get(size - 3).toString());
  }

  @Test
  public void testCompoundLiteralBlockLifetime() {
    Expr literal = Expr.addressOf(Expr.compoundLiteral(Expr.intConstant(3)));
    Code block = Code.block(Code.expression(Expr.assign(P, literal)));
    GotoProgram program = convert(block);

    assertEquals("    DECL $tmp::literal$1 : int\n" +
                 "    ASSIGN $tmp::literal$1 := 3\n" +
                 "    ASSIGN p := &$tmp::literal$1\n" +
                 "    DEAD $tmp::literal$1\n", program.toString());
    assertFalse(symbols.lookup("$tmp::literal$1").isStaticLifetime());
  }

  @Test
  public void testCompoundLiteralStaticLifetime() {
    Lifetime old = context.setLifetime(Lifetime.STATIC_GLOBAL);
    assertSame(Lifetime.AUTOMATIC_LOCAL, old);

    Expr literal = Expr.addressOf(Expr.compoundLiteral(Expr.intConstant(3)));
    Code block = Code.block(Code.expression(Expr.assign(P, literal)));
    GotoProgram program = convert(block);

    assertEquals("No DECL or DEAD for static objects",
                 "    ASSIGN $tmp::literal$1 := 3\n" +
                 "    ASSIGN p := &$tmp::literal$1\n", program.toString());
    Symbol sym = symbols.lookup("$tmp::literal$1");
    assertTrue(sym.isStaticLifetime());
    assertTrue(sym.isAuxiliary());
  }

  @Test
  public void testIfThenElseBothEmpty() {
    GotoProgram dest = new GotoProgram();
    converter.generateIfThenElse(context, A, new GotoProgram(),
                                 new GotoProgram(), null, dest);
    assertEquals("    SKIP\n", dest.toString());
  }

  @Test
  public void testIfThenElseEmptyTrue() {
    GotoProgram dest = new GotoProgram();
    GotoProgram falseCase = fragment(assign(I, 2));
    converter.generateIfThenElse(context, A, new GotoProgram(), falseCase,
                                 null, dest);
    assertEquals("    IF a THEN GOTO 1\n" +
                 "    ASSIGN i := 2\n" +
                 " 1: SKIP\n", dest.toString());
    assertTrue("Fragment moved", falseCase.isEmpty());
  }

  @Test
  public void testIfThenElseEmptyFalse() {
    GotoProgram dest = new GotoProgram();
    converter.generateIfThenElse(context, Expr.not(A),
              fragment(assign(I, 1)), new GotoProgram(), null, dest);
    assertEquals("Double negation removed",
                 "    IF a THEN GOTO 1\n" +
                 "    ASSIGN i := 1\n" +
                 " 1: SKIP\n", dest.toString());
  }

  @Test
  public void testIfThenElseGeneral() {
    GotoProgram dest = new GotoProgram();
    GotoProgram trueCase = fragment(assign(I, 1));
    GotoProgram falseCase = fragment(assign(I, 2), assign(N, 2));
    converter.generateIfThenElse(context, A, trueCase, falseCase, null,
                                 dest);
    assertEquals("    IF !a THEN GOTO 1\n" +
                 "    ASSIGN i := 1\n" +
                 "    GOTO 2\n" +
                 " 1: ASSIGN i := 2\n" +
                 "    ASSIGN n := 2\n" +
                 " 2: SKIP\n", dest.toString());
    assertTrue(trueCase.isEmpty());
    assertTrue(falseCase.isEmpty());
  }

  @Test
  public void testBranchIsolation() {
    CleanResult res = converter.clean(context,
        Expr.ifExpr(A, Expr.functionCall(H), Expr.functionCall(K)), true);
    GotoProgram program = res.program();
    ListMultimap<Instruction, Instruction> incoming =
                                        program.computeIncomingEdges();

    Instruction branch = null;
    Instruction jumpToJoin = null;
    Instruction falseStart = null;
    Instruction join = program.last();
    for (Instruction i: program.instructions()) {
      if (i.isGoto() && !i.isUnconditionalGoto()) {
        branch = i;
        falseStart = i.target();
      } else if (i.isUnconditionalGoto()) {
        jumpToJoin = i;
      }
    }
    assertEquals(InstructionType.SKIP, join.type());
    assertEquals("False branch only reachable from the branch",
                 Arrays.asList(branch), incoming.get(falseStart));

    int trueStart = program.indexOf(branch) + 1;
    assertEquals("True branch only reachable by falling through",
                 Arrays.asList(branch),
                 incoming.get(program.get(trueStart)));

    List<Instruction> joinPreds = incoming.get(join);
    assertEquals(2, joinPreds.size());
    assertTrue(joinPreds.contains(jumpToJoin));
    assertTrue(joinPreds.contains(program.get(program.size() - 2)));
  }

  @Test
  public void testIfThenElseStatement() {
    Expr cond = Expr.and(A, Expr.functionCall(F));
    Code code = Code.ifThenElse(cond,
        Code.assign(I, Expr.intConstant(1)), null);
    GotoProgram program = convert(code);

    GotoInterpreter interp = new GotoInterpreter().set("a", 1).set("i", 0)
                                                  .returns("f", 1);
    interp.run(program);
    assertEquals(1, interp.get("i"));

    interp = new GotoInterpreter().set("a", 1).set("i", 0);
    interp.run(program);
    assertEquals(0, interp.get("i"));
    assertEquals(Arrays.asList("f"), interp.calls());

    interp = new GotoInterpreter().set("a", 0).set("i", 0);
    interp.run(program);
    assertEquals(0, interp.get("i"));
    assertTrue(interp.calls().isEmpty());
  }

  @Test
  public void testIfThenElseStatementWithElse() {
    Code code = Code.ifThenElse(A,
        Code.assign(I, Expr.intConstant(1)),
        Code.assign(I, Expr.intConstant(2)));
    GotoProgram program = convert(code);
    assertEquals(5, program.size());

    GotoInterpreter interp = new GotoInterpreter().set("a", 0);
    interp.run(program);
    assertEquals(2, interp.get("i"));
  }

  @Test
  public void testAssertAndAssume() {
    Code check = Code.assertion(Expr.or(A, Expr.functionCall(F)));
    GotoProgram program = convert(check);
    Instruction last = program.last();
    assertEquals(InstructionType.ASSERT, last.type());
    assertTrue("Condition is a temporary", last.guard().isSymbol());

    program = convert(Code.assumption(A));
    assertEquals("    ASSUME a\n", program.toString());
  }

  @Test
  public void testExpressionStatement() {
    assertEquals("    CALL h()\n",
        convert(Code.expression(Expr.functionCall(H))).toString());
    assertEquals("    OTHER i + n\n",
        convert(Code.expression(Expr.binary(ExprKind.PLUS, I, N)))
                .toString());
  }

  @Test
  public void testFunctionCallStatement() {
    Code call = Code.functionCall(Y, H, Collections.<Expr>emptyList());
    assertEquals("    CALL y := h()\n", convert(call).toString());

    Expr g = Expr.symbol("g", Types.function(Types.VOID,
                                  Arrays.<Type>asList(Types.INT)));
    Code withArg = Code.functionCall(null, g,
                      Arrays.asList(Expr.postIncrement(I)));
    assertEquals("    DECL $tmp::postfix$1 : int\n" +
                 "    ASSIGN $tmp::postfix$1 := i\n" +
                 "    ASSIGN i := i + 1\n" +
                 "    CALL g($tmp::postfix$1)\n",
                 convert(withArg).toString());
  }

  @Test
  public void testDeadAndSkip() {
    GotoProgram program = convert(Code.block(Code.dead(Y), Code.skip()));
    assertEquals("    DEAD y\n    SKIP\n", program.toString());
  }
}
