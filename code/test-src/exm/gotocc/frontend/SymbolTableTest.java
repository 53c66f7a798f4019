package exm.gotocc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.lang.SourceLocation;
import exm.gotocc.common.lang.Symbol;
import exm.gotocc.common.lang.Types;

public class SymbolTableTest {

  private static final SourceLocation LOC = SourceLocation.create("t.c", 3);

  @Test
  public void testFreshNames() {
    SymbolTable table = new SymbolTable();
    Symbol s1 = table.freshAuxSymbol(Types.INT, "$tmp", "if_expr", LOC, "C",
                                     false, null);
    Symbol s2 = table.freshAuxSymbol(Types.INT, "$tmp", "literal", LOC, "C",
                                     true, null);
    assertEquals("$tmp::if_expr$1", s1.name());
    assertEquals("if_expr$1", s1.baseName());
    assertEquals("Counter shared between purposes", "$tmp::literal$2",
                 s2.name());
    assertTrue(s1.isAuxiliary());
    assertTrue(s2.isStaticLifetime());
    assertSame(s2, table.lookup("$tmp::literal$2"));
    assertEquals(2, table.size());
  }

  @Test
  public void testFreshNameSkipsExisting() {
    SymbolTable table = new SymbolTable();
    table.add(new Symbol("$tmp::assign$1", "assign$1", Types.INT, "C", LOC,
                         false, false, null));
    Symbol s = table.freshAuxSymbol(Types.INT, "$tmp", "assign", LOC, "C",
                                    false, null);
    assertEquals("$tmp::assign$2", s.name());
  }

  @Test(expected=GotoCCRuntimeError.class)
  public void testDuplicate() {
    SymbolTable table = new SymbolTable();
    Symbol s = new Symbol("x", "x", Types.INT, "C", LOC, false, false, null);
    table.add(s);
    table.add(s);
  }

  @Test
  public void testLookupMissing() {
    assertNull(new SymbolTable().lookup("nope"));
  }
}
