package exm.gotocc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.gotocc.common.exceptions.InvalidOptionException;
import exm.gotocc.common.lang.Expr;
import exm.gotocc.common.lang.Types;
import exm.gotocc.frontend.CleanResult;
import exm.gotocc.frontend.GotoConverter;
import exm.gotocc.frontend.LoweringContext;
import exm.gotocc.frontend.SymbolTable;

public class SettingsTest {

  @After
  public void resetSettings() {
    for (String key: Settings.getKeys()) {
      System.clearProperty(key);
      Settings.reset(key);
    }
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals("$tmp", Settings.get(Settings.TMP_PREFIX));
    assertEquals("C", Settings.get(Settings.MODE));
    assertTrue(Settings.getBoolean(Settings.CHECK_LOWERED));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.TMP_PREFIX, "__cs");
    System.setProperty(Settings.MODE, "cpp");
    Settings.initProperties();
    assertEquals("__cs", Settings.get(Settings.TMP_PREFIX));

    GotoConverter converter = GotoConverter.fromSettings();
    SymbolTable symbols = new SymbolTable();
    LoweringContext context = LoweringContext.create(symbols);
    Expr i = Expr.symbol("i", Types.INT);
    CleanResult res = converter.clean(context, Expr.postIncrement(i), true);
    assertEquals("__cs::postfix$1", res.residual().toString());
    assertEquals("cpp", symbols.lookup("__cs::postfix$1").mode());
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.CHECK_LOWERED, "maybe");
    Settings.getBoolean(Settings.CHECK_LOWERED);
  }

  @Test(expected=InvalidOptionException.class)
  public void testEmptyPrefix() throws InvalidOptionException {
    System.setProperty(Settings.TMP_PREFIX, "");
    Settings.initProperties();
  }

  @Test
  public void testReset() {
    Settings.set(Settings.MODE, "java");
    assertEquals("java", Settings.get(Settings.MODE));
    Settings.reset(Settings.MODE);
    assertEquals("C", Settings.get(Settings.MODE));
  }

  @Test
  public void testLoggingFromSettings() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupLogging();
    assertEquals(Level.TRACE, logger.getLevel());

    Settings.reset(Settings.LOG_TRACE);
    assertEquals("No log file, warnings only", Level.WARN,
                 Logging.setupLogging().getLevel());
  }
}
