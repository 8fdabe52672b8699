package exm.lola.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.lola.common.exceptions.InvalidOptionException;
import exm.lola.common.lang.PacingPolicy.EventCombination;
import exm.lola.common.lang.PacingPolicy.FrequencyRule;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testDefaults() throws Exception {
    Settings settings = Settings.defaults();
    settings.validate();
    assertEquals(EventCombination.DISJUNCTION,
                 settings.pacingPolicy().eventCombination);
    assertEquals(FrequencyRule.INTEGER_MULTIPLE,
                 settings.pacingPolicy().frequencyRule);
    assertTrue(settings.defaultLiteralTypes());
    assertTrue(settings.warnUnusedInputs());
    assertTrue(settings.allowLookahead());
    assertEquals(65535, settings.maxMemoryBound());
    assertEquals(100000, settings.maxDeadlines());
    assertTrue(settings.getKeys().contains(Settings.MAX_MEMORY_BOUND));
  }

  @Test
  public void testWithLeavesOriginal() throws Exception {
    Settings base = Settings.defaults();
    Settings changed = base.with(Settings.EVENT_COMBINATION, " Conjunction ")
                           .with(Settings.ALLOW_LOOKAHEAD, "false");
    assertEquals(EventCombination.CONJUNCTION,
                 changed.pacingPolicy().eventCombination);
    assertFalse(changed.allowLookahead());
    assertEquals(EventCombination.DISJUNCTION,
                 base.pacingPolicy().eventCombination);
    assertTrue(base.allowLookahead());
  }

  @Test
  public void testUnknownKey() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("lola.no-such-option");
    Settings.defaults().with("lola.no-such-option", "1");
  }

  @Test
  public void testBadEnumValue() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("integer-multiple");
    Settings.defaults().with(Settings.FREQUENCY_RULE, "nearest");
  }

  @Test
  public void testBadBound() throws Exception {
    exception.expect(InvalidOptionException.class);
    Settings.defaults().with(Settings.MAX_MEMORY_BOUND, "0");
  }

  @Test
  public void testBadDeadlineLimit() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.MAX_DEADLINES);
    Settings.defaults().with(Settings.MAX_DEADLINES, "-3");
  }

  @Test
  public void testBadBoolean() throws Exception {
    exception.expect(InvalidOptionException.class);
    Settings.defaults().with(Settings.WARN_UNUSED_INPUTS, "maybe");
  }

  @Test
  public void testSystemProperties() throws Exception {
    System.setProperty(Settings.MAX_MEMORY_BOUND, "100");
    try {
      assertEquals(100, Settings.fromSystemProperties().maxMemoryBound());
    } finally {
      System.clearProperty(Settings.MAX_MEMORY_BOUND);
    }
    assertEquals(65535, Settings.fromSystemProperties().maxMemoryBound());
  }

  @Test
  public void testUnknownSystemProperty() throws Exception {
    System.setProperty("lola.no-such-option", "1");
    try {
      Settings.fromSystemProperties();
    } finally {
      System.clearProperty("lola.no-such-option");
    }
    assertFalse("Warned once already", Logging.addEmitted(Level.WARN,
                "Ignoring unknown option lola.no-such-option"));
  }
}
