package edu.jhu.hlt.beamsearch.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class ExperimentPropertiesTest {

  @Test
  public void defaultsAreRecorded() {
    ExperimentProperties config = new ExperimentProperties();
    assertEquals(7, config.getInt("beamSize", 7));
    assertEquals("7", config.getProperty("beamSize"));
    assertEquals(0.5, config.getDouble("lr", 0.5), 1e-9);
    assertTrue(config.getBoolean("debug", true));
    assertEquals("x", config.getString("name", "x"));
    // a recorded default now wins over a different default
    assertEquals(7, config.getInt("beamSize", 3));
  }

  @Test
  public void fromMainArgs() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"beamSize", " 12", "initialSequence", "3,1, 4", "keepBeamDetails", "true"});
    assertEquals(12, config.getInt("beamSize"));
    assertEquals(Arrays.asList(3, 1, 4), config.getIntList("initialSequence"));
    assertTrue(config.getBoolean("keepBeamDetails"));
    assertNull(config.getIntList("nope"));
  }

  @Test
  public void nullStringDefault() {
    ExperimentProperties config = new ExperimentProperties();
    assertNull(config.getString("outputDir", null));
    assertFalse(config.containsKey("outputDir"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void oddArgs() {
    new ExperimentProperties().putAll(new String[] {"beamSize"});
  }

  @Test(expected = IllegalArgumentException.class)
  public void duplicateArgs() {
    new ExperimentProperties().putAll(new String[] {"beamSize", "1", "beamSize", "2"});
  }

  @Test
  public void duplicateArgsAllowed() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"beamSize", "1", "beamSize", "2"}, true);
    assertEquals(2, config.getInt("beamSize"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingRequired() {
    new ExperimentProperties().getInt("beamSize");
  }

  @Test(expected = NumberFormatException.class)
  public void malformed() {
    ExperimentProperties config = new ExperimentProperties();
    config.put("beamSize", "ten");
    config.getInt("beamSize");
  }

  @Test
  public void singleton() {
    assertSame(ExperimentProperties.getInstance(), ExperimentProperties.getInstance());
  }
}
