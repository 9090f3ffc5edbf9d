package kalmanstudy.filter.examples;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

public class SimulationTest {

  @Test
  public void samplesAreEvenlySpaced() {
    Simulation sim = Simulation.freeFall(100, 20, 1);
    assertEquals(100, sim.samples());
    assertEquals(0,  sim.times[0],  0);
    assertEquals(20, sim.times[99], 1e-12);
    assertEquals(20.0 / 99, sim.times[1], 1e-12);
    assertEquals(2000, sim.truth[0].getEntry(0), 0);
    assertEquals(2000 - 9.81 * 400, sim.truth[99].getEntry(0), 1e-9);
  }

  @Test
  public void uniformNoiseIsBounded() {
    Simulation sim = Simulation.freeFall(1000, 20, 7);
    RealVector[] observations = sim.simulate(Simulation.Noise.UNIFORM, 10);
    for (int i=0; i<observations.length; i++)
      assertTrue(Math.abs(observations[i].getEntry(0) - sim.truth[i].getEntry(0)) <= 10);
  }

  @Test
  public void sameSeedSameObservations() {
    RealVector[] a = Simulation.freeFall(50, 20, 69978).simulate(Simulation.Noise.GAUSSIAN, 50);
    RealVector[] b = Simulation.freeFall(50, 20, 69978).simulate(Simulation.Noise.GAUSSIAN, 50);
    for (int i=0; i<a.length; i++) assertEquals(a[i], b[i]);
  }

  @Test
  public void eachSimulationDrawsFreshNoise() {
    Simulation sim = Simulation.freeFall(50, 20, 69978);
    RealVector first  = sim.simulate(Simulation.Noise.GAUSSIAN, 50)[0];
    RealVector second = sim.simulate(Simulation.Noise.GAUSSIAN, 50)[0];
    assertFalse(first.equals(second));
  }

  @Test
  public void zeroNoiseReproducesTruth() {
    Simulation sim = Simulation.freeFall(10, 20, 3);
    RealVector[] observations = sim.simulate(Simulation.Noise.GAUSSIAN, 0);
    for (int i=0; i<observations.length; i++) assertEquals(sim.truth[i], observations[i]);
  }
}
