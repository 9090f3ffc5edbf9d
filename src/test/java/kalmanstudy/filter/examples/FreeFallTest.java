package kalmanstudy.filter.examples;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

import kalmanstudy.filter.JosephFormKalman;

public class FreeFallTest {

  @Test
  public void model() {
    JosephFormKalman kf = FreeFall.filter();
    assertEquals(3, kf.stateDimension());
    assertEquals(1, kf.measurementDimension());
    assertEquals(0, kf.controlDimension());
    assertEquals(1.0 / 60, FreeFall.transition().getEntry(0, 1), 0);
    assertEquals(0.5, kf.measurementNoise().variance(0), 0);
  }

  @Test
  public void predictionsAreCloserToTruthThanMeasurements() {
    Simulation sim = Simulation.freeFall(FreeFall.SAMPLES, FreeFall.DURATION, 69978);
    RealVector[] measurements = sim.simulate(Simulation.Noise.UNIFORM, 300);

    Tracker tracker = new Tracker(FreeFall.filter());
    List<RealVector> predictions = tracker.run(measurements);

    double measurementError = FreeFall.meanAbsoluteError(measurements, sim.truth);
    double predictionError  = FreeFall.meanAbsoluteError(predictions,  sim.truth);

    assertEquals(FreeFall.SAMPLES, predictions.size());
    assertTrue(String.format("prediction error %.2f, measurement error %.2f", predictionError, measurementError),
               predictionError < measurementError);
  }

  @Test
  public void meanAbsoluteError() {
    RealVector[] a = { MatrixUtils.createRealVector(new double[] { 1 }), MatrixUtils.createRealVector(new double[] { 5 }) };
    RealVector[] b = { MatrixUtils.createRealVector(new double[] { 2 }), MatrixUtils.createRealVector(new double[] { 2 }) };
    assertEquals(2, FreeFall.meanAbsoluteError(a, b), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void meanAbsoluteErrorNeedsMatchingLengths() {
    FreeFall.meanAbsoluteError(new RealVector[1], new RealVector[2]);
  }
}
