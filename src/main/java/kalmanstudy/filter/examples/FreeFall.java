package kalmanstudy.filter.examples;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import kalmanstudy.filter.CovarianceMatrix;
import kalmanstudy.filter.JosephFormKalman;
import kalmanstudy.filter.RealCovarianceMatrix;

/**
 * Tracking the height of a ball falling from 2000 meters. The state is
 * (height, velocity, acceleration) and only the height is measured.
 *
 * Usage: FreeFall [noise ...]
 *
 * Each noise level is the standard deviation of Gaussian measurement
 * noise; the filter is restarted for each level.
 */
public class FreeFall {

  private final static Logger log = LogManager.getLogger();

  public static final double DT       = 1.0 / 60;
  public static final int    SAMPLES  = 100;
  public static final double DURATION = 20;  // seconds spanned by the samples

  public static final double DEFAULT_NOISE = 50;

  public static RealMatrix transition() {
    return MatrixUtils.createRealMatrix(new double[][] {
      { 1, DT,  0 },
      { 0,  1, DT },
      { 0,  0,  1 } });
  }

  public static RealMatrix observation() {
    return MatrixUtils.createRealMatrix(new double[][] {
      { 1, 0, 0 } });
  }

  /*
   * Hand tuned; correlated between height and velocity.
   */
  public static CovarianceMatrix processNoise() {
    return new RealCovarianceMatrix(new double[][] {
      { 0.05, 0.05, 0.0 },
      { 0.05, 0.05, 0.0 },
      { 0.0,  0.0,  0.0 } });
  }

  public static CovarianceMatrix measurementNoise() {
    return new RealCovarianceMatrix(new double[][] { { 0.5 } });
  }

  /**
   * Starts at rest at 2000 meters with an acceleration of 9.81.
   */
  public static RealVector initialState() {
    return MatrixUtils.createRealVector(new double[] { 2000, 0, 9.81 });
  }

  public static JosephFormKalman filter() {
    return new JosephFormKalman(transition(), observation(), processNoise(), measurementNoise(),
                                null, initialState(), null);
  }

  /**
   * The mean over all samples of the L1 distance between estimates and truth.
   */
  public static double meanAbsoluteError(List<RealVector> estimates, RealVector[] truth) {
    return meanAbsoluteError(estimates.toArray(new RealVector[0]), truth);
  }

  public static double meanAbsoluteError(RealVector[] estimates, RealVector[] truth) {
    if (estimates.length != truth.length || truth.length == 0)
      throw new IllegalArgumentException(String.format("cannot compare %d estimates with %d true values", estimates.length, truth.length));
    double sum = 0;
    for (int i=0; i<truth.length; i++) sum += estimates[i].getL1Distance(truth[i]);
    return sum / truth.length;
  }

  public static void main(String[] args) {
    double[] noises = new double[] { DEFAULT_NOISE };
    if (args.length > 0) {
      noises = new double[args.length];
      for (int i=0; i<args.length; i++) {
        try {
          noises[i] = Double.parseDouble(args[i]);
        } catch (NumberFormatException nfe) {
          log.error("noise level '{}' is not a number", args[i]);
          System.exit(1);
        }
      }
    }

    Simulation simulation = Simulation.freeFall(SAMPLES, DURATION, System.nanoTime());
    Tracker    tracker    = new Tracker(filter());

    for (double noise: noises) {
      tracker.restart();
      RealVector[] measurements = simulation.simulate(Simulation.Noise.GAUSSIAN, noise);

      List<RealVector> predictions = tracker.run(Arrays.asList(measurements),
          (step, predicted, corrected) -> log.printf(Level.DEBUG, "step %3d predicted height %9.2f", step, predicted.getEntry(0)));

      log.printf(Level.INFO, "noise %6.1f: measurement error %8.2f, prediction error %8.2f, %d corrections skipped",
                 noise,
                 meanAbsoluteError(measurements, simulation.truth),
                 meanAbsoluteError(predictions,  simulation.truth),
                 tracker.skipped());
    }
  }
}
