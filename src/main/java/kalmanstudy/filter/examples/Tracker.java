package kalmanstudy.filter.examples;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import kalmanstudy.filter.CovarianceMatrix;
import kalmanstudy.filter.KalmanFilter;
import kalmanstudy.filter.SingularInnovationCovarianceException;

/**
 * Feeds a sequence of measurements through a filter, one predict/update
 * cycle per measurement.
 *
 * A cycle whose correction fails because the innovation covariance is
 * singular keeps the predicted state and moves on.
 */
public class Tracker {

  private final static Logger log = LogManager.getLogger();

  private KalmanFilter filter;
  private long         skipped = 0;

  public Tracker(KalmanFilter filter) {
    this.filter = filter;
  }

  public KalmanFilter filter() { return filter; }

  /**
   * @return the number of corrections skipped since construction, the last restart or the last retune
   */
  public long skipped() { return skipped; }

  public List<RealVector> run(RealVector[] measurements) {
    return run(Arrays.asList(measurements), null);
  }

  /**
   * Runs one cycle per measurement.
   *
   * @param measurements the measurements, in order
   * @param sink receives the estimates of every cycle; may be null
   * @return the measurement predicted by the filter (H*x after predict) in every cycle
   */
  public List<RealVector> run(Iterable<RealVector> measurements, EstimateSink sink) {
    List<RealVector> predictions = new ArrayList<>();
    for (RealVector z: measurements) {
      RealVector predicted = filter.predict();
      predictions.add(filter.predictedMeasurement());

      RealVector corrected;
      try {
        filter.update(z);
        corrected = filter.state();
      } catch (SingularInnovationCovarianceException sice) {
        skipped++;
        log.warn("holding the prediction of step {}: {}", sice.getStep(), sice.getMessage());
        corrected = null;
      }

      if (sink != null) sink.accept(filter.steps(), predicted, corrected);
    }
    return predictions;
  }

  /**
   * Returns the filter to its initial state.
   */
  public void restart() {
    filter.reset();
    skipped = 0;
  }

  /**
   * Replaces the filter by one with a different measurement noise, starting
   * from the initial state.
   *
   * @param noise the covariance of the measurement noise
   */
  public void retune(CovarianceMatrix noise) {
    filter  = filter.withMeasurementNoise(noise);
    skipped = 0;
    log.debug("retuned measurement noise to {}", noise);
  }
}
