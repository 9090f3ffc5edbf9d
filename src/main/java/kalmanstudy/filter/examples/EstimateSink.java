package kalmanstudy.filter.examples;

import org.apache.commons.math3.linear.RealVector;

/**
 * Consumer of the estimates that a {@link Tracker} produces, one call per step.
 */
@FunctionalInterface
public interface EstimateSink {

  /**
   * @param step      index of the step, starting from 1
   * @param predicted the state predicted for this step, before the measurement
   * @param corrected the state after the measurement, or null if the correction was skipped
   */
  void accept(long step, RealVector predicted, RealVector corrected);

}
