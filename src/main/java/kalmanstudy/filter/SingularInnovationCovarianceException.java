package kalmanstudy.filter;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.util.LocalizedFormats;

/**
 * Thrown by {@link KalmanFilter#update} when the innovation covariance 
 * S = R + H*P*H' is singular or too ill-conditioned to invert.
 * 
 * The filter is left in its predicted state, so a caller can skip the
 * correction for this step or retune the measurement noise.
 */
public class SingularInnovationCovarianceException extends MathArithmeticException {

  private static final long serialVersionUID = 1L;

  private final double inverseConditionNumber;
  private final long   step;

  public SingularInnovationCovarianceException(double inverseConditionNumber, double tolerance, long step) {
    super(LocalizedFormats.SIMPLE_MESSAGE,
          String.format("innovation covariance is singular in step %d (inverse condition number %.3e, tolerance %.3e)",
                        step, inverseConditionNumber, tolerance));
    this.inverseConditionNumber = inverseConditionNumber;
    this.step                   = step;
  }

  /**
   * @return the ratio of the smallest to the largest singular value of S, NaN if S was not finite
   */
  public double getInverseConditionNumber() { return inverseConditionNumber; }

  /**
   * @return the index of the step whose update failed
   */
  public long getStep() { return step; }

}
