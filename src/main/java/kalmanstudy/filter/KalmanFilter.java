package kalmanstudy.filter;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 *
 * A discrete-time linear Kalman filter.
 *
 * The model is
 *
 *   x_k = F*x_{k-1} + B*u_k + w_k,   w_k ~ N(0,Q)
 *   z_k = H*x_k + v_k,               v_k ~ N(0,R)
 *
 * Each step is processed by calling two methods in a particular order:
 *   predict
 *   update
 *
 * Calling predict twice in a row is legal; it models a step with no
 * measurement and simply compounds the growth of the covariance.
 * Calling update twice in a row corrects the same prior twice.
 *
 * Implementations own their state vector and covariance matrix; all the
 * methods that return them return copies. Instances are not thread safe,
 * but independent instances share no state.
 *
 */
public interface KalmanFilter {

  public static enum Phase {
    INITIALIZED,
    PREDICTED,
    CORRECTED
  }

  /**
   * Dimension n of the state vector.
   *
   * @return n
   */
  int stateDimension();

  /**
   * Dimension m of the measurement vector.
   *
   * @return m
   */
  int measurementDimension();

  /**
   * Dimension p of the control vector, 0 if the model has no control input matrix B.
   *
   * @return p
   */
  int controlDimension();

  /**
   * Advances the state and its covariance by one step, with no control input.
   *
   *   x = F*x
   *   P = F*P*F' + Q
   *
   * @return a copy of the predicted state vector
   */
  default public RealVector predict() {
    return predict(null);
  }

  /**
   * Advances the state and its covariance by one step.
   *
   *   x = F*x + B*u
   *   P = F*P*F' + Q
   *
   * @param u the control vector, or null for no control input
   * @return a copy of the predicted state vector
   * @throws DimensionMismatchException if u is not null and its dimension differs from
   *         {@link #controlDimension()}
   * @throws NotFiniteNumberException if u has a NaN or infinite entry
   */
  RealVector predict(RealVector u) throws DimensionMismatchException, NotFiniteNumberException;

  /**
   * Corrects the state and its covariance using a measurement z.
   *
   *   y = z - H*x
   *   S = R + H*P*H'
   *   K = P*H'*inv(S)
   *   x = x + K*y
   *   P = (I-K*H)*P*(I-K*H)' + K*R*K'
   *
   * If the method throws, the state and covariance are left unchanged.
   *
   * @param z the measurement vector
   * @throws DimensionMismatchException if the dimension of z differs from {@link #measurementDimension()}
   * @throws NotFiniteNumberException if z has a NaN or infinite entry
   * @throws SingularInnovationCovarianceException if S cannot be inverted reliably
   */
  void update(RealVector z) throws DimensionMismatchException, NotFiniteNumberException, SingularInnovationCovarianceException;

  /**
   * A simplified version that takes the measurement as an array.
   *
   * @param z the measurement
   */
  default public void update(double... z) {
    update(MatrixUtils.createRealVector(z));
  }

  /**
   * Returns to the initial state and covariance given at construction.
   */
  void reset();

  /**
   * Replaces the state and its covariance.
   *
   * @param x0 the new state vector
   * @param P0 the new covariance of the state
   * @throws DimensionMismatchException if the dimension of x0 or P0 is not {@link #stateDimension()}
   * @throws InvalidModelException if x0 has a NaN or infinite entry
   */
  void reset(RealVector x0, CovarianceMatrix P0) throws DimensionMismatchException, InvalidModelException;

  /**
   * @return a copy of the current state vector x
   */
  RealVector state();

  /**
   * @return a copy of the current covariance matrix P of the state
   */
  RealMatrix covariance();

  /**
   * The measurement that the current state predicts, H*x.
   *
   * @return H*x
   */
  RealVector predictedMeasurement();

  /**
   * Whether the last operation was a prediction or a correction.
   *
   * @return the phase of the current step
   */
  Phase phase();

  /**
   * The number of times predict has been called since construction or the last reset.
   *
   * @return the index of the current step
   */
  long steps();

  /**
   * Creates a filter with the same model and a different measurement noise.
   * The new filter starts from the initial state and covariance given at construction.
   *
   * @param noise the covariance of the measurement noise
   * @return a new filter
   * @throws InvalidModelException if the noise is null or its dimension is not {@link #measurementDimension()}
   */
  KalmanFilter withMeasurementNoise(CovarianceMatrix noise) throws InvalidModelException;

  /**
   *
   * @return a copy of the object.
   */
  KalmanFilter copy();

}
