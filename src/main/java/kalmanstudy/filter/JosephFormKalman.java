package kalmanstudy.filter;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Kalman filtering with the covariance update in Joseph form, which keeps
 * P symmetric positive semi-definite under rounding.
 */

public class JosephFormKalman implements KalmanFilter {

  private final static Logger log = LogManager.getLogger();

  public static final double DEFAULT_CONDITION_TOLERANCE = 1e-12;

  // model (constant)
  private final RealMatrix F, Ft, H, Ht, B, Q, R, I;
  private final CovarianceMatrix Qcov, Rcov, P0;
  private final RealVector x0;
  private final int n, m;

  // estimate (mutated by predict, update and reset)
  private RealVector x;
  private RealMatrix P;
  private Phase      phase;
  private long       steps;

  private double conditionTolerance = DEFAULT_CONDITION_TOLERANCE;

  public JosephFormKalman(RealMatrix F, RealMatrix H) {
    this(F, H, null, null, null, null, null);
  }

  public JosephFormKalman(RealMatrix F, RealMatrix H, CovarianceMatrix Q, CovarianceMatrix R) {
    this(F, H, Q, R, null, null, null);
  }

  /**
   * Creates a filter. Only F and H are mandatory; the other arguments may be
   * null, in which case
   *   Q  = I (n by n)
   *   R  = I (m by m)
   *   P  = I (n by n)
   *   x0 = 0
   *   B  = no control input
   *
   * @param F  state transition matrix, n by n
   * @param H  observation matrix, m by n
   * @param Q  covariance of the process noise, n by n
   * @param R  covariance of the measurement noise, m by m
   * @param P  initial covariance of the state, n by n
   * @param x0 initial state, dimension n
   * @param B  control input matrix, n by p
   * @throws InvalidModelException if F or H is missing or the dimensions are inconsistent
   */
  public JosephFormKalman(RealMatrix F, RealMatrix H, CovarianceMatrix Q, CovarianceMatrix R,
                          CovarianceMatrix P, RealVector x0, RealMatrix B) {
    if (F == null || H == null)
      throw new InvalidModelException("set proper system dynamics, F and H are required");
    if (!Matrix.isSquare(F))
      throw new InvalidModelException("F must be square, got " + Matrix.shape(F));
    if (!Matrix.isFinite(F) || !Matrix.isFinite(H))
      throw new InvalidModelException("F and H must have finite entries");

    n = F.getRowDimension();
    m = H.getRowDimension();

    if (H.getColumnDimension() != n)
      throw new InvalidModelException("H is " + Matrix.shape(H) + " but F is " + Matrix.shape(F)
                                      + "; H must have " + n + " columns");

    this.Qcov = (Q  == null) ? new DiagonalCovarianceMatrix(n, 1.0, DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES) : Q.copy();
    this.Rcov = (R  == null) ? new DiagonalCovarianceMatrix(m, 1.0, DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES) : R.copy();
    this.P0   = (P  == null) ? new DiagonalCovarianceMatrix(n, 1.0, DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES) : P.copy();
    this.x0   = (x0 == null) ? Matrix.zeros(n) : x0.copy();

    checkModelDimension("Q",  Qcov.dimension(),  n);
    checkModelDimension("R",  Rcov.dimension(),  m);
    checkModelDimension("P",  P0.dimension(),    n);
    checkModelDimension("x0", this.x0.getDimension(), n);
    if (!Matrix.isFinite(this.x0)) throw new InvalidModelException("x0 must have finite entries");

    if (B != null) {
      if (B.getRowDimension() != n)
        throw new InvalidModelException("B is " + Matrix.shape(B) + " but must have " + n + " rows");
      if (!Matrix.isFinite(B))
        throw new InvalidModelException("B must have finite entries");
    }

    this.F  = F.copy();
    this.Ft = F.transpose();
    this.H  = H.copy();
    this.Ht = H.transpose();
    this.B  = (B == null) ? null : B.copy();
    this.Q  = Qcov.get();
    this.R  = Rcov.get();
    this.I  = MatrixUtils.createRealIdentityMatrix(n);

    this.x     = this.x0.copy();
    this.P     = P0.get();
    this.phase = Phase.INITIALIZED;
    this.steps = 0;

    log.debug("created filter with n={} m={} p={}", n, m, controlDimension());
  }

  private static void checkModelDimension(String name, int actual, int expected) {
    if (actual != expected)
      throw new InvalidModelException(String.format("%s has dimension %d, expected %d", name, actual, expected));
  }

  @Override
  public int stateDimension()       { return n; }

  @Override
  public int measurementDimension() { return m; }

  @Override
  public int controlDimension()     { return B == null ? 0 : B.getColumnDimension(); }

  public double conditionTolerance() { return conditionTolerance; }

  /**
   * Sets the smallest inverse condition number of S that update() accepts.
   *
   * @param tolerance a non-negative number; 0 rejects only exactly singular S
   */
  public void setConditionTolerance(double tolerance) {
    if (!(tolerance >= 0)) throw new NumberIsTooSmallException(tolerance, 0, true);
    this.conditionTolerance = tolerance;
  }

  @Override
  public RealVector predict(RealVector u) throws DimensionMismatchException, NotFiniteNumberException {
    if (u != null && u.getDimension() != controlDimension())
      throw new DimensionMismatchException(u.getDimension(), controlDimension());
    if (u != null) checkFinite(u);

    RealVector xp = F.operate(x);
    if (u != null && B != null) xp = xp.add(B.operate(u));

    RealMatrix Pp = F.multiply(P).multiply(Ft).add(Q);

    x = xp;
    P = Pp;
    phase = Phase.PREDICTED;
    steps++;

    if (log.isTraceEnabled())
      log.printf(Level.TRACE, "predict %d x=%s", steps, Matrix.toString(x, "%.3e"));

    return x.copy();
  }

  @Override
  public void update(RealVector z) throws DimensionMismatchException, NotFiniteNumberException, SingularInnovationCovarianceException {
    if (z.getDimension() != m) throw new DimensionMismatchException(z.getDimension(), m);
    checkFinite(z);

    RealVector y   = z.subtract(H.operate(x));
    RealMatrix PHt = P.multiply(Ht);
    RealMatrix S   = H.multiply(PHt).add(R);
    RealMatrix K   = PHt.multiply(invert(S));

    RealVector xc  = x.add(K.operate(y));

    RealMatrix IKH = I.subtract(K.multiply(H));
    RealMatrix Pc  = IKH.multiply(P).multiply(IKH.transpose())
                        .add(K.multiply(R).multiply(K.transpose()));

    x = xc;
    P = Pc;
    phase = Phase.CORRECTED;

    if (log.isTraceEnabled())
      log.printf(Level.TRACE, "update %d y=%s x=%s", steps, Matrix.toString(y, "%.3e"), Matrix.toString(x, "%.3e"));
  }

  private static void checkFinite(RealVector v) throws NotFiniteNumberException {
    for (int i=0; i<v.getDimension(); i++)
      if (!Double.isFinite(v.getEntry(i))) throw new NotFiniteNumberException(v.getEntry(i));
  }

  /*
   * Inverts S after checking that it is well conditioned.
   */
  private RealMatrix invert(RealMatrix S) {
    if (!Matrix.isFinite(S))
      throw new SingularInnovationCovarianceException(Double.NaN, conditionTolerance, steps);
    if (S.getNorm() == 0)
      throw new SingularInnovationCovarianceException(0, conditionTolerance, steps);

    SingularValueDecomposition svd = new SingularValueDecomposition(S);
    double rcond = svd.getInverseConditionNumber();
    if (!(rcond > conditionTolerance)) {
      log.debug("S={} rejected, inverse condition number {}", Matrix.toString(S, "%.3e"), rcond);
      throw new SingularInnovationCovarianceException(rcond, conditionTolerance, steps);
    }
    return svd.getSolver().getInverse();
  }

  @Override
  public void reset() {
    x     = x0.copy();
    P     = P0.get();
    phase = Phase.INITIALIZED;
    steps = 0;
    log.debug("reset to the initial state");
  }

  @Override
  public void reset(RealVector x0, CovarianceMatrix P0) throws DimensionMismatchException {
    if (x0.getDimension() != n) throw new DimensionMismatchException(x0.getDimension(), n);
    if (P0.dimension()    != n) throw new DimensionMismatchException(P0.dimension(),    n);
    if (!Matrix.isFinite(x0))   throw new InvalidModelException("x0 must have finite entries");

    x     = x0.copy();
    P     = P0.get();
    phase = Phase.INITIALIZED;
    steps = 0;
    if (log.isDebugEnabled())
      log.debug("reset to x={}", Matrix.toString(x, "%.3e"));
  }

  @Override
  public RealVector state()                { return x.copy(); }

  @Override
  public RealMatrix covariance()           { return P.copy(); }

  @Override
  public RealVector predictedMeasurement() { return H.operate(x); }

  @Override
  public Phase phase()                     { return phase; }

  @Override
  public long steps()                      { return steps; }

  public CovarianceMatrix processNoise()     { return Qcov.copy(); }

  public CovarianceMatrix measurementNoise() { return Rcov.copy(); }

  @Override
  public JosephFormKalman withMeasurementNoise(CovarianceMatrix noise) throws InvalidModelException {
    if (noise == null) throw new InvalidModelException("measurement noise is missing");
    JosephFormKalman retuned = new JosephFormKalman(F, H, Qcov, noise, P0, x0, B);
    retuned.conditionTolerance = conditionTolerance;
    return retuned;
  }

  @Override
  public JosephFormKalman copy() {
    JosephFormKalman copy = new JosephFormKalman(F, H, Qcov, Rcov, P0, x0, B);
    copy.conditionTolerance = conditionTolerance;
    copy.x     = x.copy();
    copy.P     = P.copy();
    copy.phase = phase;
    copy.steps = steps;
    return copy;
  }

  @Override
  public String toString() {
    return String.format("JosephFormKalman(n=%d, m=%d, phase=%s, steps=%d, x=%s)",
                         n, m, phase, steps, Matrix.toString(x, "%.3e"));
  }

}
