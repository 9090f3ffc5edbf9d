package kalmanstudy.filter;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A general (full) covariance matrix.
 */
public class RealCovarianceMatrix implements CovarianceMatrix {

  public static enum Representation {
    COVARIANCE_MATRIX, // covariance matrix C
    FACTOR             // L such that C = L*L'
  }

  /*
   * Relative to the largest entry of C (or 1, if larger).
   */
  public static final double SYMMETRY_TOLERANCE     = 1e-9;
  public static final double DEFINITENESS_TOLERANCE = 1e-9;

  private final RealMatrix C;

  public int dimension() { return C.getColumnDimension(); }

  public RealCovarianceMatrix copy() {
    return new RealCovarianceMatrix(C, Representation.COVARIANCE_MATRIX);
  }

  public RealCovarianceMatrix(double[][] v) {
    this(v == null ? null : MatrixUtils.createRealMatrix(v), Representation.COVARIANCE_MATRIX);
  }

  public RealCovarianceMatrix(RealMatrix v) {
    this(v, Representation.COVARIANCE_MATRIX);
  }

  public RealCovarianceMatrix(RealMatrix v, Representation rep) {
    if (v == null)            throw new InvalidModelException("covariance matrix is missing");
    if (!Matrix.isFinite(v))  throw new InvalidModelException("covariance matrix has non-finite entries");

    switch (rep) {
    case COVARIANCE_MATRIX:
      if (!Matrix.isSquare(v)) 
        throw new InvalidModelException("covariance matrix must be square, got " + Matrix.shape(v));
      if (!Matrix.isSymmetric(v, SYMMETRY_TOLERANCE))
        throw new InvalidModelException(String.format("covariance matrix is not symmetric (asymmetry %.2e)", Matrix.asymmetry(v)));
      double mev = Matrix.minEigenvalue(v);
      if (mev < -DEFINITENESS_TOLERANCE * Matrix.scale(v))
        throw new InvalidModelException(String.format("covariance matrix is not positive semi-definite (smallest eigenvalue %.2e)", mev));
      C = Matrix.symmetrize(v);
      break;
    case FACTOR:
      C = v.multiply(v.transpose());
      break;
    default:
      throw new IllegalArgumentException("unknown representation " + rep);
    }
  }

  @Override
  public RealMatrix get() {
    return C.copy();
  }

  @Override
  public String toString() { return "C=" + Matrix.toString(C, "%.3e"); }

}
