package kalmanstudy.filter;

import java.util.Arrays;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A covariance matrix of uncorrelated elements.
 */
public class DiagonalCovarianceMatrix implements CovarianceMatrix {

  public static enum Representation {
    DIAGONAL_VARIANCES,
    DIAGONAL_STANDARD_DEVIATIONS,
  }

  private final RealVector variances;

  public int dimension() {
    return variances.getDimension();
  }

  public DiagonalCovarianceMatrix copy() {
    return new DiagonalCovarianceMatrix(variances, Representation.DIAGONAL_VARIANCES);
  }

  public DiagonalCovarianceMatrix(RealVector variances) {
    this(variances, DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES);
  }

  public DiagonalCovarianceMatrix(double[] v, DiagonalCovarianceMatrix.Representation rep) {
    this(MatrixUtils.createRealVector(v), rep);
  }

  /**
   * An isotropic covariance matrix, value*I in the given representation.
   */
  public DiagonalCovarianceMatrix(int dimension, double value, DiagonalCovarianceMatrix.Representation rep) {
    this(filled(dimension, value), rep);
  }

  public DiagonalCovarianceMatrix(RealVector v, DiagonalCovarianceMatrix.Representation rep) {
    if (v == null) throw new InvalidModelException("covariance matrix is missing");
    for (int i=0; i<v.getDimension(); i++) {
      double v_i = v.getEntry(i);
      if (!Double.isFinite(v_i) || v_i < 0)
        throw new InvalidModelException(String.format("diagonal covariance entry %d is %s, must be finite and non-negative", i, v_i));
    }
    switch (rep) {
    case DIAGONAL_VARIANCES:
      variances = v.copy();
      break;
    case DIAGONAL_STANDARD_DEVIATIONS:
      variances = v.map( (v_i) -> (v_i*v_i) );
      break;
    default:
      throw new IllegalArgumentException("unknown representation " + rep);
    }
  }

  private static RealVector filled(int dimension, double value) {
    double[] a = new double[dimension];
    Arrays.fill(a, value);
    return MatrixUtils.createRealVector(a);
  }

  @Override
  public RealMatrix get() {
    return MatrixUtils.createRealDiagonalMatrix(variances.toArray());
  }

  @Override
  public double variance(int i) {
    return variances.getEntry(i);
  }

  @Override
  public String toString() { return String.format("DiagonalCovarianceMatrix(variances=%s)",Arrays.toString(variances.toArray())); };

}
