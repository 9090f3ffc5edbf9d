package kalmanstudy.filter;

import java.util.Arrays;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Static helpers on Commons Math matrices that the filter and the
 * covariance representations share.
 */
public class Matrix {

  private Matrix() {}

  public static RealMatrix zeros(int rows, int cols) {
    return MatrixUtils.createRealMatrix(rows, cols);
  }

  public static RealVector zeros(int dim) {
    return MatrixUtils.createRealVector(new double[dim]);
  }

  public static boolean isSquare(RealMatrix A) {
    return A.getRowDimension() == A.getColumnDimension();
  }

  public static boolean isFinite(RealMatrix A) {
    for (int i=0; i<A.getRowDimension(); i++)
      for (int j=0; j<A.getColumnDimension(); j++)
        if (!Double.isFinite(A.getEntry(i, j))) return false;
    return true;
  }

  public static boolean isFinite(RealVector v) {
    for (int i=0; i<v.getDimension(); i++)
      if (!Double.isFinite(v.getEntry(i))) return false;
    return true;
  }

  /**
   * Largest absolute value of an entry, never less than 1, so that it can
   * scale an absolute tolerance into a relative one.
   */
  public static double scale(RealMatrix A) {
    double max = 1.0;
    for (int i=0; i<A.getRowDimension(); i++)
      for (int j=0; j<A.getColumnDimension(); j++)
        max = Math.max(max, Math.abs(A.getEntry(i, j)));
    return max;
  }

  /**
   * The largest absolute difference between A and its transpose.
   */
  public static double asymmetry(RealMatrix A) {
    double max = 0;
    for (int i=0; i<A.getRowDimension(); i++)
      for (int j=i+1; j<A.getColumnDimension(); j++)
        max = Math.max(max, Math.abs(A.getEntry(i, j) - A.getEntry(j, i)));
    return max;
  }

  public static boolean isSymmetric(RealMatrix A, double tolerance) {
    return isSquare(A) && asymmetry(A) <= tolerance * scale(A);
  }

  /**
   * Returns (A+A')/2.
   */
  public static RealMatrix symmetrize(RealMatrix A) {
    return A.add(A.transpose()).scalarMultiply(0.5);
  }

  /**
   * The smallest eigenvalue of the symmetric part of A.
   *
   * @param A a square matrix
   * @return the smallest eigenvalue of (A+A')/2
   */
  public static double minEigenvalue(RealMatrix A) {
    EigenDecomposition eig = new EigenDecomposition(symmetrize(A));
    return Arrays.stream(eig.getRealEigenvalues()).min().getAsDouble();
  }

  public static String toString(RealVector v, String format) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int i=0; i<v.getDimension(); i++) {
      if (i > 0) s.append(' ');
      s.append(String.format(format, v.getEntry(i)));
    }
    s.append(']');
    return s.toString();
  }

  public static String toString(RealMatrix A, String format) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int d=0; d<A.getRowDimension(); d++) {
      s.append('[');
      for (int i=0; i<A.getColumnDimension(); i++) {
        if (i > 0) s.append(' ');
        s.append(String.format(format, A.getEntry(d, i)));
      }
      s.append(']');
    }
    s.append(']');
    return s.toString();
  }

  public static String shape(RealMatrix A) {
    return A.getRowDimension() + "x" + A.getColumnDimension();
  }
}
