package kalmanstudy.filter;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Representation of a covariance matrix C.
 * 
 * Implementations validate their input on construction, so a filter
 * can rely on C being symmetric positive semi-definite.
 */

public interface CovarianceMatrix {
  /**
   * Returns the dimension of this square matrix.
   * 
   * @return the dimension of C
   */
  public int dimension();

  /**
   * Returns an explicit representation of C. The returned matrix
   * is freshly allocated; mutating it does not affect this object.
   * 
   * @return an explicit representation of C.
   */
  public RealMatrix get();

  /**
   * Returns a copy of C.
   * 
   * @return a copy of C
   */
  public CovarianceMatrix copy();

  /**
   * Returns the variance of element i, the i'th diagonal entry of C.
   * 
   * @param i index of the element
   * @return C(i,i)
   */
  public default double variance(int i) {
    return get().getEntry(i, i);
  }
}
