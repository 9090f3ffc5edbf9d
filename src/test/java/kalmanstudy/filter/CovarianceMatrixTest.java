package kalmanstudy.filter;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

public class CovarianceMatrixTest {

  @Test
  public void diagonalFromStandardDeviations() {
    DiagonalCovarianceMatrix C = new DiagonalCovarianceMatrix(new double[] { 2, 3 },
        DiagonalCovarianceMatrix.Representation.DIAGONAL_STANDARD_DEVIATIONS);
    assertEquals(2, C.dimension());
    assertEquals(4, C.variance(0), 0);
    assertEquals(9, C.variance(1), 0);
    assertArrayEquals(new double[] { 4, 0 }, C.get().getRow(0), 0);
    assertArrayEquals(new double[] { 0, 9 }, C.get().getRow(1), 0);
  }

  @Test
  public void isotropicDiagonal() {
    DiagonalCovarianceMatrix C = new DiagonalCovarianceMatrix(3, 0.5,
        DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES);
    assertEquals(MatrixUtils.createRealIdentityMatrix(3).scalarMultiply(0.5), C.get());
  }

  @Test
  public void diagonalRejectsNegativeAndNonFiniteEntries() {
    try {
      new DiagonalCovarianceMatrix(MatrixUtils.createRealVector(new double[] { 1, -1 }));
      fail("negative variance");
    } catch (InvalidModelException expected) {}
    try {
      new DiagonalCovarianceMatrix(MatrixUtils.createRealVector(new double[] { Double.NaN }));
      fail("NaN variance");
    } catch (InvalidModelException expected) {}
    try {
      new DiagonalCovarianceMatrix(new double[] { Double.POSITIVE_INFINITY },
          DiagonalCovarianceMatrix.Representation.DIAGONAL_STANDARD_DEVIATIONS);
      fail("infinite standard deviation");
    } catch (InvalidModelException expected) {}
  }

  @Test
  public void fullAcceptsSingularPositiveSemiDefinite() {
    RealCovarianceMatrix Q = new RealCovarianceMatrix(new double[][] {
      { 0.05, 0.05, 0.0 },
      { 0.05, 0.05, 0.0 },
      { 0.0,  0.0,  0.0 } });
    assertEquals(3, Q.dimension());
    assertEquals(0.05, Q.variance(1), 0);
    assertEquals(0.05, Q.get().getEntry(0, 1), 0);
  }

  @Test(expected = InvalidModelException.class)
  public void fullRejectsAsymmetric() {
    new RealCovarianceMatrix(new double[][] {
      { 1, 0.5 },
      { 0,   1 } });
  }

  @Test(expected = InvalidModelException.class)
  public void fullRejectsIndefinite() {
    new RealCovarianceMatrix(new double[][] {
      { 1, 2 },
      { 2, 1 } });
  }

  @Test(expected = InvalidModelException.class)
  public void fullRejectsNonSquare() {
    new RealCovarianceMatrix(new double[][] {
      { 1, 0, 0 },
      { 0, 1, 0 } });
  }

  @Test(expected = InvalidModelException.class)
  public void fullRejectsMissingMatrix() {
    new RealCovarianceMatrix((RealMatrix) null);
  }

  @Test
  public void fullFromFactor() {
    RealMatrix L = MatrixUtils.createRealMatrix(new double[][] {
      { 2, 0 },
      { 1, 1 } });
    RealCovarianceMatrix C = new RealCovarianceMatrix(L, RealCovarianceMatrix.Representation.FACTOR);
    assertArrayEquals(new double[] { 4, 2 }, C.get().getRow(0), 0);
    assertArrayEquals(new double[] { 2, 2 }, C.get().getRow(1), 0);
  }

  @Test
  public void getReturnsCopies() {
    RealMatrix A = MatrixUtils.createRealMatrix(new double[][] {
      { 2, 1 },
      { 1, 2 } });
    RealCovarianceMatrix C = new RealCovarianceMatrix(A);
    A.setEntry(0, 0, 100);
    C.get().setEntry(0, 0, 100);
    assertEquals(2, C.get().getEntry(0, 0), 0);

    CovarianceMatrix copy = C.copy();
    assertEquals(C.get(), copy.get());
  }
}
