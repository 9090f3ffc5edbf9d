package kalmanstudy.filter;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.util.LocalizedFormats;

/**
 * Thrown when the model of a filter is missing a mandatory matrix, when
 * its matrices have inconsistent dimensions, or when a covariance matrix
 * is not symmetric positive semi-definite.
 */
public class InvalidModelException extends MathIllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidModelException(String message) {
    super(LocalizedFormats.SIMPLE_MESSAGE, message);
  }

}
