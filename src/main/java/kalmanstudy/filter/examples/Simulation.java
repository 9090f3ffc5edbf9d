package kalmanstudy.filter.examples;

import java.util.Random;
import java.util.function.DoubleUnaryOperator;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealVector;

/**
 * This class simulates noisy scalar measurements of a known signal,
 * sampled at evenly spaced times.
 *
 */
public class Simulation {

  public static enum Noise {
    GAUSSIAN, // zero mean, the amplitude is the standard deviation
    UNIFORM   // bounded, uniform in [-amplitude, amplitude]
  }

  public final Random random;

  public final DoubleUnaryOperator signal;

  public final double[]     times;
  public final RealVector[] truth;
  public RealVector[]       observations;

  public Simulation(int samples, double duration, DoubleUnaryOperator signal, long seed) {
    this.random = new Random(seed);
    this.signal = signal;

    times = new double[ samples ];
    truth = new RealVector[ samples ];

    for (int i=0; i<samples; i++) {
      times[i] = samples == 1 ? 0 : duration * i / (samples - 1);
      truth[i] = MatrixUtils.createRealVector(new double[] { signal.applyAsDouble(times[i]) });
    }
  }

  /**
   * A ball released at a height of 2000 meters, h(t) = 2000 - 9.81*t^2.
   */
  public static Simulation freeFall(int samples, double duration, long seed) {
    return new Simulation(samples, duration, (t) -> -1 * (9.81 * t * t - 2000), seed);
  }

  public double noise(Noise kind, double amplitude) {
    switch (kind) {
    case GAUSSIAN: return amplitude * random.nextGaussian();
    case UNIFORM:  return amplitude * (2 * random.nextDouble() - 1);
    default:       throw new IllegalArgumentException("unknown noise " + kind);
    }
  }

  /**
   * Generates a new set of observations; each call draws fresh noise.
   *
   * @param kind      the distribution of the noise
   * @param amplitude the scale of the noise
   * @return the observations, one per sample
   */
  public RealVector[] simulate(Noise kind, double amplitude) {
    observations = new RealVector[ truth.length ];
    for (int i=0; i<truth.length; i++) {
      observations[i] = truth[i].mapAdd( noise(kind, amplitude) );
    }
    return observations;
  }

  public int samples() { return truth.length; }
}
