// ******************************************************************************
//
// Title:       Diffraction Geometry X.
// Description: Diffraction Geometry X - Scan-Varying Geometry Refinement.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of Diffraction Geometry X.
//
// Diffraction Geometry X is free software; you can redistribute it and/or
// modify it under the terms of the GNU General Public License version 3 as
// published by the Free Software Foundation.
//
// Diffraction Geometry X is distributed in the hope that it will be useful, but
// WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
// FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Diffraction Geometry X; if not, write to the Free Software Foundation, Inc.,
// 59 Temple Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package dgx.refinement.parameterisation;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The GaussianSmoother distributes checkpoints over a range of scan coordinates and interpolates a
 * {@link ScanVaryingParameterSet} at any coordinate as the Gaussian weighted mean of the
 * checkpoint values in a window around it.
 * <p>
 * Coordinates are normalized so that one sample interval has unit length. For more than 3
 * checkpoints the first checkpoint sits half an interval before the start of the range and the last
 * half an interval after its end. Only the numAverage checkpoints nearest to a query contribute,
 * except that a window reaching the first or last checkpoint is widened to span at least 2
 * checkpoints.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GaussianSmoother {

  private static final Logger logger = Logger.getLogger(GaussianSmoother.class.getName());

  /** Default number of checkpoints averaged. */
  public static final int DEFAULT_NUM_AVERAGE = 3;
  /** Default width of one sample interval, in scan coordinate units (e.g. degrees). */
  public static final double DEFAULT_INTERVAL_WIDTH = 36.0;

  private final double coordinateOrigin;
  private final int numIntervals;
  private final int numCheckpoints;
  private final double spacing;
  private final double[] positions;
  private int numAverage;
  private double halfAverage;
  private double sigma;

  /**
   * Constructor for GaussianSmoother. The smoothing defaults to 3 averaged checkpoints with the
   * matching default sigma.
   *
   * @param start first scan coordinate of the range.
   * @param end last scan coordinate of the range.
   * @param numIntervals number of sample intervals the range is divided into.
   * @throws IllegalArgumentException if numIntervals is not positive or the range is empty.
   */
  public GaussianSmoother(double start, double end, int numIntervals) {
    if (numIntervals <= 0) {
      throw new IllegalArgumentException(
          format(" The number of smoother intervals must be positive (%d).", numIntervals));
    }
    if (!Double.isFinite(start) || !Double.isFinite(end) || !(end > start)) {
      throw new IllegalArgumentException(
          format(" Invalid smoother range (%10.4f, %10.4f).", start, end));
    }
    coordinateOrigin = start;
    this.numIntervals = numIntervals;
    spacing = (end - start) / numIntervals;

    if (numIntervals == 1) {
      numCheckpoints = 2;
    } else if (numIntervals == 2) {
      numCheckpoints = 3;
    } else {
      numCheckpoints = numIntervals + 2;
    }

    if (numCheckpoints == 2) {
      positions = new double[] {1.0, 2.0};
    } else if (numCheckpoints == 3) {
      positions = new double[] {0.0, 1.0, 2.0};
    } else {
      positions = new double[numCheckpoints];
      for (int i = 0; i < numCheckpoints; i++) {
        positions[i] = i - 0.5;
      }
    }

    setSmoothing(DEFAULT_NUM_AVERAGE, -1.0);
  }

  /**
   * Constructor for GaussianSmoother.
   *
   * @param range the first and last scan coordinates.
   * @param numIntervals number of sample intervals the range is divided into.
   */
  public GaussianSmoother(double[] range, int numIntervals) {
    this(range[0], range[1], numIntervals);
  }

  /**
   * Create a GaussianSmoother for a scan range from the following properties:
   * <p>
   * scan-varying-intervals: number of sample intervals (default -1, derive from the width).
   * <p>
   * scan-varying-interval-width: width of one interval in scan coordinate units (default 36.0).
   * <p>
   * scan-varying-num-average: number of checkpoints averaged (default 3).
   * <p>
   * scan-varying-sigma: Gaussian width, negative for the default (default -1.0).
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @param start first scan coordinate of the range.
   * @param end last scan coordinate of the range.
   * @return a configured {@link GaussianSmoother}.
   */
  public static GaussianSmoother checkProperties(CompositeConfiguration properties,
      double start, double end) {
    int intervals = properties.getInt("scan-varying-intervals", -1);
    double width = properties.getDouble("scan-varying-interval-width", DEFAULT_INTERVAL_WIDTH);
    int nAverage = properties.getInt("scan-varying-num-average", DEFAULT_NUM_AVERAGE);
    double sigma = properties.getDouble("scan-varying-sigma", -1.0);

    if (intervals <= 0) {
      if (!(width > 0.0)) {
        throw new IllegalArgumentException(
            format(" The scan-varying interval width must be positive (%10.4f).", width));
      }
      intervals = max(1, (int) ceil(abs(end - start) / width));
    }

    GaussianSmoother smoother = new GaussianSmoother(start, end, intervals);
    smoother.setSmoothing(nAverage, sigma);

    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder();
      sb.append("\n Scan-Varying Smoother Settings\n\n");
      sb.append(format("  Scan range:                          (%8.3f, %8.3f)\n", start, end));
      sb.append("  Sample intervals:                    ").append(smoother.numIntervals).append("\n");
      sb.append("  Checkpoints:                         ").append(smoother.numCheckpoints).append("\n");
      sb.append(format("  Checkpoint spacing:                  %8.3f\n", smoother.spacing));
      sb.append("  Checkpoints averaged:                ").append(smoother.numAverage).append("\n");
      sb.append(format("  Gaussian sigma:                      %8.3f\n", smoother.sigma));
      logger.info(sb.toString());
    }
    return smoother;
  }

  /**
   * Set the smoothing values.
   *
   * @param numAverage number of checkpoints included in each interpolation, in [1, 5]. Values
   *     larger than the number of checkpoints are reduced to the number of checkpoints.
   * @param sigma width of the Gaussian in normalized coordinates. If negative, a suitable value
   *     is derived from numAverage: 0.65, 0.7, 0.75 and 0.8 for 2, 3, 4 and 5 checkpoints.
   * @throws IllegalArgumentException if numAverage is outside [1, 5].
   */
  public final void setSmoothing(int numAverage, double sigma) {
    if (numAverage < 1 || numAverage > 5) {
      throw new IllegalArgumentException(
          format(" The number of checkpoints averaged must be between 1 and 5 (%d).", numAverage));
    }
    this.numAverage = min(numAverage, numCheckpoints);
    halfAverage = this.numAverage / 2.0;
    if (sigma < 0.0) {
      this.sigma = 0.65 + 0.05 * (this.numAverage - 2);
    } else {
      this.sigma = sigma;
    }
  }

  /**
   * Interpolate a parameter set at a scan coordinate.
   *
   * @param x the unnormalized scan coordinate.
   * @param parameterSet the checkpoint values.
   * @return a new {@link ValueWeight}.
   */
  public ValueWeight valueWeight(double x, ScanVaryingParameterSet parameterSet) {
    return valueWeight(x, parameterSet, new ValueWeight(numCheckpoints));
  }

  /**
   * Interpolate a parameter set at a scan coordinate, writing into an existing result.
   *
   * @param x the unnormalized scan coordinate.
   * @param parameterSet the checkpoint values.
   * @param result the ValueWeight to fill; its size must equal the number of checkpoints.
   * @return the result.
   * @throws LengthMismatchException if the parameter set or result does not match the number
   *     of checkpoints.
   */
  public ValueWeight valueWeight(double x, ScanVaryingParameterSet parameterSet,
      ValueWeight result) {
    if (parameterSet.size() != numCheckpoints) {
      throw new LengthMismatchException(parameterSet.getNameStem() + " smoothing",
          numCheckpoints, parameterSet.size());
    }
    if (result.size() != numCheckpoints) {
      throw new LengthMismatchException("Smoothing weights", numCheckpoints, result.size());
    }

    double z = (x - coordinateOrigin) / spacing;

    int i1;
    int i2;
    if (numCheckpoints <= 3) {
      i1 = 0;
      i2 = numCheckpoints;
    } else {
      // The nearest numAverage checkpoints that bracket z. A window that reaches the first or
      // last checkpoint always spans at least 2.
      i1 = roundHalfAwayFromZero(z - halfAverage) + 1;
      i2 = i1 + numAverage;
      if (i1 <= 0) {
        i1 = 0;
        i2 = max(2, i2);
      }
      if (i2 >= numCheckpoints) {
        i2 = numCheckpoints;
        i1 = min(i1, numCheckpoints - 2);
      }
    }

    result.reset(i1, i2);
    double sumWeightedValue = 0.0;
    double sumWeight = 0.0;
    for (int i = i1; i < i2; i++) {
      double ds = (z - positions[i]) / sigma;
      double weight = exp(-ds * ds);
      result.setWeight(i, weight);
      sumWeightedValue += weight * parameterSet.getValue(i);
      sumWeight += weight;
    }

    if (sumWeight > 0.0) {
      result.setValue(sumWeightedValue / sumWeight, sumWeight);
    } else {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" No checkpoint of %s contributes at %10.4f (sigma %8.5f).",
            parameterSet.getNameStem(), x, sigma));
      }
      result.setValue(0.0, sumWeight);
    }
    return result;
  }

  /** Round to the nearest integer, with halves rounded away from zero. */
  private static int roundHalfAwayFromZero(double v) {
    int r = (int) floor(abs(v) + 0.5);
    return (v < 0.0) ? -r : r;
  }

  public int getNumCheckpoints() {
    return numCheckpoints;
  }

  public int getNumIntervals() {
    return numIntervals;
  }

  public int getNumAverage() {
    return numAverage;
  }

  public double getSigma() {
    return sigma;
  }

  public double getSpacing() {
    return spacing;
  }

  public double getCoordinateOrigin() {
    return coordinateOrigin;
  }

  /**
   * Checkpoint positions in normalized coordinates.
   *
   * @return a copy of the positions.
   */
  public double[] getPositions() {
    return positions.clone();
  }

  @Override
  public String toString() {
    return format(" Gaussian smoother: %d intervals, %d checkpoints, spacing %8.3f, "
        + "averaging %d, sigma %6.3f", numIntervals, numCheckpoints, spacing, numAverage, sigma);
  }
}
