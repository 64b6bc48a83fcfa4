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

import java.util.Arrays;

/**
 * The result of smoothing one parameter set at one scan coordinate: the interpolated value, the
 * weight of every checkpoint and the sum of the weights.
 * <p>
 * Weights are non-zero only inside the smoothing window [firstIndex, lastIndex). Instances are
 * filled in place by {@link GaussianSmoother#valueWeight(double, ScanVaryingParameterSet,
 * ValueWeight)} so that a parameterisation can reuse one per parameter set.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ValueWeight {

  private final double[] weights;
  private double value;
  private double sumWeight;
  private int firstIndex;
  private int lastIndex;

  /**
   * Constructor for ValueWeight.
   *
   * @param numCheckpoints length of the weight vector.
   */
  public ValueWeight(int numCheckpoints) {
    weights = new double[numCheckpoints];
  }

  /** Clear the weights before a new window is evaluated. */
  void reset(int firstIndex, int lastIndex) {
    Arrays.fill(weights, 0.0);
    this.firstIndex = firstIndex;
    this.lastIndex = lastIndex;
    value = 0.0;
    sumWeight = 0.0;
  }

  void setWeight(int index, double weight) {
    weights[index] = weight;
  }

  void setValue(double value, double sumWeight) {
    this.value = value;
    this.sumWeight = sumWeight;
  }

  /**
   * The smoothed value.
   *
   * @return the weighted mean of the checkpoint values, or 0.0 if no checkpoint contributed.
   */
  public double getValue() {
    return value;
  }

  /**
   * getWeights.
   *
   * @return a copy of the full length weight vector.
   */
  public double[] getWeights() {
    return weights.clone();
  }

  /**
   * Weight of one checkpoint.
   *
   * @param index the checkpoint index.
   * @return the weight.
   */
  public double getWeight(int index) {
    return weights[index];
  }

  /**
   * Derivative of the smoothed value with respect to the value at one checkpoint, that is the
   * weight divided by the sum of the weights.
   *
   * @param index the checkpoint index.
   * @return d(value)/d(checkpoint value), 0.0 if no checkpoint contributed.
   */
  public double getNormalizedWeight(int index) {
    if (sumWeight > 0.0) {
      return weights[index] / sumWeight;
    }
    return 0.0;
  }

  public double getSumWeight() {
    return sumWeight;
  }

  /**
   * First checkpoint index of the smoothing window.
   *
   * @return the inclusive lower bound.
   */
  public int getFirstIndex() {
    return firstIndex;
  }

  /**
   * Last checkpoint index of the smoothing window.
   *
   * @return the exclusive upper bound.
   */
  public int getLastIndex() {
    return lastIndex;
  }

  public int size() {
    return weights.length;
  }
}
