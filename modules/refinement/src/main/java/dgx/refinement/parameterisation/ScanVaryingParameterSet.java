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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A scan-varying parameter set holds the checkpoint values of one scalar physical quantity. The
 * value at an arbitrary scan coordinate is derived from the checkpoints by a
 * {@link GaussianSmoother}; externally the set is presented as one parameter per checkpoint.
 * <p>
 * Values are only ever replaced as a whole. Replacing them invalidates the uncertainties.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScanVaryingParameterSet {

  private final int numSamples;
  private final String nameStem;
  private final List<String> names;
  private final double[] axis;
  private final ParameterType parameterType;
  private double[] values;
  private double[] esds;
  private boolean fixed = false;

  /**
   * Constructor for ScanVaryingParameterSet.
   *
   * @param value initial value for every checkpoint.
   * @param numSamples number of checkpoints (at least 2).
   * @param axis axis the parameter acts along, or null.
   * @param parameterType physical role of the parameter, or null.
   * @param nameStem base name of the parameters.
   * @throws IllegalArgumentException if numSamples is less than 2.
   */
  public ScanVaryingParameterSet(double value, int numSamples, @Nullable double[] axis,
      @Nullable ParameterType parameterType, String nameStem) {
    if (numSamples < 2) {
      throw new IllegalArgumentException(format(
          " A scan-varying parameter set needs at least 2 samples (%d requested); "
              + "use a scan-static parameter instead.", numSamples));
    }
    this.numSamples = numSamples;
    this.nameStem = nameStem;
    this.axis = (axis == null) ? null : axis.clone();
    this.parameterType = (parameterType == null) ? ParameterType.OTHER : parameterType;
    values = new double[numSamples];
    Arrays.fill(values, value);
    esds = unknownEsds(numSamples);
    List<String> sampleNames = new ArrayList<>(numSamples);
    for (int i = 0; i < numSamples; i++) {
      sampleNames.add(sampleName(nameStem, i));
    }
    names = Collections.unmodifiableList(sampleNames);
  }

  /**
   * Constructor for an untyped parameter set without an axis.
   *
   * @param value initial value for every checkpoint.
   * @param numSamples number of checkpoints (at least 2).
   * @param nameStem base name of the parameters.
   */
  public ScanVaryingParameterSet(double value, int numSamples, String nameStem) {
    this(value, numSamples, null, null, nameStem);
  }

  /**
   * Name of the parameter held at one checkpoint.
   *
   * @param stem the base name.
   * @param index the checkpoint index.
   * @return stem + "_sample" + index.
   */
  public static String sampleName(String stem, int index) {
    return stem + "_sample" + index;
  }

  /**
   * The number of checkpoints.
   *
   * @return N.
   */
  public int size() {
    return numSamples;
  }

  /**
   * getValues.
   *
   * @return a copy of the checkpoint values.
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * Replace all checkpoint values. Uncertainties are reset to unknown (NaN).
   *
   * @param values the new values.
   * @throws LengthMismatchException if values.length != size().
   */
  public void setValues(double[] values) {
    if (values.length != numSamples) {
      throw new LengthMismatchException(nameStem + " values", numSamples, values.length);
    }
    this.values = values.clone();
    esds = unknownEsds(numSamples);
  }

  /**
   * Copy the values of checkpoints into an array, avoiding an allocation.
   *
   * @param destination the destination array.
   * @param offset where to start writing.
   */
  void copyValues(double[] destination, int offset) {
    System.arraycopy(values, 0, destination, offset, numSamples);
  }

  /**
   * Direct access to the values for the smoother.
   *
   * @param index the checkpoint index.
   * @return the value at index.
   */
  double getValue(int index) {
    return values[index];
  }

  /**
   * getEsds.
   *
   * @return a copy of the uncertainties; NaN marks an unknown uncertainty.
   */
  public double[] getEsds() {
    return esds.clone();
  }

  /**
   * Set the checkpoint uncertainties, usually after a solver has estimated them.
   *
   * @param esds the uncertainties.
   * @throws LengthMismatchException if esds.length != size().
   */
  public void setEsds(double[] esds) {
    if (esds.length != numSamples) {
      throw new LengthMismatchException(nameStem + " uncertainties", numSamples, esds.length);
    }
    this.esds = esds.clone();
  }

  public boolean isFixed() {
    return fixed;
  }

  public void setFixed(boolean fixed) {
    this.fixed = fixed;
  }

  /**
   * getNames.
   *
   * @return an unmodifiable list of the checkpoint parameter names.
   */
  public List<String> getNames() {
    return names;
  }

  public String getNameStem() {
    return nameStem;
  }

  /**
   * getAxis.
   *
   * @return a copy of the axis, or null if there is none.
   */
  @Nullable
  public double[] getAxis() {
    return (axis == null) ? null : axis.clone();
  }

  public ParameterType getParameterType() {
    return parameterType;
  }

  private static double[] unknownEsds(int n) {
    double[] unknown = new double[n];
    Arrays.fill(unknown, Double.NaN);
    return unknown;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" %s (%s%s):", nameStem, parameterType,
        fixed ? ", fixed" : ""));
    for (double value : values) {
      sb.append(format(" %10.5f", value));
    }
    return sb.toString();
  }
}
