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

import static dgx.numerics.math.DoubleMath.X;
import static dgx.numerics.math.DoubleMath.length;
import static dgx.numerics.math.DoubleMath.normalize;
import static dgx.numerics.math.DoubleMath.scale;
import static dgx.numerics.math.MatrixMath.axisAngleRotation;
import static dgx.numerics.math.MatrixMath.axisAngleRotationDerivative;
import static dgx.numerics.math.MatrixMath.mat3Vec3Multiply;
import static dgx.utilities.Constants.MRAD_TO_RAD;

import dgx.crystal.Beam;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scan-varying parameterisation of the incident beam direction by two small rotations Mu1 and Mu2
 * (mrad) about axes perpendicular to s0. The first axis is perpendicular to both s0 and the
 * goniometer spindle; the second is perpendicular to s0 and the first. The wavelength is not
 * refined.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScanVaryingBeamParameterisation
    extends ScanVaryingModelParameterisation<Beam, double[]> {

  private final double[] axis1;
  private final double[] axis2;

  /**
   * Constructor for ScanVaryingBeamParameterisation.
   *
   * @param beam the beam.
   * @param spindleAxis the goniometer rotation axis.
   * @param smoother the smoother.
   * @throws IllegalArgumentException if the spindle axis is parallel to the beam.
   */
  public ScanVaryingBeamParameterisation(Beam beam, double[] spindleAxis,
      GaussianSmoother smoother) {
    this(beam, beam.getS0(), rotationAxes(beam.getS0(), spindleAxis), smoother);
  }

  private ScanVaryingBeamParameterisation(Beam beam, double[] s0, double[][] axes,
      GaussianSmoother smoother) {
    super(beam, s0, createSets(smoother.getNumCheckpoints(), axes), smoother);
    axis1 = axes[0];
    axis2 = axes[1];
  }

  private static double[][] rotationAxes(double[] s0, double[] spindleAxis) {
    double[] a1 = X(s0, spindleAxis);
    if (length(a1) <= 1.0e-10 * length(s0) * length(spindleAxis)) {
      throw new IllegalArgumentException(" The spindle axis must not be parallel to the beam.");
    }
    a1 = normalize(a1);
    double[] a2 = normalize(X(s0, a1));
    return new double[][] {a1, a2};
  }

  private static List<ScanVaryingParameterSet> createSets(int numSamples, double[][] axes) {
    List<ScanVaryingParameterSet> sets = new ArrayList<>(2);
    sets.add(new ScanVaryingParameterSet(0.0, numSamples, axes[0], ParameterType.ANGLE, "Mu1"));
    sets.add(new ScanVaryingParameterSet(0.0, numSamples, axes[1], ParameterType.ANGLE, "Mu2"));
    return sets;
  }

  /** {@inheritDoc} */
  @Override
  public void compose(double t) {
    double mu1 = smoothedValue(0, t).getValue() * MRAD_TO_RAD;
    double mu2 = smoothedValue(1, t).getValue() * MRAD_TO_RAD;

    double[][] r1 = axisAngleRotation(axis1, mu1);
    double[][] r2 = axisAngleRotation(axis2, mu2);
    double[] r1s0 = mat3Vec3Multiply(r1, initialState);
    double[] s0 = mat3Vec3Multiply(r2, r1s0);

    double[] ds1 = mat3Vec3Multiply(r2,
        mat3Vec3Multiply(axisAngleRotationDerivative(axis1, mu1), initialState));
    double[] ds2 = mat3Vec3Multiply(axisAngleRotationDerivative(axis2, mu2), r1s0);
    List<double[]> setDerivatives = Arrays.asList(scale(ds1, MRAD_TO_RAD, ds1),
        scale(ds2, MRAD_TO_RAD, ds2));

    setComposedState(t, s0, checkpointDerivatives(setDerivatives));
  }

  /**
   * The rotation axes of Mu1 and Mu2.
   *
   * @return copies of the two unit axes.
   */
  public double[][] getRotationAxes() {
    return new double[][] {axis1.clone(), axis2.clone()};
  }

  @Override
  protected double[] zeroDerivative() {
    return new double[3];
  }

  @Override
  protected double[] scaleDerivative(double[] derivative, double factor) {
    return scale(derivative, factor, new double[3]);
  }

  @Override
  protected double[] copyState(double[] s) {
    return s.clone();
  }
}
