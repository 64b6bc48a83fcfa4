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

import static dgx.numerics.math.MatrixMath.axisAngleRotation;
import static dgx.numerics.math.MatrixMath.axisAngleRotationDerivative;
import static dgx.numerics.math.MatrixMath.mat3Copy;
import static dgx.numerics.math.MatrixMath.mat3Mat3Multiply;
import static dgx.numerics.math.MatrixMath.mat3Scale;
import static dgx.utilities.Constants.MRAD_TO_RAD;

import dgx.crystal.Crystal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scan-varying parameterisation of a crystal orientation matrix U by three small rotations about
 * the laboratory X, Y and Z axes: U(t) = R3(phi3) R2(phi2) R1(phi1) U0. Angles are in mrad.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScanVaryingCrystalOrientationParameterisation
    extends ScanVaryingModelParameterisation<Crystal, double[][]> {

  private static final double[][] LAB_AXES = {{1.0, 0.0, 0.0}, {0.0, 1.0, 0.0}, {0.0, 0.0, 1.0}};
  private static final String[] STEMS = {"Phi1", "Phi2", "Phi3"};

  /**
   * Constructor for ScanVaryingCrystalOrientationParameterisation. All angles start at zero, so
   * the initial state is the current orientation of the crystal.
   *
   * @param crystal the crystal.
   * @param smoother the smoother.
   */
  public ScanVaryingCrystalOrientationParameterisation(Crystal crystal,
      GaussianSmoother smoother) {
    super(crystal, crystal.getU(), createSets(smoother.getNumCheckpoints()), smoother);
  }

  private static List<ScanVaryingParameterSet> createSets(int numSamples) {
    List<ScanVaryingParameterSet> sets = new ArrayList<>(3);
    for (int i = 0; i < 3; i++) {
      sets.add(new ScanVaryingParameterSet(0.0, numSamples, LAB_AXES[i], ParameterType.ANGLE,
          STEMS[i]));
    }
    return sets;
  }

  /** {@inheritDoc} */
  @Override
  public void compose(double t) {
    double phi1 = smoothedValue(0, t).getValue() * MRAD_TO_RAD;
    double phi2 = smoothedValue(1, t).getValue() * MRAD_TO_RAD;
    double phi3 = smoothedValue(2, t).getValue() * MRAD_TO_RAD;

    double[][] r1 = axisAngleRotation(LAB_AXES[0], phi1);
    double[][] r2 = axisAngleRotation(LAB_AXES[1], phi2);
    double[][] r3 = axisAngleRotation(LAB_AXES[2], phi3);
    double[][] dr1 = axisAngleRotationDerivative(LAB_AXES[0], phi1);
    double[][] dr2 = axisAngleRotationDerivative(LAB_AXES[1], phi2);
    double[][] dr3 = axisAngleRotationDerivative(LAB_AXES[2], phi3);

    double[][] r1u0 = mat3Mat3Multiply(r1, initialState);
    double[][] r21u0 = mat3Mat3Multiply(r2, r1u0);
    double[][] u = mat3Mat3Multiply(r3, r21u0);

    // Chain rule through the mrad to rad conversion.
    double[][] du1 = mat3Mat3Multiply(r3,
        mat3Mat3Multiply(r2, mat3Mat3Multiply(dr1, initialState)));
    double[][] du2 = mat3Mat3Multiply(r3, mat3Mat3Multiply(dr2, r1u0));
    double[][] du3 = mat3Mat3Multiply(dr3, r21u0);
    List<double[][]> setDerivatives = Arrays.asList(mat3Scale(du1, MRAD_TO_RAD),
        mat3Scale(du2, MRAD_TO_RAD), mat3Scale(du3, MRAD_TO_RAD));

    setComposedState(t, u, checkpointDerivatives(setDerivatives));
  }

  @Override
  protected double[][] zeroDerivative() {
    return new double[3][3];
  }

  @Override
  protected double[][] scaleDerivative(double[][] derivative, double factor) {
    return mat3Scale(derivative, factor);
  }

  @Override
  protected double[][] copyState(double[][] s) {
    return mat3Copy(s);
  }
}
