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

import static dgx.numerics.math.DoubleMath.dot;
import static dgx.numerics.math.DoubleMath.length;
import static dgx.utilities.Constants.RAD_TO_MRAD;
import static org.junit.Assert.assertEquals;

import dgx.crystal.Beam;
import dgx.crystal.Crystal;
import dgx.crystal.Detector;
import dgx.utilities.DGXTest;
import java.util.Arrays;
import org.junit.Test;

/**
 * Test the states composed by the concrete scan-varying parameterisations.
 *
 * @author Michael J. Schnieders
 */
public class ScanVaryingGeometryTest extends DGXTest {

  private static final double TOL = 1.0e-10;

  @Test
  public void testOrientationAtZeroAngles() {
    Crystal crystal = new Crystal(28.38, 31.73, 36.75, 90.12, 99.61, 96.52);
    ScanVaryingCrystalOrientationParameterisation parameterisation =
        new ScanVaryingCrystalOrientationParameterisation(crystal, new GaussianSmoother(0, 90, 3));
    assertEquals(Arrays.asList("Phi1", "Phi2", "Phi3"),
        parameterisation.getParameterSetNames(false));
    assertEquals(ParameterType.ANGLE,
        parameterisation.getParameterSets().get(0).getParameterType());
    parameterisation.compose(45.0);
    double[][] u = parameterisation.getState();
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        assertEquals((i == j) ? 1.0 : 0.0, u[i][j], TOL);
      }
    }
  }

  @Test
  public void testQuarterTurnAboutZ() {
    Crystal crystal = new Crystal(92.69, 92.69, 92.69, 90.0, 90.0, 90.0);
    GaussianSmoother smoother = new GaussianSmoother(0.0, 90.0, 3);
    ScanVaryingCrystalOrientationParameterisation parameterisation =
        new ScanVaryingCrystalOrientationParameterisation(crystal, smoother);
    double[] phi3 = new double[5];
    Arrays.fill(phi3, 0.5 * Math.PI * RAD_TO_MRAD);
    parameterisation.getParameterSets().get(2).setValues(phi3);
    parameterisation.compose(30.0);
    double[][] u = parameterisation.getState();
    // x is rotated onto y.
    assertEquals(0.0, u[0][0], TOL);
    assertEquals(1.0, u[1][0], TOL);
    assertEquals(-1.0, u[0][1], TOL);

    // The converged state is handed to the model by the caller.
    crystal.setU(u);
    assertEquals(1.0, crystal.getU()[1][0], TOL);
  }

  @Test
  public void testBeamRotationKeepsWavelength() {
    Beam beam = new Beam(new double[] {0.0, 0.0, -1.0}, 0.9795);
    ScanVaryingBeamParameterisation parameterisation = new ScanVaryingBeamParameterisation(beam,
        new double[] {1.0, 0.0, 0.0}, new GaussianSmoother(0.0, 360.0, 10));
    double[][] axes = parameterisation.getRotationAxes();
    double[] s00 = beam.getS0();
    assertEquals(0.0, dot(axes[0], s00), TOL);
    assertEquals(0.0, dot(axes[1], s00), TOL);
    assertEquals(0.0, dot(axes[0], axes[1]), TOL);

    double[] values = new double[parameterisation.numFree()];
    for (int i = 0; i < values.length; i++) {
      values[i] = 2.0 + i;
    }
    parameterisation.unflattenValues(values);
    parameterisation.compose(123.0);
    double[] s0 = parameterisation.getState();
    assertEquals(1.0 / 0.9795, length(s0), TOL);
  }

  @Test
  public void testDetectorHandOff() {
    Detector detector = new Detector(new double[] {0.0, 0.0, -100.0},
        new double[] {1.0, 0.0, 0.0}, new double[] {0.0, -1.0, 0.0});
    ScanVaryingDetectorParameterisation parameterisation =
        new ScanVaryingDetectorParameterisation(detector, new GaussianSmoother(0.0, 90.0, 3));
    double[] values = new double[parameterisation.numFree()];
    Arrays.fill(values, 0, 5, 0.75);
    Arrays.fill(values, 5, 10, -0.5);
    parameterisation.unflattenValues(values);
    parameterisation.compose(45.0);

    // The composed origin is handed to the detector, which the parameterisation never modifies.
    assertEquals(100.0, detector.getDistance(), TOL);
    detector.setOrigin(parameterisation.getState());
    assertEquals(100.75, detector.getDistance(), TOL);
    double[] origin = detector.getOrigin();
    assertEquals(-0.5, origin[0], TOL);
    assertEquals(0.0, origin[1], TOL);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSpindleParallelToBeam() {
    Beam beam = new Beam(new double[] {0.0, 0.0, -1.0}, 1.0);
    new ScanVaryingBeamParameterisation(beam, new double[] {0.0, 0.0, 1.0},
        new GaussianSmoother(0.0, 360.0, 10));
  }
}
