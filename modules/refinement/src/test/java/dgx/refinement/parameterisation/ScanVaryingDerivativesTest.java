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

import static dgx.numerics.math.DoubleMath.normalize;
import static dgx.numerics.math.MatrixMath.axisAngleRotation;
import static org.junit.Assert.assertEquals;

import dgx.crystal.Beam;
import dgx.crystal.Crystal;
import dgx.crystal.Detector;
import dgx.utilities.DGXTest;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Compare the analytic state derivatives of the concrete scan-varying parameterisations with
 * central finite differences.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class ScanVaryingDerivativesTest extends DGXTest {

  private static final double STEP = 1.0e-4;

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Scan start", 0.0},
        {"Between checkpoints", 3.7},
        {"On a checkpoint", 5.0},
        {"Scan end", 10.0}
    });
  }

  private final String info;
  private final double t;
  private final GaussianSmoother smoother = new GaussianSmoother(0.0, 10.0, 5);

  public ScanVaryingDerivativesTest(String info, double t) {
    this.info = info;
    this.t = t;
  }

  /** Give every checkpoint a distinct, non-zero value so that all weights are exercised. */
  private static void perturb(ScanVaryingParameterisation<?> parameterisation, double scale) {
    double[] values = new double[parameterisation.numFree()];
    for (int i = 0; i < values.length; i++) {
      values[i] = scale * Math.sin(1.3 * i + 0.2);
    }
    parameterisation.unflattenValues(values);
  }

  private <S> void compare(ScanVaryingParameterisation<S> parameterisation,
      Function<S, double[]> flattener, double tolerance) {
    parameterisation.compose(t);
    List<S> analytic = parameterisation.getDerivatives(true);
    double[] state = flattener.apply(parameterisation.getState());
    List<double[]> numeric =
        FiniteDifferenceUtils.stateDerivatives(parameterisation, t, STEP, flattener);
    assertEquals(analytic.size(), numeric.size());
    for (int i = 0; i < numeric.size(); i++) {
      double[] a = flattener.apply(analytic.get(i));
      double[] n = numeric.get(i);
      for (int j = 0; j < n.length; j++) {
        assertEquals(info + " derivative " + i + "," + j, n[j], a[j], tolerance);
      }
    }
    // The state is restored after differencing.
    double[] restored = flattener.apply(parameterisation.getState());
    for (int j = 0; j < state.length; j++) {
      assertEquals(info + " restored state", state[j], restored[j], 0.0);
    }
  }

  @Test
  public void testCrystalOrientation() {
    Crystal crystal = new Crystal(50.85, 38.60, 89.83, 90.0, 103.99, 90.0);
    crystal.setU(axisAngleRotation(normalize(new double[] {1.0, 1.0, 1.0}), 0.3));
    ScanVaryingCrystalOrientationParameterisation parameterisation =
        new ScanVaryingCrystalOrientationParameterisation(crystal, smoother);
    perturb(parameterisation, 20.0);
    compare(parameterisation, FiniteDifferenceUtils::flattenMatrix, 1.0e-9);
  }

  @Test
  public void testCrystalOrientationWithFixedSet() {
    Crystal crystal = new Crystal(92.69, 92.69, 92.69, 90.0, 90.0, 90.0);
    ScanVaryingCrystalOrientationParameterisation parameterisation =
        new ScanVaryingCrystalOrientationParameterisation(crystal, smoother);
    parameterisation.setFixed(new boolean[] {false, true, false});
    perturb(parameterisation, 5.0);
    compare(parameterisation, FiniteDifferenceUtils::flattenMatrix, 1.0e-9);
  }

  @Test
  public void testBeam() {
    Beam beam = new Beam(new double[] {0.0, 0.0, -1.0}, 0.9795);
    ScanVaryingBeamParameterisation parameterisation =
        new ScanVaryingBeamParameterisation(beam, new double[] {1.0, 0.0, 0.0}, smoother);
    perturb(parameterisation, 3.0);
    compare(parameterisation, Function.identity(), 1.0e-9);
  }

  @Test
  public void testDetector() {
    Detector detector = new Detector(new double[] {-10.0, 20.0, -100.0},
        new double[] {1.0, 0.0, 0.0}, new double[] {0.0, -1.0, 0.0});
    ScanVaryingDetectorParameterisation parameterisation =
        new ScanVaryingDetectorParameterisation(detector, smoother);
    perturb(parameterisation, 0.5);
    compare(parameterisation, Function.identity(), 1.0e-8);
  }
}
