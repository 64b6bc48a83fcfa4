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

import static dgx.numerics.math.DoubleMath.addScaled;
import static dgx.numerics.math.DoubleMath.scale;

import dgx.crystal.Detector;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scan-varying parameterisation of a detector panel position. The panel origin moves by Dist
 * along the panel normal and by Shift1 and Shift2 along the fast and slow axes, all in mm.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScanVaryingDetectorParameterisation
    extends ScanVaryingModelParameterisation<Detector, double[]> {

  private final double[] normal;
  private final double[] fastAxis;
  private final double[] slowAxis;

  /**
   * Constructor for ScanVaryingDetectorParameterisation.
   *
   * @param detector the detector.
   * @param smoother the smoother.
   */
  public ScanVaryingDetectorParameterisation(Detector detector, GaussianSmoother smoother) {
    super(detector, detector.getOrigin(), createSets(detector, smoother.getNumCheckpoints()),
        smoother);
    normal = detector.getNormal();
    fastAxis = detector.getFastAxis();
    slowAxis = detector.getSlowAxis();
  }

  private static List<ScanVaryingParameterSet> createSets(Detector detector, int numSamples) {
    List<ScanVaryingParameterSet> sets = new ArrayList<>(3);
    sets.add(new ScanVaryingParameterSet(0.0, numSamples, detector.getNormal(),
        ParameterType.LENGTH, "Dist"));
    sets.add(new ScanVaryingParameterSet(0.0, numSamples, detector.getFastAxis(),
        ParameterType.LENGTH, "Shift1"));
    sets.add(new ScanVaryingParameterSet(0.0, numSamples, detector.getSlowAxis(),
        ParameterType.LENGTH, "Shift2"));
    return sets;
  }

  /** {@inheritDoc} */
  @Override
  public void compose(double t) {
    double dist = smoothedValue(0, t).getValue();
    double shift1 = smoothedValue(1, t).getValue();
    double shift2 = smoothedValue(2, t).getValue();

    double[] origin = addScaled(initialState, dist, normal, new double[3]);
    addScaled(origin, shift1, fastAxis, origin);
    addScaled(origin, shift2, slowAxis, origin);

    // The origin is linear in each shift.
    List<double[]> setDerivatives = Arrays.asList(normal, fastAxis, slowAxis);
    setComposedState(t, origin, checkpointDerivatives(setDerivatives));
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
