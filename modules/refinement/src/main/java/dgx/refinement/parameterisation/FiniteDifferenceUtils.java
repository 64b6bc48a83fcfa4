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
import java.util.List;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central finite difference derivatives of a scan-varying state, used to check analytic
 * derivatives.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FiniteDifferenceUtils {

  private static final Logger logger = Logger.getLogger(FiniteDifferenceUtils.class.getName());

  private FiniteDifferenceUtils() {
  }

  /**
   * Derivatives of the flattened state with respect to each free parameter. The parameter values
   * are restored and the parameterisation is recomposed at t afterwards; uncertainties of the free
   * sets are reset.
   *
   * @param parameterisation the parameterisation.
   * @param t the scan coordinate.
   * @param step the finite difference step.
   * @param flattener converts a state into a flat array.
   * @param <S> the state type.
   * @return one flattened derivative per free parameter.
   */
  public static <S> List<double[]> stateDerivatives(ScanVaryingParameterisation<S> parameterisation,
      double t, double step, Function<S, double[]> flattener) {
    if (!(step > 0.0)) {
      throw new IllegalArgumentException(
          format(" The finite difference step must be positive (%g).", step));
    }
    double[] p0 = parameterisation.flattenValues(true);
    List<double[]> ret = new ArrayList<>(p0.length);
    double[] p = p0.clone();
    try {
      for (int i = 0; i < p0.length; i++) {
        p[i] = p0[i] + step;
        parameterisation.unflattenValues(p);
        parameterisation.compose(t);
        double[] plus = flattener.apply(parameterisation.getState());

        p[i] = p0[i] - step;
        parameterisation.unflattenValues(p);
        parameterisation.compose(t);
        double[] minus = flattener.apply(parameterisation.getState());
        p[i] = p0[i];

        double[] d = new double[plus.length];
        for (int j = 0; j < d.length; j++) {
          d[j] = (plus[j] - minus[j]) / (2.0 * step);
        }
        ret.add(d);
      }
    } finally {
      parameterisation.unflattenValues(p0);
      parameterisation.compose(t);
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Finite difference derivatives of %d parameters at %10.4f.",
          p0.length, t));
    }
    return ret;
  }

  /**
   * Flatten a matrix row by row.
   *
   * @param m the matrix.
   * @return a new array.
   */
  public static double[] flattenMatrix(double[][] m) {
    int n = 0;
    for (double[] row : m) {
      n += row.length;
    }
    double[] ret = new double[n];
    int k = 0;
    for (double[] row : m) {
      System.arraycopy(row, 0, ret, k, row.length);
      k += row.length;
    }
    return ret;
  }
}
