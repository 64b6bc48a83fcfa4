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

import java.util.List;

/**
 * A parameterisation of one geometry model whose state varies smoothly across a scan. The
 * optimizer sees a flat vector of free parameters; after {@link #compose(double)} the model state
 * and its derivatives with respect to every parameter are available for the composed scan
 * coordinate.
 *
 * @param <S> the state type, for example a 3-vector or a 3x3 matrix.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface ScanVaryingParameterisation<S> {

  /**
   * Number of parameters not fixed.
   *
   * @return the number of free parameters.
   */
  int numFree();

  /**
   * Number of parameters, fixed or free.
   *
   * @return the number of parameters.
   */
  int numTotal();

  /**
   * Concatenate the checkpoint values of the parameter sets, in set order.
   *
   * @param onlyFree if true, fixed sets are skipped.
   * @return the flat parameter vector.
   */
  double[] flattenValues(boolean onlyFree);

  /**
   * Parameter names aligned with {@link #flattenValues(boolean)}.
   *
   * @param onlyFree if true, fixed sets are skipped.
   * @return the names.
   */
  List<String> flattenNames(boolean onlyFree);

  /**
   * Distribute a vector of free parameter values over the free sets. The state is not recomposed.
   *
   * @param values one value per free parameter.
   * @throws LengthMismatchException if values.length != numFree().
   */
  void unflattenValues(double[] values);

  /**
   * Evaluate the state and its derivatives at a scan coordinate.
   *
   * @param t the scan coordinate.
   */
  void compose(double t);

  /**
   * The state at the last composed coordinate.
   *
   * @return the state.
   * @throws IllegalStateException if compose has not been called.
   */
  S getState();

  /**
   * Derivatives of the state with respect to each parameter, ordered like
   * {@link #flattenValues(boolean)}.
   *
   * @param onlyFree if false, fixed sets contribute zero derivatives.
   * @return the derivatives.
   * @throws IllegalStateException if compose has not been called.
   */
  List<S> getDerivatives(boolean onlyFree);

  /**
   * The scan coordinate of the last compose.
   *
   * @return the coordinate.
   * @throws IllegalStateException if compose has not been called.
   */
  double getComposedCoordinate();

  /**
   * Smoothing results of each parameter set at a scan coordinate.
   *
   * @param t the scan coordinate.
   * @param onlyFree if true, fixed sets are skipped.
   * @return one ValueWeight per set.
   */
  List<ValueWeight> getParameterSetValueWeights(double t, boolean onlyFree);
}
