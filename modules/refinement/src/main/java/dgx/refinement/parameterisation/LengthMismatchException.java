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

/**
 * Thrown when a vector of parameter values (or uncertainties) does not have the length expected by
 * its receiver. The receiver is left unchanged.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LengthMismatchException extends IllegalArgumentException {

  public final int expected;
  public final int actual;

  /**
   * Constructor for LengthMismatchException.
   *
   * @param description what was being assigned.
   * @param expected the required length.
   * @param actual the supplied length.
   */
  public LengthMismatchException(String description, int expected, int actual) {
    super(format(" %s requires %d values, but %d were supplied.", description, expected, actual));
    this.expected = expected;
    this.actual = actual;
  }
}
