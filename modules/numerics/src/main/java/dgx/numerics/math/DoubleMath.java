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
package dgx.numerics.math;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

import javax.annotation.Nullable;

/**
 * The DoubleMath class is a simple math library that operates on 3-coordinate double arrays.
 *
 * <p>All methods are static and thread-safe.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DoubleMath {

  private DoubleMath() {
    // Prevent instantiation.
  }

  /**
   * Finds the cross-product between two vectors
   *
   * @param a First vector
   * @param b Second vector
   * @return Returns the cross-product.
   */
  public static double[] X(double[] a, double[] b) {
    return X(a, b, new double[3]);
  }

  /**
   * Finds the cross-product between two vectors
   *
   * @param a First vector
   * @param b Second vector
   * @param ret The cross-product of a x b.
   * @return Returns the cross-product ret.
   */
  public static double[] X(double[] a, double[] b, double[] ret) {
    double x = a[1] * b[2] - a[2] * b[1];
    double y = a[2] * b[0] - a[0] * b[2];
    double z = a[0] * b[1] - a[1] * b[0];
    ret[0] = x;
    ret[1] = y;
    ret[2] = z;
    return ret;
  }

  /**
   * Compute a + b * c, the scaled addition used to place points along an axis.
   *
   * @param a Base vector.
   * @param b Scalar.
   * @param c Direction vector.
   * @param ret Result vector (may be a).
   * @return Returns ret.
   */
  public static double[] addScaled(double[] a, double b, double[] c, double[] ret) {
    ret[0] = a[0] + b * c[0];
    ret[1] = a[1] + b * c[1];
    ret[2] = a[2] + b * c[2];
    return ret;
  }

  /**
   * dot
   *
   * @param a an array of double.
   * @param b an array of double.
   * @return Returns the dot product of a and b.
   */
  public static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * length
   *
   * @param d an array of double.
   * @return Returns the length of d.
   */
  public static double length(double[] d) {
    return sqrt(dot(d, d));
  }

  /**
   * Normalize a vector.
   *
   * @param n A vector to normalize.
   * @return Returns a new unit vector.
   * @throws IllegalArgumentException if n has zero length.
   */
  public static double[] normalize(double[] n) {
    double len = length(n);
    if (len == 0.0) {
      throw new IllegalArgumentException(" A zero length vector cannot be normalized.");
    }
    return scale(n, 1.0 / len, new double[3]);
  }

  /**
   * Scale a vector.
   *
   * @param n A vector to scale.
   * @param a A scalar.
   * @param ret The result (may be n).
   * @return Returns ret.
   */
  public static double[] scale(double[] n, double a, double[] ret) {
    ret[0] = n[0] * a;
    ret[1] = n[1] * a;
    ret[2] = n[2] * a;
    return ret;
  }

  /**
   * Returns a String representation of a vector, prefixed with an optional label.
   *
   * @param v The vector.
   * @param label The label, or null.
   * @return A String.
   */
  public static String toString(@Nullable double[] v, @Nullable String label) {
    if (v == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    if (label != null) {
      sb.append(format(" %s = [", label));
    } else {
      sb.append(" [");
    }
    for (int i = 0; i < v.length; i++) {
      sb.append(format(" %16.8f", v[i]));
    }
    sb.append(" ]");
    return sb.toString();
  }
}
