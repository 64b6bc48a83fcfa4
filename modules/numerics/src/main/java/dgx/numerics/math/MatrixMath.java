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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * The MatrixMath class is a simple 3x3 matrix library used by the geometry models and their
 * parameterisations.
 * <p>
 * All methods are thread-safe and static.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MatrixMath {

    private MatrixMath() {
        // Prevent instantiation.
    }

    /**
     * Returns a new 3x3 identity matrix.
     *
     * @return The identity matrix.
     */
    public static double[][] mat3Identity() {
        return new double[][] {{1.0, 0.0, 0.0}, {0.0, 1.0, 0.0}, {0.0, 0.0, 1.0}};
    }

    /**
     * Deep copy of a 3x3 matrix.
     *
     * @param m an input 3x3 matrix.
     * @return A new matrix with the same entries.
     */
    public static double[][] mat3Copy(double[][] m) {
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            copy[i] = m[i].clone();
        }
        return copy;
    }

    /**
     * Multiple a 3x3 matrix m and a 3x3 matrix n. The output is returned in a newly allocated
     * 3x3 matrix.
     *
     * @param m an input 3x3 matrix.
     * @param n an input 3x3 matrix
     * @return Returns the 3x3 matrix result.
     */
    public static double[][] mat3Mat3Multiply(double[][] m, double[][] n) {
        return mat3Mat3Multiply(m, n, new double[3][3]);
    }

    /**
     * Multiple a 3x3 matrix m and a 3x3 matrix n. The output is stored in result. The matrix m or n
     * can be used for the result matrix.
     *
     * @param m an input 3x3 matrix.
     * @param n an input 3x3 matrix
     * @param result a 3x3 matrix to store the result.
     * @return Returns the matrix result.
     */
    public static double[][] mat3Mat3Multiply(double[][] m, double[][] n, double[][] result) {
        double[][] r = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                r[i][j] = m[i][0] * n[0][j] + m[i][1] * n[1][j] + m[i][2] * n[2][j];
            }
        }
        for (int i = 0; i < 3; i++) {
            System.arraycopy(r[i], 0, result[i], 0, 3);
        }
        return result;
    }

    /**
     * Multiply a 3x3 matrix and a 3x1 column vector.
     *
     * @param m input 3x3 matrix.
     * @param v input column vector.
     * @return Returns a new vector m.v.
     */
    public static double[] mat3Vec3Multiply(double[][] m, double[] v) {
        return new double[] {
                m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2],
                m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2],
                m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2]};
    }

    /**
     * Transpose a 3x3 matrix into a newly allocated matrix.
     *
     * @param m input 3x3 matrix.
     * @return Returns the transposed matrix.
     */
    public static double[][] mat3Transpose(double[][] m) {
        double[][] t = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                t[j][i] = m[i][j];
            }
        }
        return t;
    }

    /**
     * Scale every entry of a 3x3 matrix.
     *
     * @param m input 3x3 matrix.
     * @param a scale factor.
     * @return Returns a new matrix a.m.
     */
    public static double[][] mat3Scale(double[][] m, double a) {
        double[][] s = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                s[i][j] = a * m[i][j];
            }
        }
        return s;
    }

    /**
     * Rotation matrix for a right-handed rotation about a unit axis (Rodrigues' formula).
     * <p>
     * R = cos(t) I + sin(t) [k]x + (1 - cos(t)) k k^T
     *
     * @param axis unit rotation axis.
     * @param angle rotation angle in radians.
     * @return Returns the rotation matrix.
     */
    public static double[][] axisAngleRotation(double[] axis, double angle) {
        double c = cos(angle);
        double s = sin(angle);
        return axisAngleTerms(axis, c, s, 1.0 - c);
    }

    /**
     * Derivative of {@link #axisAngleRotation(double[], double)} with respect to the angle.
     * <p>
     * dR/dt = -sin(t) I + cos(t) [k]x + sin(t) k k^T
     *
     * @param axis unit rotation axis.
     * @param angle rotation angle in radians.
     * @return Returns dR/dt.
     */
    public static double[][] axisAngleRotationDerivative(double[] axis, double angle) {
        double c = cos(angle);
        double s = sin(angle);
        return axisAngleTerms(axis, -s, c, s);
    }

    /** Returns a I + b [k]x + c k k^T. */
    private static double[][] axisAngleTerms(double[] k, double a, double b, double c) {
        double kx = k[0];
        double ky = k[1];
        double kz = k[2];
        return new double[][] {
                {a + c * kx * kx, -b * kz + c * kx * ky, b * ky + c * kx * kz},
                {b * kz + c * ky * kx, a + c * ky * ky, -b * kx + c * ky * kz},
                {-b * ky + c * kz * kx, b * kx + c * kz * ky, a + c * kz * kz}};
    }
}
