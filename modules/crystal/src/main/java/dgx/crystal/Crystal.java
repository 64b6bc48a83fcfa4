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
package dgx.crystal;

import static dgx.numerics.math.MatrixMath.mat3Copy;
import static dgx.numerics.math.MatrixMath.mat3Identity;
import static dgx.numerics.math.MatrixMath.mat3Mat3Multiply;
import static dgx.numerics.math.MatrixMath.mat3Transpose;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The Crystal class encapsulates the lattice parameters and orientation of a crystal in the
 * laboratory frame.
 * <p>
 * The real space basis vectors are the rows of Ai and the reciprocal basis vectors are the columns
 * of A = Ai^(-1), so that A plays the role of the B matrix and UB = U.A maps Miller indices onto
 * reciprocal lattice vectors in the laboratory frame.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Crystal {

    private static final Logger logger = Logger.getLogger(Crystal.class.getName());

    /**
     * Tolerance used to decide if an orientation matrix is a proper rotation.
     */
    private static final double ORTHONORMAL_TOLERANCE = 1.0e-6;

    /**
     * Length of the a-axis.
     */
    public double a;
    /**
     * Length of the b-axis.
     */
    public double b;
    /**
     * Length of the c-axis.
     */
    public double c;
    /**
     * The alpha angle.
     */
    public double alpha;
    /**
     * The beta angle.
     */
    public double beta;
    /**
     * The gamma angle.
     */
    public double gamma;
    /**
     * Reciprocal axis lengths.
     */
    public double aStar, bStar, cStar;
    /**
     * The crystal unit cell volume.
     */
    public double volume;
    /**
     * Metric tensor.
     */
    public final double[][] G = new double[3][3];
    /**
     * Matrix to convert from fractional to Cartesian coordinates (rows are the real basis).
     */
    public final double[][] Ai = new double[3][3];
    /**
     * Matrix to convert from Cartesian to fractional coordinates (columns are the reciprocal
     * basis).
     */
    public double[][] A;
    /**
     * Orientation of the crystal in the laboratory frame.
     */
    private double[][] U = mat3Identity();

    /**
     * The Crystal class encapsulates the lattice parameters and orientation.
     *
     * @param a The a-axis length.
     * @param b The b-axis length.
     * @param c The c-axis length.
     * @param alpha The alpha angle.
     * @param beta The beta angle.
     * @param gamma The gamma angle.
     * @throws IllegalArgumentException if the parameters do not describe a unit cell.
     */
    public Crystal(double a, double b, double c, double alpha, double beta, double gamma) {
        if (!changeUnitCellParameters(a, b, c, alpha, beta, gamma)) {
            throw new IllegalArgumentException(format(
                    " Invalid unit cell parameters (%8.3f %8.3f %8.3f %8.3f %8.3f %8.3f).",
                    a, b, c, alpha, beta, gamma));
        }
    }

    /**
     * Create a Crystal from the a-axis, b-axis, c-axis, alpha, beta and gamma
     * properties.
     *
     * @param properties a
     * {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     * @return a {@link dgx.crystal.Crystal} object, or null if any parameter is missing.
     */
    public static Crystal checkProperties(CompositeConfiguration properties) {
        double a = properties.getDouble("a-axis", -1.0);
        double b = properties.getDouble("b-axis", -1.0);
        double c = properties.getDouble("c-axis", -1.0);
        double alpha = properties.getDouble("alpha", -1.0);
        double beta = properties.getDouble("beta", -1.0);
        double gamma = properties.getDouble("gamma", -1.0);

        if (a < 0.0 || b < 0.0 || c < 0.0 || alpha < 0.0 || beta < 0.0 || gamma < 0.0) {
            return null;
        }

        return new Crystal(a, b, c, alpha, beta, gamma);
    }

    /**
     * This method should be called to update the unit cell parameters of a crystal. The proposed
     * parameters will only be accepted if they describe a unit cell with positive volume. If so,
     * all Crystal variables that depend on the unit cell parameters will be updated.
     *
     * @param a length of the a-axis.
     * @param b length of the b-axis.
     * @param c length of the c-axis.
     * @param alpha Angle between b-axis and c-axis.
     * @param beta Angle between a-axis and c-axis.
     * @param gamma Angle between a-axis and b-axis.
     * @return The method return true if the parameters are accepted, false otherwise.
     */
    public final boolean changeUnitCellParameters(double a, double b, double c,
                                                  double alpha, double beta, double gamma) {
        if (!(a > 0.0 && b > 0.0 && c > 0.0)) {
            return false;
        }
        if (!(alpha > 0.0 && alpha < 180.0 && beta > 0.0 && beta < 180.0
                && gamma > 0.0 && gamma < 180.0)) {
            return false;
        }

        double sin_beta = sin(toRadians(beta));
        double cos_alpha = cos(toRadians(alpha));
        double cos_beta = cos(toRadians(beta));
        double sin_gamma = sin(toRadians(gamma));
        double cos_gamma = cos(toRadians(gamma));
        double beta_term = (cos_alpha - cos_beta * cos_gamma) / sin_gamma;
        double gamma_term2 = sin_beta * sin_beta - beta_term * beta_term;
        if (gamma_term2 <= 0.0) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(format(" Angles (%8.3f %8.3f %8.3f) cannot form a unit cell.",
                        alpha, beta, gamma));
            }
            return false;
        }
        double gamma_term = sqrt(gamma_term2);

        this.a = a;
        this.b = b;
        this.c = c;
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        volume = sin_gamma * gamma_term * a * b * c;

        G[0][0] = a * a;
        G[0][1] = a * b * cos_gamma;
        G[0][2] = a * c * cos_beta;
        G[1][0] = G[0][1];
        G[1][1] = b * b;
        G[1][2] = b * c * cos_alpha;
        G[2][0] = G[0][2];
        G[2][1] = G[1][2];
        G[2][2] = c * c;

        // a is the first row of A^(-1).
        Ai[0][0] = a;
        Ai[0][1] = 0.0;
        Ai[0][2] = 0.0;
        // b is the second row of A^(-1).
        Ai[1][0] = b * cos_gamma;
        Ai[1][1] = b * sin_gamma;
        Ai[1][2] = 0.0;
        // c is the third row of A^(-1).
        Ai[2][0] = c * cos_beta;
        Ai[2][1] = c * beta_term;
        Ai[2][2] = c * gamma_term;

        // Invert A^-1 to get A
        RealMatrix m = new Array2DRowRealMatrix(Ai, true);
        m = new LUDecomposition(m).getSolver().getInverse();
        A = m.getData();

        // Reciprocal basis vector lengths
        aStar = sqrt(A[0][0] * A[0][0] + A[1][0] * A[1][0] + A[2][0] * A[2][0]);
        bStar = sqrt(A[0][1] * A[0][1] + A[1][1] * A[1][1] + A[2][1] * A[2][1]);
        cStar = sqrt(A[0][2] * A[0][2] + A[1][2] * A[1][2] + A[2][2] * A[2][2]);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest(format(" Reciprocal Lattice Lengths: (%8.5f, %8.5f, %8.5f)",
                    aStar, bStar, cStar));
        }
        return true;
    }

    /**
     * The B matrix, whose columns are the reciprocal basis vectors.
     *
     * @return a copy of the B matrix.
     */
    public double[][] getB() {
        return mat3Copy(A);
    }

    /**
     * The orientation matrix U.
     *
     * @return a copy of U.
     */
    public double[][] getU() {
        return mat3Copy(U);
    }

    /**
     * Set the orientation matrix, for example with the state of a converged orientation
     * refinement.
     *
     * @param U a proper rotation matrix.
     * @throws IllegalArgumentException if U is not a proper rotation.
     */
    public void setU(double[][] U) {
        double[][] utu = mat3Mat3Multiply(mat3Transpose(U), U);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double expected = (i == j) ? 1.0 : 0.0;
                if (abs(utu[i][j] - expected) > ORTHONORMAL_TOLERANCE) {
                    throw new IllegalArgumentException(" The orientation matrix is not orthonormal.");
                }
            }
        }
        double det = U[0][0] * (U[1][1] * U[2][2] - U[1][2] * U[2][1])
                - U[0][1] * (U[1][0] * U[2][2] - U[1][2] * U[2][0])
                + U[0][2] * (U[1][0] * U[2][1] - U[1][1] * U[2][0]);
        if (det < 0.0) {
            throw new IllegalArgumentException(" The orientation matrix is an improper rotation.");
        }
        this.U = mat3Copy(U);
    }

    /**
     * The setting matrix UB.
     *
     * @return a new matrix U.B.
     */
    public double[][] getUB() {
        return mat3Mat3Multiply(U, A);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(" Unit Cell\n");
        sb.append(format("  A-axis:                              %8.3f\n", a));
        sb.append(format("  B-axis:                              %8.3f\n", b));
        sb.append(format("  C-axis:                              %8.3f\n", c));
        sb.append(format("  Alpha:                               %8.3f\n", alpha));
        sb.append(format("  Beta:                                %8.3f\n", beta));
        sb.append(format("  Gamma:                               %8.3f\n", gamma));
        sb.append(format("  Volume:                              %8.1f", volume));
        return sb.toString();
    }
}
