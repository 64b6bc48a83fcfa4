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

import static dgx.numerics.math.DoubleMath.X;
import static dgx.numerics.math.DoubleMath.addScaled;
import static dgx.numerics.math.DoubleMath.dot;
import static dgx.numerics.math.DoubleMath.length;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;

/**
 * The Detector class describes a flat detector panel by the laboratory position of its origin and
 * two orthonormal in-plane axes. Distances are in millimetres.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Detector {

    private static final double AXIS_TOLERANCE = 1.0e-6;

    private double[] origin;
    private final double[] fastAxis;
    private final double[] slowAxis;
    private final double[] normal;

    /**
     * Constructor for Detector.
     *
     * @param origin laboratory position of the panel origin.
     * @param fastAxis unit vector along the fast pixel direction.
     * @param slowAxis unit vector along the slow pixel direction.
     * @throws IllegalArgumentException if the axes are not orthonormal.
     */
    public Detector(double[] origin, double[] fastAxis, double[] slowAxis) {
        if (abs(length(fastAxis) - 1.0) > AXIS_TOLERANCE
                || abs(length(slowAxis) - 1.0) > AXIS_TOLERANCE
                || abs(dot(fastAxis, slowAxis)) > AXIS_TOLERANCE) {
            throw new IllegalArgumentException(" Detector fast and slow axes must be orthonormal.");
        }
        this.origin = origin.clone();
        this.fastAxis = fastAxis.clone();
        this.slowAxis = slowAxis.clone();
        this.normal = X(fastAxis, slowAxis);
    }

    /**
     * Laboratory coordinate of a point on the panel.
     *
     * @param x distance along the fast axis.
     * @param y distance along the slow axis.
     * @return a new laboratory coordinate.
     */
    public double[] getLabCoordinate(double x, double y) {
        double[] xyz = addScaled(origin, x, fastAxis, new double[3]);
        return addScaled(xyz, y, slowAxis, xyz);
    }

    public double[] getOrigin() {
        return origin.clone();
    }

    /**
     * Set the panel origin, for example with the state of a converged refinement.
     *
     * @param origin the new laboratory position of the panel origin.
     */
    public void setOrigin(double[] origin) {
        this.origin = origin.clone();
    }

    public double[] getFastAxis() {
        return fastAxis.clone();
    }

    public double[] getSlowAxis() {
        return slowAxis.clone();
    }

    /**
     * The panel normal, fast x slow.
     *
     * @return a copy of the normal.
     */
    public double[] getNormal() {
        return normal.clone();
    }

    /**
     * Distance from the laboratory origin to the panel plane along the normal.
     *
     * @return the distance.
     */
    public double getDistance() {
        return dot(origin, normal);
    }

    @Override
    public String toString() {
        return format(" Detector origin (%8.3f, %8.3f, %8.3f), distance %8.3f",
                origin[0], origin[1], origin[2], getDistance());
    }
}
