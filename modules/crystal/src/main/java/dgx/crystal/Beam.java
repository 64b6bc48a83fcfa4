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

import static dgx.numerics.math.DoubleMath.length;
import static dgx.numerics.math.DoubleMath.normalize;
import static dgx.numerics.math.DoubleMath.scale;
import static java.lang.String.format;

/**
 * The Beam class describes the incident beam by its direction and wavelength. The incident beam
 * vector s0 points along the beam with length 1 / wavelength.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Beam {

    private double[] unitDirection;
    private double wavelength;

    /**
     * Constructor for Beam.
     *
     * @param direction the beam direction (need not be normalized).
     * @param wavelength the wavelength in Angstroms.
     * @throws IllegalArgumentException for a zero direction or a non-positive wavelength.
     */
    public Beam(double[] direction, double wavelength) {
        if (!(wavelength > 0.0)) {
            throw new IllegalArgumentException(format(" Invalid wavelength %8.5f.", wavelength));
        }
        this.unitDirection = normalize(direction);
        this.wavelength = wavelength;
    }

    /**
     * getS0.
     *
     * @return a new s0 vector.
     */
    public double[] getS0() {
        return scale(unitDirection, 1.0 / wavelength, new double[3]);
    }

    /**
     * Set s0 from a refined state. The wavelength follows from the length of s0.
     *
     * @param s0 the incident beam vector.
     */
    public void setS0(double[] s0) {
        double len = length(s0);
        if (!(len > 0.0)) {
            throw new IllegalArgumentException(" The beam vector must have a positive length.");
        }
        unitDirection = normalize(s0);
        wavelength = 1.0 / len;
    }

    public double[] getUnitDirection() {
        return unitDirection.clone();
    }

    public double getWavelength() {
        return wavelength;
    }

    @Override
    public String toString() {
        return format(" Beam direction (%8.5f, %8.5f, %8.5f), wavelength %8.5f",
                unitDirection[0], unitDirection[1], unitDirection[2], wavelength);
    }
}
