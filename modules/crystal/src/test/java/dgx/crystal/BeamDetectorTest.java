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

import static org.junit.Assert.assertEquals;

import dgx.utilities.DGXTest;
import org.junit.Test;

/**
 * Test the Beam and Detector models.
 *
 * @author Michael J. Schnieders
 */
public class BeamDetectorTest extends DGXTest {

    private static final double TOL = 1.0e-12;

    @Test
    public void testBeamVector() {
        Beam beam = new Beam(new double[]{0.0, 0.0, -2.0}, 0.5);
        double[] s0 = beam.getS0();
        assertEquals(0.0, s0[0], TOL);
        assertEquals(0.0, s0[1], TOL);
        assertEquals(-2.0, s0[2], TOL);

        beam.setS0(new double[]{0.0, 1.0, 0.0});
        assertEquals(1.0, beam.getWavelength(), TOL);
        assertEquals(1.0, beam.getUnitDirection()[1], TOL);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidWavelength() {
        new Beam(new double[]{0.0, 0.0, -1.0}, 0.0);
    }

    @Test
    public void testDetectorGeometry() {
        Detector detector = new Detector(new double[]{-10.0, 20.0, -100.0},
                new double[]{1.0, 0.0, 0.0}, new double[]{0.0, -1.0, 0.0});
        double[] normal = detector.getNormal();
        assertEquals(0.0, normal[0], TOL);
        assertEquals(0.0, normal[1], TOL);
        assertEquals(-1.0, normal[2], TOL);
        assertEquals(100.0, detector.getDistance(), TOL);

        double[] xyz = detector.getLabCoordinate(5.0, 2.0);
        assertEquals(-5.0, xyz[0], TOL);
        assertEquals(18.0, xyz[1], TOL);
        assertEquals(-100.0, xyz[2], TOL);
    }

    @Test
    public void testSetOrigin() {
        Detector detector = new Detector(new double[]{0.0, 0.0, -100.0},
                new double[]{1.0, 0.0, 0.0}, new double[]{0.0, -1.0, 0.0});
        double[] refined = {0.5, -0.25, -101.5};
        detector.setOrigin(refined);
        refined[2] = 0.0;
        assertEquals(-101.5, detector.getOrigin()[2], TOL);
        assertEquals(101.5, detector.getDistance(), TOL);
        double[] xyz = detector.getLabCoordinate(1.0, 1.0);
        assertEquals(1.5, xyz[0], TOL);
        assertEquals(-1.25, xyz[1], TOL);
        assertEquals(-101.5, xyz[2], TOL);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonOrthogonalAxes() {
        new Detector(new double[3], new double[]{1.0, 0.0, 0.0}, new double[]{0.6, 0.8, 0.0});
    }
}
