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
package dgx.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import org.junit.Test;

/**
 * Test the logging and scratch directory support of DGXTest.
 *
 * @author Michael J. Schnieders
 */
public class DGXTestLevelTest extends DGXTest {

  @Test
  public void testParseLevel() {
    System.clearProperty("dgx.level.check");
    assertEquals(Level.WARNING, parseLevel("dgx.level.check", Level.WARNING));
    System.setProperty("dgx.level.check", " fine ");
    assertEquals(Level.FINE, parseLevel("dgx.level.check", Level.WARNING));
    System.setProperty("dgx.level.check", "loud");
    assertEquals(Level.INFO, parseLevel("dgx.level.check", Level.INFO));
  }

  @Test
  public void testPropertyIsolation() {
    // Properties set here are rolled back before the next test.
    assertNull(System.getProperty("dgx.isolation.check"));
    System.setProperty("dgx.isolation.check", "set");
  }

  @Test
  public void testPropertyIsolationAgain() {
    assertNull(System.getProperty("dgx.isolation.check"));
    System.setProperty("dgx.isolation.check", "set");
  }

  @Test
  public void testScratchDirectory() {
    Path first = registerTemporaryDirectory();
    assertTrue(Files.isDirectory(first));
    Path second = registerTemporaryDirectory();
    assertTrue(Files.notExists(first));
    assertTrue(Files.isDirectory(second));
  }
}
