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

import static java.lang.String.format;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * Base class of the DGX unit tests.
 * <p>
 * The "dgx" loggers run at the level given by the dgx.test.log System property (default WARNING),
 * so that settings tables logged at INFO do not flood the test output. System properties set by a
 * test are rolled back after it, since {@link PropertyUtils} layers them over every property file.
 * A test may also request a scratch directory for property files; it is removed after the test.
 *
 * @author Michael J. Schnieders
 */
public abstract class DGXTest {

  protected static final Logger logger = Logger.getLogger(DGXTest.class.getName());

  /** Parent of every DGX logger; held so that its level is not lost to garbage collection. */
  private static final Logger dgxLogger = Logger.getLogger("dgx");
  private static final Level testLevel = parseLevel("dgx.test.log", Level.WARNING);
  private static Level savedLevel;

  private Properties savedProperties;
  private Path scratchDirectory;

  /**
   * Parse a logging level from a System property.
   *
   * @param key the System property.
   * @param defaultLevel level used if the property is unset or invalid.
   * @return the level.
   */
  static Level parseLevel(String key, Level defaultLevel) {
    String value = System.getProperty(key);
    if (value == null) {
      return defaultLevel;
    }
    try {
      return Level.parse(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Ignoring %s=%s: %s", key, value, e.getMessage()));
      return defaultLevel;
    }
  }

  @BeforeClass
  public static void setTestLogLevel() {
    savedLevel = dgxLogger.getLevel();
    dgxLogger.setLevel(testLevel);
  }

  @AfterClass
  public static void restoreLogLevel() {
    dgxLogger.setLevel(savedLevel);
  }

  @Before
  public void saveSystemProperties() {
    savedProperties = new Properties();
    savedProperties.putAll(System.getProperties());
  }

  @After
  public void restoreSystemProperties() {
    System.setProperties(savedProperties);
    deleteScratchDirectory();
  }

  /**
   * Create a scratch directory that is deleted after the current test. A second call replaces
   * the first directory.
   *
   * @return the directory.
   */
  public Path registerTemporaryDirectory() {
    deleteScratchDirectory();
    try {
      scratchDirectory = Files.createTempDirectory("dgx-test");
    } catch (IOException e) {
      fail(format(" Could not create a scratch directory: %s", e));
    }
    return scratchDirectory;
  }

  private void deleteScratchDirectory() {
    if (scratchDirectory != null) {
      try {
        FileUtils.deleteDirectory(scratchDirectory.toFile());
      } catch (IOException e) {
        fail(format(" Could not delete %s: %s", scratchDirectory, e));
      }
      scratchDirectory = null;
    }
  }
}
