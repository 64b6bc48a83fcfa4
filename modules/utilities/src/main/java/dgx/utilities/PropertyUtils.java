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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The PropertyUtils class builds the layered configuration used to set up refinement.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PropertyUtils {

    private static final Logger logger = Logger.getLogger(PropertyUtils.class.getName());

    /** Name of the environment variable that points to a system wide property file. */
    public static final String DGX_PROPERTIES = "DGX_PROPERTIES";

    private PropertyUtils() {
        // Prevent instantiation.
    }

    /**
     * Load the properties for an input file. Earlier sources take precedence:
     * <p>
     * 1.) JVM system properties (i.e. -Dkey=value pairs).
     * <p>
     * 2.) Input specific properties (input.properties or input.prop next to the input file).
     * <p>
     * 3.) User specific properties (~/.dgx/dgx.properties).
     * <p>
     * 4.) System wide properties (file defined by environment variable DGX_PROPERTIES).
     *
     * @param file The input file, or null if there is none.
     * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
     * @since 1.0
     */
    public static CompositeConfiguration loadProperties(@Nullable File file) {
        CompositeConfiguration properties = new CompositeConfiguration();

        /*
            JVM system properties are read first.
            a.) -Dkey=value from the Java command line
            b.) System.setProperty("key","value") within Java code.
         */
        PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
        systemConfiguration.append(new SystemConfiguration());
        systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
        properties.addConfiguration(systemConfiguration);

        // Input specific options are 2nd.
        if (file != null) {
            String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
            String propertyFilename =
                    (new File(basename + ".properties").exists()) ? basename + ".properties"
                            : (new File(basename + ".prop").exists()) ? basename + ".prop"
                            : null;
            if (propertyFilename != null) {
                File inputPropFile = new File(propertyFilename);
                PropertiesConfiguration inputConfiguration = readPropertyFile(inputPropFile);
                if (inputConfiguration != null) {
                    inputConfiguration.setHeader("Input properties from (" + propertyFilename + ").");
                    properties.addConfiguration(inputConfiguration);
                    try {
                        properties.addProperty("propertyFile", inputPropFile.getCanonicalPath());
                    } catch (IOException e) {
                        logger.log(Level.INFO, " Error resolving {0}.", propertyFilename);
                    }
                }
            }
        }

        // User specific options are 3rd.
        String filename = System.getProperty("user.home") + File.separator + ".dgx/dgx.properties";
        PropertiesConfiguration userConfiguration = readPropertyFile(new File(filename));
        if (userConfiguration != null) {
            userConfiguration.setHeader("DGX user property file (" + filename + ").");
            properties.addConfiguration(userConfiguration);
        }

        // System wide options are last.
        filename = System.getenv(DGX_PROPERTIES);
        if (filename != null) {
            PropertiesConfiguration envConfiguration = readPropertyFile(new File(filename));
            if (envConfiguration != null) {
                envConfiguration.setHeader("Environment variable DGX_PROPERTIES (" + filename + ").");
                properties.addConfiguration(envConfiguration);
            }
        }

        // Echo the interpolated configuration.
        if (logger.isLoggable(Level.FINE)) {
            Iterator<String> i = properties.getKeys();
            StringBuilder sb = new StringBuilder();
            sb.append(format("\n %-30s %s\n", "Property", "Value"));
            while (i.hasNext()) {
                String s = i.next();
                sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
            }
            logger.fine(sb.toString());
        }

        return properties;
    }

    /**
     * Read a single property file.
     *
     * @param propertyFile The file to read.
     * @return The configuration, or null if the file is missing, unreadable or malformed.
     */
    @Nullable
    private static PropertiesConfiguration readPropertyFile(File propertyFile) {
        if (!propertyFile.exists() || !propertyFile.canRead()) {
            return null;
        }
        try {
            FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
                    new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
                            .configure(new Parameters().properties()
                                    .setFile(propertyFile)
                                    .setThrowExceptionOnMissing(true)
                                    .setIncludesAllowed(false));
            return builder.getConfiguration();
        } catch (ConfigurationException e) {
            logger.log(Level.INFO, " Error loading {0}.", propertyFile.getPath());
            return null;
        }
    }
}
