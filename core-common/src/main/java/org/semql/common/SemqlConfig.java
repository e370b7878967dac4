/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/

package org.semql.common;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Enumeration;
import java.util.Properties;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates and loads semql.properties.
 *
 * Lookup order: the SEMQL_CONF system property (a directory), $SEMQL_HOME/conf,
 * then semql.properties on the classpath. A sibling "semql.properties.override"
 * file is layered on top of a file found on disk.
 */
public class SemqlConfig extends SemqlConfigBase {
    private static final long serialVersionUID = 1L;
    private static final Logger logger = LoggerFactory.getLogger(SemqlConfig.class);

    public static final String SEMQL_CONF_PROPERTIES_FILE = "semql.properties";
    public static final String SEMQL_CONF = "SEMQL_CONF";

    // static cached instances
    private static SemqlConfig ENV_INSTANCE = null;

    public static SemqlConfig getInstanceFromEnv() {
        synchronized (SemqlConfig.class) {
            if (ENV_INSTANCE == null) {
                try {
                    SemqlConfig config = new SemqlConfig();
                    config.reloadSemqlConfig(getSemqlProperties());

                    logger.info("Initialized a new SemqlConfig from getInstanceFromEnv : " + System.identityHashCode(config));
                    ENV_INSTANCE = config;
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("Failed to find SemqlConfig ", e);
                }
            }
            return ENV_INSTANCE;
        }
    }

    //Only used in test cases!!!
    public static void destroyInstance() {
        logger.info("Destroy SemqlConfig");
        ENV_INSTANCE = null;
    }

    public static SemqlConfig createSemqlConfig(String propsInStr) throws IOException {
        Properties props = new Properties();
        props.load(new StringReader(propsInStr));
        return createSemqlConfig(props);
    }

    public static SemqlConfig createSemqlConfig(SemqlConfig another) {
        Properties copy = new Properties();
        copy.putAll(another.getAllProperties());
        return createSemqlConfig(copy);
    }

    public static SemqlConfig createSemqlConfig(Properties prop) {
        SemqlConfig semqlConfig = new SemqlConfig();
        semqlConfig.reloadSemqlConfig(prop);
        return semqlConfig;
    }

    /**
     * Resolve the properties file from $SEMQL_CONF first, then $SEMQL_HOME/conf.
     * Returns null when neither is set.
     */
    static File getSemqlPropertiesFile() {
        String semqlConfHome = System.getProperty(SEMQL_CONF);
        if (!StringUtils.isEmpty(semqlConfHome)) {
            logger.info("Use SEMQL_CONF=" + semqlConfHome);
            return new File(semqlConfHome, SEMQL_CONF_PROPERTIES_FILE);
        }

        String semqlHome = getSemqlHome();
        if (StringUtils.isEmpty(semqlHome))
            return null;

        return new File(semqlHome + File.separator + "conf", SEMQL_CONF_PROPERTIES_FILE);
    }

    public static Properties getSemqlProperties() {
        Properties conf = new Properties();
        File propFile = getSemqlPropertiesFile();
        try {
            if (propFile != null && propFile.exists()) {
                loadInto(conf, propFile);

                File propOverrideFile = new File(propFile.getParentFile(), propFile.getName() + ".override");
                if (propOverrideFile.exists()) {
                    Properties propOverride = new Properties();
                    loadInto(propOverride, propOverrideFile);
                    conf.putAll(propOverride);
                }
                return conf;
            }

            InputStream is = SemqlConfig.class.getClassLoader().getResourceAsStream(SEMQL_CONF_PROPERTIES_FILE);
            if (is != null) {
                try {
                    conf.load(is);
                } finally {
                    IOUtils.closeQuietly(is);
                }
                logger.info("Loaded " + SEMQL_CONF_PROPERTIES_FILE + " from classpath");
            } else {
                logger.warn("Fail to locate " + SEMQL_CONF_PROPERTIES_FILE + ", built-in defaults are used");
            }
        } catch (IOException e) {
            throw new SemqlConfigCannotInitException("Failed to read " + SEMQL_CONF_PROPERTIES_FILE, e);
        }
        return conf;
    }

    private static void loadInto(Properties props, File file) throws IOException {
        FileInputStream is = new FileInputStream(file);
        try {
            props.load(is);
        } finally {
            IOUtils.closeQuietly(is);
        }
    }

    // ============================================================================

    private SemqlConfig() {
        super();
    }

    public String getConfigAsString() {
        final StringWriter stringWriter = new StringWriter();
        PrintWriter out = new PrintWriter(stringWriter);
        Properties props = getAllProperties();
        for (Enumeration<?> e = props.keys(); e.hasMoreElements();) {
            String key = (String) e.nextElement();
            out.println(key + "=" + props.getProperty(key));
        }
        out.flush();
        return stringWriter.toString();
    }
}
