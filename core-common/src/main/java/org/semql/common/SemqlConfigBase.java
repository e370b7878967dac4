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

import java.io.Serializable;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed accessors over the raw semql properties.
 * A JVM system property with the same key always wins over the file value.
 */
@SuppressWarnings("serial")
public class SemqlConfigBase implements Serializable {

    private static final Logger logger = LoggerFactory.getLogger(SemqlConfigBase.class);

    public static final String SEMQL_HOME = "SEMQL_HOME";

    public static final String DEFAULT_PLANNER = "org.semql.query.planner.RuleBasedQueryPlanner";

    public static String getSemqlHome() {
        String semqlHome = System.getenv(SEMQL_HOME);
        if (StringUtils.isEmpty(semqlHome)) {
            logger.warn("SEMQL_HOME was not set");
        }
        return semqlHome;
    }

    // ============================================================================

    private volatile Properties properties = new Properties();

    public SemqlConfigBase() {
        this(new Properties());
    }

    public SemqlConfigBase(Properties props) {
        this.properties = props;
    }

    protected String getOptional(String prop) {
        return getOptional(prop, null);
    }

    protected String getOptional(String prop, String dft) {
        final String property = System.getProperty(prop);
        return property != null ? property : properties.getProperty(prop, dft);
    }

    protected Properties getAllProperties() {
        return properties;
    }

    /**
     * Use with care, properties should be read-only. This is for testing mostly.
     */
    public void setProperty(String key, String value) {
        logger.info("SemQL Config was updated with " + key + " : " + value);
        properties.setProperty(key, value);
    }

    protected void reloadSemqlConfig(Properties properties) {
        this.properties = properties;
    }

    private int getPositiveInt(String prop, String dft) {
        String value = getOptional(prop, dft);
        int result;
        try {
            result = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + prop + "' must be an integer, but it is " + value, e);
        }
        if (result <= 0) {
            throw new IllegalArgumentException("'" + prop + "' must be positive, but it is " + result);
        }
        return result;
    }

    // ============================================================================
    // GENERATOR
    // ============================================================================

    public int getDefaultLimit() {
        return getPositiveInt("semql.generator.default-limit", "100");
    }

    public int getMaxJoins() {
        return getPositiveInt("semql.generator.max-joins", "10");
    }

    public boolean isDryRunEnabled() {
        return Boolean.parseBoolean(getOptional("semql.generator.dry-run-enabled", "false"));
    }

    public String getTableQuote() {
        return getOptional("semql.sql.table-quote", "`");
    }

    // ============================================================================
    // METADATA
    // ============================================================================

    public int getExpressionMaxDepth() {
        return getPositiveInt("semql.expression.max-depth", "5");
    }

    public boolean isGroundingCacheEnabled() {
        return Boolean.parseBoolean(getOptional("semql.grounding.cache-enabled", "true"));
    }

    // ============================================================================
    // QUERY
    // ============================================================================

    public String getQueryPlanner() {
        return getOptional("semql.query.planner", DEFAULT_PLANNER);
    }

    public double getAmbiguityEpsilon() {
        String value = getOptional("semql.query.ambiguity-epsilon", "0.25");
        double epsilon;
        try {
            epsilon = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'semql.query.ambiguity-epsilon' must be a number, but it is " + value, e);
        }
        if (epsilon < 0) {
            throw new IllegalArgumentException("'semql.query.ambiguity-epsilon' must not be negative, but it is " + epsilon);
        }
        return epsilon;
    }
}
