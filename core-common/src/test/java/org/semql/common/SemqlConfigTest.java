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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Properties;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SemqlConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(SemqlConfig.SEMQL_CONF);
        System.clearProperty("semql.generator.default-limit");
        SemqlConfig.destroyInstance();
    }

    @Test
    void defaults_apply_when_nothing_is_configured() {
        SemqlConfig config = SemqlConfig.createSemqlConfig(new Properties());

        assertEquals(100, config.getDefaultLimit());
        assertEquals(10, config.getMaxJoins());
        assertFalse(config.isDryRunEnabled());
        assertEquals(5, config.getExpressionMaxDepth());
        assertTrue(config.isGroundingCacheEnabled());
        assertEquals(SemqlConfigBase.DEFAULT_PLANNER, config.getQueryPlanner());
        assertEquals(0.25, config.getAmbiguityEpsilon(), 1e-9);
        assertEquals("`", config.getTableQuote());
    }

    @Test
    void system_property_wins_over_file_value() throws Exception {
        SemqlConfig config = SemqlConfig.createSemqlConfig("semql.generator.default-limit=50\nsemql.generator.max-joins=3\n");
        assertEquals(50, config.getDefaultLimit());
        assertEquals(3, config.getMaxJoins());

        System.setProperty("semql.generator.default-limit", "7");
        assertEquals(7, config.getDefaultLimit());
    }

    @Test
    void rejects_invalid_numbers() throws Exception {
        SemqlConfig config = SemqlConfig.createSemqlConfig("semql.generator.default-limit=0\nsemql.generator.max-joins=many\nsemql.query.ambiguity-epsilon=-1\n");

        assertThrows(IllegalArgumentException.class, () -> config.getDefaultLimit());
        assertThrows(IllegalArgumentException.class, () -> config.getMaxJoins());
        assertThrows(IllegalArgumentException.class, () -> config.getAmbiguityEpsilon());
    }

    @Test
    void override_file_is_layered_on_top(@TempDir Path dir) throws Exception {
        File conf = dir.toFile();
        FileUtils.writeStringToFile(new File(conf, "semql.properties"), "semql.generator.default-limit=20\nsemql.generator.max-joins=4\n", StandardCharsets.UTF_8);
        FileUtils.writeStringToFile(new File(conf, "semql.properties.override"), "semql.generator.max-joins=2\n", StandardCharsets.UTF_8);
        System.setProperty(SemqlConfig.SEMQL_CONF, conf.getAbsolutePath());

        SemqlConfig config = SemqlConfig.getInstanceFromEnv();
        assertEquals(20, config.getDefaultLimit());
        assertEquals(2, config.getMaxJoins());
        assertSame(config, SemqlConfig.getInstanceFromEnv());
    }

    @Test
    void copies_are_independent() {
        SemqlConfig base = SemqlConfig.createSemqlConfig(new Properties());
        SemqlConfig copy = SemqlConfig.createSemqlConfig(base);
        copy.setProperty("semql.generator.max-joins", "1");

        assertEquals(10, base.getMaxJoins());
        assertEquals(1, copy.getMaxJoins());
        assertTrue(copy.getConfigAsString().contains("semql.generator.max-joins=1"));
    }
}
