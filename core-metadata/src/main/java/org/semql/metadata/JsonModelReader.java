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

package org.semql.metadata;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.io.IOUtils;
import org.semql.common.util.JsonUtil;
import org.semql.metadata.model.ProjectDesc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the model-file parser's output, a JSON document of the form
 * {"models": [{"name", "views": [...], "explores": [...]}], "views": [...]}.
 */
public class JsonModelReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonModelReader.class);

    public static ProjectDesc read(InputStream in) throws IOException {
        return JsonUtil.readValue(in, ProjectDesc.class);
    }

    public static ProjectDesc read(File file) throws IOException {
        logger.info("Reading semantic model from " + file.getAbsolutePath());
        return JsonUtil.readValue(file, ProjectDesc.class);
    }

    public static ProjectDesc readResource(String resource) throws IOException {
        InputStream in = JsonModelReader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new IOException("Model resource not found: " + resource);
        try {
            return read(in);
        } finally {
            IOUtils.closeQuietly(in);
        }
    }
}
