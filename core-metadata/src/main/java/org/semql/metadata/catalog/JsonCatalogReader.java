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

package org.semql.metadata.catalog;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.semql.common.util.JsonUtil;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;

/**
 * Loads a catalog snapshot from JSON of the form
 * {"columns": [ColumnRow...], "column_descriptions": [ColumnDescriptionRow...]}.
 */
public class JsonCatalogReader {

    public static CatalogSnapshot read(InputStream in) throws IOException {
        CatalogRows rows = JsonUtil.readValue(in, CatalogRows.class);
        return rows.toSnapshot();
    }

    public static CatalogSnapshot read(File file) throws IOException {
        CatalogRows rows = JsonUtil.readValue(file, CatalogRows.class);
        return rows.toSnapshot();
    }

    public static CatalogSnapshot readResource(String resource) throws IOException {
        InputStream in = JsonCatalogReader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new IOException("Catalog resource not found: " + resource);
        try {
            return read(in);
        } finally {
            IOUtils.closeQuietly(in);
        }
    }

    @JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
    static class CatalogRows {
        @JsonProperty("columns")
        private List<ColumnRow> columns = Lists.newArrayList();
        @JsonProperty("column_descriptions")
        private List<ColumnDescriptionRow> descriptions = Lists.newArrayList();

        CatalogSnapshot toSnapshot() {
            return new CatalogSnapshot(columns == null ? Lists.<ColumnRow> newArrayList() : columns, descriptions == null ? Lists.<ColumnDescriptionRow> newArrayList() : descriptions);
        }
    }
}
