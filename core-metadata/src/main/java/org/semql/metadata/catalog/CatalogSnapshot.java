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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.semql.common.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * Immutable in-memory catalog built from the two catalog row shapes.
 * Table names are matched on their last dotted segment, case-insensitively and without quotes.
 */
public class CatalogSnapshot implements ICatalogReader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSnapshot.class);

    public static final CatalogSnapshot EMPTY = new CatalogSnapshot(Collections.<ColumnRow> emptyList(), Collections.<ColumnDescriptionRow> emptyList());

    private final Map<String, TableDesc> tables;
    private final String fingerprint;

    public CatalogSnapshot(List<ColumnRow> columnRows, List<ColumnDescriptionRow> descriptionRows) {
        Map<String, Map<String, ColumnDesc>> columnsByTable = Maps.newLinkedHashMap();
        for (ColumnRow row : columnRows) {
            String table = normalizeTable(row.getTableName());
            Map<String, ColumnDesc> columns = columnsByTable.get(table);
            if (columns == null) {
                columns = Maps.newLinkedHashMap();
                columnsByTable.put(table, columns);
            }
            columns.put(normalizeColumn(row.getColumnName()), new ColumnDesc(table, row.getColumnName(), row.getDataType(), null, null));
        }

        // descriptions only attach to columns the column listing knows
        int described = 0;
        for (ColumnDescriptionRow row : descriptionRows) {
            Map<String, ColumnDesc> columns = columnsByTable.get(normalizeTable(row.getTableName()));
            String column = normalizeColumn(row.getColumnName());
            if (columns == null || !columns.containsKey(column) || row.getDescription() == null)
                continue;
            columns.put(column, columns.get(column).withDescription(row.getDescription(), row.getFieldPath()));
            described++;
        }

        ImmutableMap.Builder<String, TableDesc> builder = ImmutableMap.builder();
        for (Map.Entry<String, Map<String, ColumnDesc>> entry : columnsByTable.entrySet()) {
            builder.put(entry.getKey(), new TableDesc(entry.getKey(), entry.getValue()));
        }
        this.tables = builder.build();
        this.fingerprint = computeFingerprint(columnRows, descriptionRows);
        logger.debug("Catalog snapshot with " + tables.size() + " tables, " + described + " described columns, fingerprint " + fingerprint);
    }

    @Override
    public TableDesc getTable(String table) {
        return table == null ? null : tables.get(normalizeTable(table));
    }

    @Override
    public ColumnDesc getColumn(String table, String column) {
        TableDesc t = getTable(table);
        return t == null ? null : t.findColumn(column);
    }

    @Override
    public String getFingerprint() {
        return fingerprint;
    }

    public int getTableCount() {
        return tables.size();
    }

    static String normalizeTable(String table) {
        return StringUtil.normalizeIdentifier(StringUtil.lastSegment(StringUtil.stripQuotes(table)));
    }

    private static String normalizeColumn(String column) {
        return StringUtil.normalizeIdentifier(StringUtil.stripQuotes(column));
    }

    private static String computeFingerprint(List<ColumnRow> columnRows, List<ColumnDescriptionRow> descriptionRows) {
        List<String> lines = Lists.newArrayList();
        for (ColumnRow row : columnRows) {
            lines.add("C|" + row.getTableName() + "|" + row.getColumnName() + "|" + row.getDataType());
        }
        for (ColumnDescriptionRow row : descriptionRows) {
            lines.add("D|" + row.getTableName() + "|" + row.getColumnName() + "|" + row.getFieldPath() + "|" + row.getDataType() + "|" + row.getDescription());
        }
        Collections.sort(lines);

        Hasher hasher = Hashing.murmur3_128().newHasher();
        for (String line : lines) {
            hasher.putString(line, StandardCharsets.UTF_8).putChar('\n');
        }
        return hasher.hash().toString();
    }
}
