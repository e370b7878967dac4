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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.metadata.ModelFixtures;

import com.google.common.collect.Lists;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CatalogSnapshotTest {

    @Test
    void matches_tables_on_last_segment_without_quotes() throws Exception {
        CatalogSnapshot catalog = ModelFixtures.thelookCatalog();

        ColumnDesc column = catalog.getColumn("`bigquery-public-data.thelook_ecommerce.users`", "TRAFFIC_SOURCE");
        assertEquals("STRING", column.getDataType());
        assertEquals("Marketing channel or device the user signed up through", column.getDescription());
        assertEquals("traffic_source", column.getFieldPath());
        assertEquals(4, catalog.getTableCount());
    }

    @Test
    void unknown_columns_are_null() throws Exception {
        CatalogSnapshot catalog = ModelFixtures.thelookCatalog();

        assertNull(catalog.getColumn("users", "nothing"));
        assertNull(catalog.getColumn("inventory_items", "id"));
        // description rows never invent columns
        assertNull(catalog.getColumn("products", "missing_column"));
        assertNull(catalog.getColumn("users", "age").getDescription());
    }

    @Test
    void fingerprint_ignores_row_order_but_not_content() {
        List<ColumnRow> rows = Lists.newArrayList(new ColumnRow("t", "a", "INT64"), new ColumnRow("t", "b", "STRING"));
        List<ColumnRow> reversed = Lists.reverse(rows);
        List<ColumnDescriptionRow> none = Collections.emptyList();

        String fingerprint = new CatalogSnapshot(rows, none).getFingerprint();
        assertEquals(fingerprint, new CatalogSnapshot(reversed, none).getFingerprint());

        List<ColumnRow> changed = Lists.newArrayList(new ColumnRow("t", "a", "INT64"), new ColumnRow("t", "b", "BYTES"));
        assertNotEquals(fingerprint, new CatalogSnapshot(changed, none).getFingerprint());
        assertNotEquals(fingerprint, CatalogSnapshot.EMPTY.getFingerprint());
    }
}
