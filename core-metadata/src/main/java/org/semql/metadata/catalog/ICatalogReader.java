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

/**
 * Read access to the physical catalog, already fetched by an external client.
 */
public interface ICatalogReader {

    /**
     * @param table a bare or fully-qualified, optionally quoted, table name
     * @return the column, or null when the catalog does not know it
     */
    ColumnDesc getColumn(String table, String column);

    TableDesc getTable(String table);

    /**
     * Changes whenever the catalog content changes; equal content gives an equal fingerprint.
     */
    String getFingerprint();
}
