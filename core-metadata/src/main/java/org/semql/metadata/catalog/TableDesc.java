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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import org.semql.common.util.StringUtil;

/**
 * A physical table with its columns in catalog order.
 */
public class TableDesc {

    private final String name;
    private final Map<String, ColumnDesc> columns;//keyed by lower-cased column name

    TableDesc(String name, Map<String, ColumnDesc> columns) {
        this.name = name;
        this.columns = Collections.unmodifiableMap(columns);
    }

    public String getName() {
        return name;
    }

    public ColumnDesc findColumn(String columnName) {
        return columnName == null ? null : columns.get(StringUtil.normalizeIdentifier(StringUtil.stripQuotes(columnName)));
    }

    public Collection<ColumnDesc> getColumns() {
        return columns.values();
    }

    @Override
    public String toString() {
        return "TableDesc [name=" + name + ", columns=" + columns.size() + "]";
    }
}
