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

import com.google.common.base.MoreObjects;

/**
 * A physical column as the catalog reports it.
 */
public class ColumnDesc {

    private final String tableName;
    private final String name;
    private final String dataType;
    private final String description;
    private final String fieldPath;

    public ColumnDesc(String tableName, String name, String dataType, String description, String fieldPath) {
        this.tableName = tableName;
        this.name = name;
        this.dataType = dataType;
        this.description = description;
        this.fieldPath = fieldPath;
    }

    ColumnDesc withDescription(String description, String fieldPath) {
        return new ColumnDesc(tableName, name, dataType, description, fieldPath);
    }

    public String getTableName() {
        return tableName;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    public String getDescription() {
        return description;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("table", tableName).add("name", name).add("type", dataType).toString();
    }
}
