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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the catalog's field-path listing: (table_name, column_name, field_path, data_type, description).
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class ColumnDescriptionRow {

    @JsonProperty("table_name")
    private String tableName;
    @JsonProperty("column_name")
    private String columnName;
    @JsonProperty("field_path")
    private String fieldPath;//nested path for record columns, equals column_name otherwise
    @JsonProperty("data_type")
    private String dataType;
    @JsonProperty("description")
    private String description;

    public ColumnDescriptionRow() {
    }

    public ColumnDescriptionRow(String tableName, String columnName, String fieldPath, String dataType, String description) {
        this.tableName = tableName;
        this.columnName = columnName;
        this.fieldPath = fieldPath;
        this.dataType = dataType;
        this.description = description;
    }

    public String getTableName() {
        return tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getDataType() {
        return dataType;
    }

    public String getDescription() {
        return description;
    }
}
