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

package org.semql.query.planner;

import org.semql.metadata.model.JoinType;

/**
 * One join of a plan, with its ON condition already resolved to aliases.
 */
public class PlannedJoin {

    private final String alias;
    private final String table;
    private final JoinType type;
    private final String condition;//null for CROSS joins

    public PlannedJoin(String alias, String table, JoinType type, String condition) {
        this.alias = alias;
        this.table = table;
        this.type = type;
        this.condition = condition;
    }

    public String getAlias() {
        return alias;
    }

    public String getTable() {
        return table;
    }

    public JoinType getType() {
        return type;
    }

    public String getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return type.getKeyword() + " " + alias;
    }
}
