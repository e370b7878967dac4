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

package org.semql.query.sql;

import org.semql.common.SemqlConfig;
import org.semql.grounding.GroundedField;
import org.semql.query.planner.PlannedJoin;
import org.semql.query.planner.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link QueryPlan} as one SELECT statement. The same plan always renders
 * to the same text.
 */
public class SqlGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SqlGenerator.class);

    private final String tableQuote;
    private final LimitGuardrail guardrail;

    public SqlGenerator(SemqlConfig config) {
        this(config.getTableQuote(), new LimitGuardrail(config.getDefaultLimit()));
    }

    public SqlGenerator(String tableQuote, LimitGuardrail guardrail) {
        this.tableQuote = tableQuote;
        this.guardrail = guardrail;
    }

    /**
     * The statement of {@link #render(QueryPlan)}, with the default limit appended if it has none.
     */
    public String generate(QueryPlan plan) {
        String sql = guardrail.apply(render(plan));
        logger.debug("Generated SQL for explore " + plan.getExplore() + ":\n" + sql);
        return sql;
    }

    public String render(QueryPlan plan) {
        StringBuilder sql = new StringBuilder();

        sql.append("SELECT" + "\n");
        int i = 0;
        for (GroundedField field : plan.getSelectedFields()) {
            if (i > 0)
                sql.append(",\n");
            sql.append("  ").append(field.getResolvedExpression()).append(" AS ").append(field.getSqlAlias());
            i++;
        }
        sql.append("\n");

        sql.append("FROM ").append(quoteTable(plan.getBaseTable())).append(" AS ").append(plan.getBaseAlias()).append("\n");
        for (PlannedJoin join : plan.getJoinPath()) {
            sql.append(join.getType().getKeyword()).append(" ").append(quoteTable(join.getTable())).append(" AS ").append(join.getAlias());
            if (join.getCondition() != null)
                sql.append(" ON ").append(join.getCondition());
            sql.append("\n");
        }

        if (!plan.getFilters().isEmpty()) {
            sql.append("WHERE ");
            for (int f = 0; f < plan.getFilters().size(); f++) {
                if (f > 0)
                    sql.append(" AND ");
                sql.append(plan.getFilters().get(f));
            }
            sql.append("\n");
        }

        appendGroupBy(plan, sql);

        if (plan.getLimit() != null)
            sql.append("LIMIT ").append(plan.getLimit()).append("\n");

        // no trailing newline
        sql.setLength(sql.length() - 1);
        return sql.toString();
    }

    private void appendGroupBy(QueryPlan plan, StringBuilder sql) {
        if (!plan.hasMeasure())
            return;
        StringBuilder ordinals = new StringBuilder();
        int ordinal = 1;
        for (GroundedField field : plan.getSelectedFields()) {
            if (!field.isMeasure()) {
                if (ordinals.length() > 0)
                    ordinals.append(", ");
                ordinals.append(ordinal);
            }
            ordinal++;
        }
        if (ordinals.length() > 0)
            sql.append("GROUP BY ").append(ordinals).append("\n");
    }

    public LimitGuardrail getGuardrail() {
        return guardrail;
    }

    /**
     * Dotted project.dataset.table names are quoted as a whole.
     */
    String quoteTable(String table) {
        if (table.indexOf('.') < 0 || table.startsWith(tableQuote))
            return table;
        return tableQuote + table + tableQuote;
    }
}
