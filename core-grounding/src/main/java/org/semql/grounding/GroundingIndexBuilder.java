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

package org.semql.grounding;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;
import org.semql.metadata.catalog.ColumnDesc;
import org.semql.metadata.catalog.ICatalogReader;
import org.semql.metadata.expression.ExpressionException;
import org.semql.metadata.expression.ExpressionResolver;
import org.semql.metadata.model.AggregationType;
import org.semql.metadata.model.DimensionDesc;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.FieldDesc;
import org.semql.metadata.model.MeasureDesc;
import org.semql.metadata.model.ValueKind;
import org.semql.metadata.model.ViewDesc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Builds the {@link GroundingIndex} of one explore by resolving every visible field
 * and attaching the catalog type and description of the column behind it.
 */
public class GroundingIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GroundingIndexBuilder.class);

    public static final String COUNT_TYPE = "INT64";

    // ${TABLE}.column
    private static final Pattern TABLE_COLUMN = Pattern.compile("\\s*\\$\\{TABLE\\}\\.`?(\\w+)`?\\s*", Pattern.CASE_INSENSITIVE);
    // ${field} or ${view.field}
    private static final Pattern SINGLE_REF = Pattern.compile("\\s*\\$\\{(?:(\\w+)\\.)?(\\w+)\\}\\s*");

    private final ICatalogReader catalog;
    private final ExpressionResolver resolver;

    public GroundingIndexBuilder(ICatalogReader catalog, ExpressionResolver resolver) {
        this.catalog = catalog;
        this.resolver = resolver;
    }

    public GroundingIndex build(ExploreGraph explore) {
        List<GroundedField> fields = Lists.newArrayList();
        Set<String> excluded = Sets.newLinkedHashSet();

        for (ViewDesc view : explore.getViews()) {
            for (FieldDesc field : view.getFields()) {
                if (field.isHidden())
                    continue;

                Set<String> touched = Sets.newTreeSet();
                String sql;
                try {
                    sql = resolver.resolveField(explore, field, touched);
                } catch (ExpressionException e) {
                    logger.warn("Excluding " + field.getQualifiedName() + " from explore " + explore.getName() + ": " + e.getMessage());
                    excluded.add(field.getQualifiedName());
                    continue;
                }
                touched.add(view.getName());

                ColumnDesc column = findBackingColumn(explore, field, 0);
                fields.add(new GroundedField(view.getName(), field.getName(), sql, physicalType(field, column), mergeDescription(field, column), //
                        field.isMeasure(), valueKindOf(field), field.isMeasure() ? ((MeasureDesc) field).getAggregationType() : null, touched, fields.size()));
            }
        }

        GroundingIndex index = new GroundingIndex(explore, catalog.getFingerprint(), fields, excluded);
        logger.info("Built " + index + (excluded.isEmpty() ? "" : ", excluded " + excluded));
        return index;
    }

    /**
     * The catalog column a field reads directly, following single-reference chains
     * such as ${sale_price} to ${TABLE}.sale_price. Null for computed expressions.
     */
    private ColumnDesc findBackingColumn(ExploreGraph explore, FieldDesc field, int depth) {
        if (depth > resolver.getMaxDepth())
            return null;

        String sql = field.isMeasure() ? field.getSql() : ((DimensionDesc) field).getExpression();
        if (sql == null)
            return null;

        Matcher m = TABLE_COLUMN.matcher(sql);
        if (m.matches())
            return catalog.getColumn(field.getView().getSqlTableName(), m.group(1));

        m = SINGLE_REF.matcher(sql);
        if (m.matches()) {
            ViewDesc view = m.group(1) == null ? field.getView() : explore.getView(m.group(1));
            FieldDesc ref = view == null ? null : view.findField(m.group(2));
            return ref == null ? null : findBackingColumn(explore, ref, depth + 1);
        }
        return null;
    }

    private static String physicalType(FieldDesc field, ColumnDesc column) {
        if (field.isMeasure()) {
            AggregationType agg = ((MeasureDesc) field).getAggregationType();
            if (agg == AggregationType.COUNT || agg == AggregationType.COUNT_DISTINCT)
                return COUNT_TYPE;
        }
        return column == null ? null : column.getDataType();
    }

    /**
     * Semantic description first, then the catalog's, else empty.
     */
    static String mergeDescription(FieldDesc field, ColumnDesc column) {
        if (StringUtils.isNotBlank(field.getDescription()))
            return field.getDescription().trim();
        if (column != null && StringUtils.isNotBlank(column.getDescription()))
            return column.getDescription().trim();
        return "";
    }

    private static ValueKind valueKindOf(FieldDesc field) {
        return field.isMeasure() ? ((MeasureDesc) field).getValueKind() : ((DimensionDesc) field).getValueKind();
    }
}
