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

package org.semql.metadata.expression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Set;
import java.util.regex.Pattern;

import org.semql.common.SemqlConfig;
import org.semql.metadata.model.AggregationType;
import org.semql.metadata.model.DimensionDesc;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.FieldDesc;
import org.semql.metadata.model.MeasureDesc;
import org.semql.metadata.model.ViewDesc;

/**
 * Rewrites placeholder expressions into alias-qualified SQL for one explore.
 * <ul>
 * <li>${TABLE} becomes the alias of the view owning the expression</li>
 * <li>${view.field} and ${field} become the referenced field's resolved expression,
 * or its aggregate form when the field is a measure</li>
 * </ul>
 * Text without placeholders is returned as is. Stateless, safe to share.
 */
public class ExpressionResolver {

    // a.b.c, `a`.b, 42
    private static final Pattern SIMPLE_PATH = Pattern.compile("[A-Za-z_`][\\w`]*(\\.[A-Za-z_`][\\w`]*)*|\\d+(\\.\\d+)?");
    private static final Pattern FUNCTION_CALL = Pattern.compile("[A-Za-z_][\\w.]*\\s*\\(.*\\)", Pattern.DOTALL);

    private final int maxDepth;

    public ExpressionResolver() {
        this(SemqlConfig.getInstanceFromEnv().getExpressionMaxDepth());
    }

    public ExpressionResolver(int maxDepth) {
        if (maxDepth <= 0)
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.maxDepth = maxDepth;
    }

    /**
     * A dimension's bare resolved expression, or a measure's aggregate form.
     */
    public String resolveField(ExploreGraph graph, FieldDesc field) {
        return resolveField(graph, field, null);
    }

    /**
     * Same as {@link #resolveField(ExploreGraph, FieldDesc)}, also collecting into {@code touchedViews}
     * every view whose alias the result references.
     */
    public String resolveField(ExploreGraph graph, FieldDesc field, Set<String> touchedViews) {
        return resolveField(graph, field, 0, new ArrayDeque<String>(), touchedViews);
    }

    /**
     * The aggregate form of a measure, e.g. SUM(order_items.sale_price).
     */
    public String resolveAggregate(ExploreGraph graph, MeasureDesc measure) {
        return resolveField(graph, measure, 0, new ArrayDeque<String>(), null);
    }

    /**
     * Resolves free expression text, e.g. a join condition, as if it were declared on {@code viewName}.
     */
    public String resolve(ExploreGraph graph, String viewName, String expression) {
        ViewDesc view = graph.getView(viewName);
        if (view == null)
            throw new ExpressionException("View '" + viewName + "' is not part of explore '" + graph.getName() + "'");
        return substitute(graph, view, expression, 0, new ArrayDeque<String>(), null);
    }

    private String resolveField(ExploreGraph graph, FieldDesc field, int depth, Deque<String> stack, Set<String> touchedViews) {
        String qualifiedName = field.getQualifiedName();
        if (stack.contains(qualifiedName))
            throw new ExpressionException("Cyclic reference: " + describeCycle(stack, qualifiedName));
        if (depth > maxDepth)
            throw new ExpressionException("Reference chain exceeds max depth " + maxDepth + " at " + qualifiedName + ", probably cyclic");
        if (!graph.containsView(field.getView().getName()))
            throw new ExpressionException("View '" + field.getView().getName() + "' is not part of explore '" + graph.getName() + "'");

        stack.push(qualifiedName);
        try {
            if (!field.isMeasure()) {
                return substitute(graph, field.getView(), ((DimensionDesc) field).getExpression(), depth, stack, touchedViews);
            }

            MeasureDesc measure = (MeasureDesc) field;
            AggregationType agg = measure.getAggregationType();
            if (measure.getSql() == null) {
                if (agg == AggregationType.COUNT)
                    return agg.wrap(null);
                throw new ExpressionException("Measure " + qualifiedName + " of type " + measure.getType() + " declares no sql");
            }
            String inner = substitute(graph, field.getView(), measure.getSql(), depth, stack, touchedViews);
            return agg.wrap(inner);
        } finally {
            stack.pop();
        }
    }

    private String substitute(ExploreGraph graph, ViewDesc owner, String expression, int depth, Deque<String> stack, Set<String> touchedViews) {
        if (!ExpressionTokenizer.hasPlaceholders(expression))
            return expression;

        StringBuilder buf = new StringBuilder();
        for (ExpressionToken token : ExpressionTokenizer.tokenize(expression)) {
            switch (token.getKind()) {
            case LITERAL:
                buf.append(token.getText());
                break;
            case TABLE_REF:
                buf.append(graph.getAlias(owner.getName()));
                if (touchedViews != null)
                    touchedViews.add(owner.getName());
                break;
            case FIELD_REF:
                FieldDesc ref = lookup(graph, owner, token);
                buf.append(wrapIfComplex(resolveField(graph, ref, depth + 1, stack, touchedViews)));
                break;
            default:
                throw new IllegalStateException("Unknown token kind " + token.getKind());
            }
        }
        return buf.toString();
    }

    private FieldDesc lookup(ExploreGraph graph, ViewDesc owner, ExpressionToken token) {
        ViewDesc view = owner;
        if (token.getViewName() != null) {
            view = graph.getView(token.getViewName());
            if (view == null)
                throw new ExpressionException("Reference " + token.getText() + " names view '" + token.getViewName() + "' which is not part of explore '" + graph.getName() + "'");
        }
        FieldDesc field = view.findField(token.getFieldName());
        if (field == null)
            throw new ExpressionException("Reference " + token.getText() + " names unknown field '" + view.getName() + "." + token.getFieldName() + "'");
        return field;
    }

    static String wrapIfComplex(String sql) {
        String trimmed = sql.trim();
        if (SIMPLE_PATH.matcher(trimmed).matches() || isSingleCall(trimmed) || isParenthesized(trimmed))
            return trimmed;
        return "(" + trimmed + ")";
    }

    private static boolean isSingleCall(String sql) {
        if (!FUNCTION_CALL.matcher(sql).matches())
            return false;
        return closingParen(sql, sql.indexOf('(')) == sql.length() - 1;
    }

    private static boolean isParenthesized(String sql) {
        return sql.startsWith("(") && closingParen(sql, 0) == sql.length() - 1;
    }

    // index of the paren closing the one at open, or -1; quoted text is skipped
    private static int closingParen(String sql, int open) {
        int level = 0;
        char quote = 0;
        for (int i = open; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (quote != 0) {
                if (c == quote)
                    quote = 0;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == '(') {
                level++;
            } else if (c == ')') {
                level--;
                if (level == 0)
                    return i;
            }
        }
        return -1;
    }

    private static String describeCycle(Deque<String> stack, String repeated) {
        StringBuilder buf = new StringBuilder();
        Iterator<String> it = stack.descendingIterator();
        while (it.hasNext()) {
            buf.append(it.next()).append(" -> ");
        }
        return buf.append(repeated).toString();
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
