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

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.semql.common.util.StringUtil;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Splits expression text into literal runs and placeholders.
 */
public class ExpressionTokenizer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]*)\\}");
    private static final String TABLE = "TABLE";

    public static List<ExpressionToken> tokenize(String expression) {
        List<ExpressionToken> tokens = Lists.newArrayList();
        if (expression == null)
            return tokens;

        Matcher m = PLACEHOLDER.matcher(expression);
        int last = 0;
        while (m.find()) {
            if (m.start() > last)
                tokens.add(ExpressionToken.literal(expression.substring(last, m.start())));
            tokens.add(toPlaceholder(m.group(), m.group(1).trim()));
            last = m.end();
        }
        if (last < expression.length())
            tokens.add(ExpressionToken.literal(expression.substring(last)));
        return tokens;
    }

    private static ExpressionToken toPlaceholder(String text, String inner) {
        if (inner.isEmpty())
            throw new ExpressionException("Empty placeholder in expression");
        if (TABLE.equalsIgnoreCase(inner))
            return ExpressionToken.tableRef(text);

        int cut = inner.indexOf('.');
        if (cut < 0)
            return ExpressionToken.fieldRef(text, null, StringUtil.normalizeIdentifier(inner));
        String view = inner.substring(0, cut);
        String field = inner.substring(cut + 1);
        if (view.isEmpty() || field.isEmpty())
            throw new ExpressionException("Malformed placeholder " + text);
        return ExpressionToken.fieldRef(text, StringUtil.normalizeIdentifier(view), StringUtil.normalizeIdentifier(field));
    }

    public static boolean hasPlaceholders(String expression) {
        return expression != null && PLACEHOLDER.matcher(expression).find();
    }

    /**
     * Views named by ${view.field} references, in order of first appearance.
     */
    public static Set<String> referencedViews(String expression) {
        Set<String> views = Sets.newLinkedHashSet();
        for (ExpressionToken token : tokenize(expression)) {
            if (token.isCrossViewRef())
                views.add(token.getViewName());
        }
        return views;
    }
}
