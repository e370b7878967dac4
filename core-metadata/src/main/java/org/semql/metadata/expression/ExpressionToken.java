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

/**
 * One piece of a placeholder expression: verbatim SQL text, ${TABLE}, or a ${view.field} / ${field} reference.
 */
public class ExpressionToken {

    public enum Kind {
        LITERAL, TABLE_REF, FIELD_REF
    }

    private final Kind kind;
    private final String text;//the source text, placeholders included
    private final String viewName;//null for a same-view reference
    private final String fieldName;

    private ExpressionToken(Kind kind, String text, String viewName, String fieldName) {
        this.kind = kind;
        this.text = text;
        this.viewName = viewName;
        this.fieldName = fieldName;
    }

    public static ExpressionToken literal(String text) {
        return new ExpressionToken(Kind.LITERAL, text, null, null);
    }

    public static ExpressionToken tableRef(String text) {
        return new ExpressionToken(Kind.TABLE_REF, text, null, null);
    }

    public static ExpressionToken fieldRef(String text, String viewName, String fieldName) {
        return new ExpressionToken(Kind.FIELD_REF, text, viewName, fieldName);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String getViewName() {
        return viewName;
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean isCrossViewRef() {
        return kind == Kind.FIELD_REF && viewName != null;
    }

    @Override
    public String toString() {
        return kind + "[" + text + "]";
    }
}
