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

public class SqlTextUtil {

    private SqlTextUtil() {
    }

    /**
     * Blanks the content of '...', "..." and `...` so checks only see SQL text.
     */
    public static String maskQuoted(String sql) {
        StringBuilder buf = new StringBuilder(sql.length());
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (quote == 0) {
                if (c == '\'' || c == '"' || c == '`')
                    quote = c;
                buf.append(c);
            } else if (c == '\\' && i + 1 < sql.length()) {
                buf.append("  ");
                i++;
            } else if (c == quote) {
                quote = 0;
                buf.append(c);
            } else {
                buf.append(c == '\n' ? '\n' : ' ');
            }
        }
        return buf.toString();
    }
}
