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

package org.semql.common.util;

import java.util.Locale;

import org.apache.commons.lang.StringUtils;

public class StringUtil {

    /**
     * Lower-case the name and replace '-' with '_', e.g. "Order-Items" becomes "order_items".
     */
    public static String normalizeIdentifier(String name) {
        if (name == null)
            return null;
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    /**
     * Remove surrounding back-quotes, double quotes and single quotes.
     */
    public static String stripQuotes(String name) {
        if (name == null)
            return null;
        return StringUtils.strip(name.trim(), "`\"'");
    }

    /**
     * The last dot-separated segment, e.g. "project.dataset.users" becomes "users".
     */
    public static String lastSegment(String dottedName) {
        if (dottedName == null)
            return null;
        int cut = dottedName.lastIndexOf('.');
        return cut < 0 ? dottedName : dottedName.substring(cut + 1);
    }
}
