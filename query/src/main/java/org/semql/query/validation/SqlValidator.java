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

package org.semql.query.validation;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.semql.common.SemqlConfig;
import org.semql.query.planner.PlannedJoin;
import org.semql.query.planner.QueryPlan;
import org.semql.query.sql.LimitGuardrail;
import org.semql.query.sql.SqlTextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Sets;

/**
 * Checks a generated statement: one trailing LIMIT, no comments, only the plan's table
 * aliases, then optionally a warehouse dry run. Reports, never repairs.
 */
public class SqlValidator {

    private static final Logger logger = LoggerFactory.getLogger(SqlValidator.class);

    // alias.column, but not schema.function(
    private static final Pattern QUALIFIED_REF = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z_][A-Za-z0-9_]*)\\b(?!\\s*\\()");

    private final IDryRunClient dryRunClient;
    private final boolean dryRunEnabled;

    public SqlValidator(SemqlConfig config, IDryRunClient dryRunClient) {
        this(dryRunClient, config.isDryRunEnabled());
    }

    public SqlValidator(IDryRunClient dryRunClient, boolean dryRunEnabled) {
        this.dryRunClient = dryRunClient;
        this.dryRunEnabled = dryRunEnabled;
        if (dryRunEnabled && dryRunClient == null)
            logger.warn("Dry run is enabled but no dry run client is given, only static checks apply");
    }

    public ValidationResult validate(String sql, QueryPlan plan) {
        String masked = SqlTextUtil.maskQuoted(sql);

        if (masked.contains("--") || masked.contains("/*"))
            return fail(sql, ValidationTag.COMMENT_PRESENT, "Statement contains a comment");

        Matcher limit = LimitGuardrail.LIMIT.matcher(masked);
        int count = 0;
        int lastEnd = -1;
        while (limit.find()) {
            count++;
            lastEnd = limit.end();
        }
        if (count != 1)
            return fail(sql, ValidationTag.LIMIT_VIOLATION, "Expected exactly one LIMIT, found " + count);
        if (!masked.substring(lastEnd).trim().isEmpty())
            return fail(sql, ValidationTag.LIMIT_VIOLATION, "LIMIT is not the last clause");

        Set<String> aliases = Sets.newHashSet();
        aliases.add(plan.getBaseAlias().toLowerCase(Locale.ROOT));
        for (PlannedJoin join : plan.getJoinPath()) {
            aliases.add(join.getAlias().toLowerCase(Locale.ROOT));
        }
        Matcher ref = QUALIFIED_REF.matcher(masked);
        while (ref.find()) {
            String alias = ref.group(1).toLowerCase(Locale.ROOT);
            if (!aliases.contains(alias))
                return fail(sql, ValidationTag.UNKNOWN_ALIAS, "Reference " + ref.group() + " uses alias '" + alias + "' outside " + aliases);
        }

        if (dryRunEnabled && dryRunClient != null) {
            try {
                dryRunClient.dryRun(sql);
            } catch (DryRunException e) {
                return fail(sql, ValidationTag.classify(e.getMessage()), e.getMessage());
            }
        }
        return ValidationResult.passed(sql);
    }

    private static ValidationResult fail(String sql, ValidationTag tag, String message) {
        logger.warn("SQL validation failed, " + tag + ": " + message);
        return ValidationResult.failed(sql, tag, message);
    }
}
