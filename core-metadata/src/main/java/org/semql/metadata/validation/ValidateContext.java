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

package org.semql.metadata.validation;

import java.util.List;

import com.google.common.collect.Lists;

/**
 * Collects the results of all validator rules.
 */
public class ValidateContext {

    private final List<Result> results = Lists.newArrayList();

    public void addResult(ResultLevel level, String message) {
        results.add(new Result(level, message));
    }

    public Result[] getResults() {
        return results.toArray(new Result[results.size()]);
    }

    public List<String> getMessages(ResultLevel level) {
        List<String> messages = Lists.newArrayList();
        for (Result result : results) {
            if (result.getLevel() == level)
                messages.add(result.getMessage());
        }
        return messages;
    }

    /**
     * True when no rule reported an error; warnings do not count.
     */
    public boolean ifPass() {
        for (Result result : results) {
            if (result.getLevel() == ResultLevel.ERROR)
                return false;
        }
        return true;
    }

    public static class Result {
        private final ResultLevel level;
        private final String message;

        public Result(ResultLevel level, String message) {
            this.level = level;
            this.message = message;
        }

        public ResultLevel getLevel() {
            return level;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return level.getLevel() + " : " + message;
        }
    }
}
