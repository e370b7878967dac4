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

/**
 * The outcome of validating a statement. The statement is carried unchanged either way.
 */
public class ValidationResult {

    private final String sql;
    private final ValidationTag tag;//null when valid
    private final String message;

    private ValidationResult(String sql, ValidationTag tag, String message) {
        this.sql = sql;
        this.tag = tag;
        this.message = message;
    }

    public static ValidationResult passed(String sql) {
        return new ValidationResult(sql, null, null);
    }

    public static ValidationResult failed(String sql, ValidationTag tag, String message) {
        return new ValidationResult(sql, tag, message);
    }

    public boolean isValid() {
        return tag == null;
    }

    public String getSql() {
        return sql;
    }

    public ValidationTag getTag() {
        return tag;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult [valid]" : "ValidationResult [" + tag + ": " + message + "]";
    }
}
