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

package org.semql.metadata.model;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * The semantic model failed to assemble. Carries every error found, not only the first.
 */
public class ModelException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ModelException(String message) {
        this(Collections.singletonList(message));
    }

    public ModelException(List<String> errors) {
        super("Invalid semantic model: " + Joiner.on("; ").join(errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
