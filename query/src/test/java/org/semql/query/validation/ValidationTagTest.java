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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ValidationTagTest {

    @Test
    void classifies_warehouse_messages() {
        assertEquals(ValidationTag.MISSING_TABLE, ValidationTag.classify("Not found: Table p.d.t"));
        assertEquals(ValidationTag.MISSING_COLUMN, ValidationTag.classify("Column foo not found"));
        assertEquals(ValidationTag.MISSING_DATASET, ValidationTag.classify("Not found: Dataset p:d"));
        assertEquals(ValidationTag.REFERENCE_ERROR, ValidationTag.classify("Not found: Function foo"));
        assertEquals(ValidationTag.SYNTAX_ERROR, ValidationTag.classify("Syntax error: Unexpected keyword"));
        assertEquals(ValidationTag.PERMISSION_ERROR, ValidationTag.classify("Access Denied: Project p"));
        assertEquals(ValidationTag.INVALID_QUERY, ValidationTag.classify("Invalid cast from STRING to INT64"));
        assertEquals(ValidationTag.UNKNOWN_ERROR, ValidationTag.classify("Quota exceeded"));
        assertEquals(ValidationTag.UNKNOWN_ERROR, ValidationTag.classify(null));
    }
}
