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

package org.semql.query.routing;

import org.semql.grounding.GroundingIndex;
import org.semql.metadata.model.ExploreDesc;

/**
 * An explore competing to answer a question, with its match score and join cost.
 */
public class ExploreCandidate {

    private final GroundingIndex index;
    private final double score;
    private final int joinCost;

    public ExploreCandidate(GroundingIndex index, double score, int joinCost) {
        this.index = index;
        this.score = score;
        this.joinCost = joinCost;
    }

    public GroundingIndex getIndex() {
        return index;
    }

    public String getName() {
        return index.getExploreName();
    }

    public ExploreDesc getExplore() {
        return index.getExplore().getExplore();
    }

    public double getScore() {
        return score;
    }

    /**
     * Joins needed to reach the matched fields, plus the joins the explore always requires.
     */
    public int getJoinCost() {
        return joinCost;
    }

    @Override
    public String toString() {
        return getName() + "(" + score + ", joins=" + joinCost + ")";
    }
}
