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

package org.semql.query.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.semql.grounding.TermUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Breaks a question into terms, aggregation cues, metric and grouping clauses, and a time window.
 * <p>
 * Everything after the first of "by", "per", "each" or "across" is grouping; clauses are
 * separated by "and" or commas. Row-limit wording ("limit 50", "top 10") is dropped, the
 * row limit never comes from the question.
 */
public class QuestionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(QuestionAnalyzer.class);

    private static final Set<String> GROUP_MARKERS = ImmutableSet.of("by", "per", "each", "across");
    private static final String CLAUSE_SEPARATOR = "and";
    private static final int MIN_TERM_LENGTH = 3;

    private static final Pattern LIMIT_WORDING = Pattern.compile("\\b(limit|top|first)\\s+\\d+\\b");
    private static final Pattern LAST_N = Pattern.compile("\\b(?:last|past)\\s+(\\d+)\\s+(day|week|month|year)s?\\b");
    private static final Pattern THIS_PERIOD = Pattern.compile("\\bthis\\s+(month|year)\\b");

    public AnalyzedQuestion analyze(String question) {
        String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
        text = LIMIT_WORDING.matcher(text).replaceAll(" ");

        TimeWindow window = null;
        Matcher m = LAST_N.matcher(text);
        if (m.find()) {
            window = new TimeWindow(TimeWindow.Unit.valueOf(m.group(2).toUpperCase(Locale.ROOT)), Integer.valueOf(m.group(1)));
            text = m.replaceAll(" ");
        } else {
            m = THIS_PERIOD.matcher(text);
            if (m.find()) {
                window = new TimeWindow(TimeWindow.Unit.valueOf(m.group(1).toUpperCase(Locale.ROOT)), null);
                text = m.replaceAll(" ");
            }
        }

        List<String> words = TermUtil.words(text.replace(",", " " + CLAUSE_SEPARATOR + " "));

        Set<AggregationCue> cues = Sets.newLinkedHashSet();
        List<List<String>> metricClauses = Lists.newArrayList();
        List<List<String>> groupClauses = Lists.newArrayList();
        Set<String> terms = Sets.newLinkedHashSet();

        List<String> clause = Lists.newArrayList();
        boolean grouping = false;
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);

            if (i + 1 < words.size()) {
                AggregationCue phraseCue = AggregationCue.fromPhrase(word + " " + words.get(i + 1));
                if (phraseCue != null) {
                    cues.add(phraseCue);
                    i++;
                    continue;
                }
            }
            AggregationCue cue = AggregationCue.fromPhrase(word);
            if (cue != null) {
                cues.add(cue);
                continue;
            }

            if (GROUP_MARKERS.contains(word) || CLAUSE_SEPARATOR.equals(word)) {
                closeClause(clause, grouping ? groupClauses : metricClauses);
                clause = Lists.newArrayList();
                if (GROUP_MARKERS.contains(word))
                    grouping = true;
                continue;
            }

            if (isContentWord(word)) {
                String term = TermUtil.stem(word);
                clause.add(term);
                terms.add(term);
            }
        }
        closeClause(clause, grouping ? groupClauses : metricClauses);

        AnalyzedQuestion analyzed = new AnalyzedQuestion(question, Lists.newArrayList(terms), cues, metricClauses, groupClauses, window);
        logger.debug("Analyzed question '" + question + "' as " + analyzed);
        return analyzed;
    }

    private static void closeClause(List<String> clause, List<List<String>> target) {
        if (!clause.isEmpty())
            target.add(clause);
    }

    private static boolean isContentWord(String word) {
        if (word.length() < MIN_TERM_LENGTH || TermUtil.isStopWord(word))
            return false;
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i)))
                return true;
        }
        return false;
    }
}
