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

package org.semql.grounding;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Term extraction shared by the grounding index and the question analyzer,
 * so that both sides of a match are normalized the same way.
 */
public class TermUtil {

    public static final Set<String> STOP_WORDS = ImmutableSet.of(//
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by", "from", "up", "about", "into", "over", "after", //
            "what", "when", "where", "which", "who", "how", "show", "get", "find", "list", "give", "me", "want", "need", "can", "you", "please", //
            "are", "is", "was", "were", "be", "all", "our", "its", "has", "had", "have", "did", "does", "do", "let", "see", "use", //
            "calculate", "compute", "display", "tell", "return", "each", "per", "across", "grouped", "some", "any", "this", "that", "these", "those", "there");

    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");
    private static final Pattern KEYWORD = Pattern.compile("\\b[a-zA-Z]{3,}\\b");

    /**
     * Lower-cased alphanumeric words in order, nothing dropped.
     */
    public static List<String> words(String text) {
        List<String> words = Lists.newArrayList();
        if (text == null)
            return words;
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    /**
     * Terms of an identifier such as "average_sale_price": split on '_' and '-', stemmed.
     */
    public static Set<String> nameTerms(String identifier) {
        Set<String> terms = Sets.newLinkedHashSet();
        for (String word : words(identifier)) {
            terms.add(stem(word));
        }
        return terms;
    }

    /**
     * Keywords of free text: words of three letters or more, stop words removed, stemmed.
     */
    public static Set<String> keywords(String text) {
        Set<String> terms = Sets.newLinkedHashSet();
        if (text == null)
            return terms;
        Matcher m = KEYWORD.matcher(text);
        while (m.find()) {
            String word = m.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(word))
                terms.add(stem(word));
        }
        return terms;
    }

    public static boolean isStopWord(String word) {
        return STOP_WORDS.contains(word);
    }

    /**
     * Folds plurals: "categories" to "category", "boxes" to "box", "sources" to "source".
     */
    public static String stem(String word) {
        int n = word.length();
        if (n > 4 && word.endsWith("ies"))
            return word.substring(0, n - 3) + "y";
        if (n > 4 && (word.endsWith("sses") || word.endsWith("xes") || word.endsWith("ches") || word.endsWith("shes")))
            return word.substring(0, n - 2);
        if (n > 3 && word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is"))
            return word.substring(0, n - 1);
        return word;
    }
}
