/* Copyright (C) 2024 ConstraintLib contributors
 * This file is part of ConstraintLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.constraintlib.algorithm.mining;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import de.constraintlib.api.exception.NotNumericException;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.datastructure.derivation.LabeledInput;
import de.constraintlib.datastructure.derivation.NonTerminalOccurrence;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The literal values observed at the occurrences of one non-terminal across the failing inputs of a corpus. Passing
 * inputs never contribute values.
 *
 * @author ConstraintLib contributors
 */
final class ObservedValues {

    private static final int MIN_COMMON_SUBSTRING = 2;
    private static final int MAX_INTEGER_DIGITS = 64;

    private final String nonTerminal;
    private final ImmutableSet<String> strings;
    private final ImmutableSet<BigInteger> integers;
    private final boolean numeric;
    private final boolean recurring;
    private final @Nullable String commonSubstring;

    private ObservedValues(String nonTerminal,
                           Set<String> strings,
                           Set<BigInteger> integers,
                           boolean numeric,
                           boolean recurring,
                           @Nullable String commonSubstring) {
        this.nonTerminal = nonTerminal;
        this.strings = ImmutableSet.copyOf(strings);
        this.integers = ImmutableSet.copyOf(integers);
        this.numeric = numeric;
        this.recurring = recurring;
        this.commonSubstring = commonSubstring;
    }

    static Map<String, ObservedValues> collect(Corpus corpus, Collection<String> nonTerminals) {
        Map<String, ObservedValues> result = new LinkedHashMap<>();
        for (String nt : nonTerminals) {
            result.put(nt, collect(corpus, nt));
        }
        return result;
    }

    static ObservedValues collect(Corpus corpus, String nonTerminal) {
        Set<String> strings = new LinkedHashSet<>();
        Set<BigInteger> integers = new LinkedHashSet<>();
        List<String> allTexts = new ArrayList<>();
        boolean numeric = true;
        boolean recurring = false;

        for (LabeledInput input : corpus.getFailing()) {
            int count = 0;
            for (NonTerminalOccurrence occ : input.getTree().occurrences(nonTerminal)) {
                count++;
                String text = occ.getText();
                strings.add(text);
                allTexts.add(text);
                try {
                    BigInteger whole = toWholeNumber(occ.toNumber());
                    if (whole != null) {
                        integers.add(whole);
                    }
                } catch (NotNumericException e) {
                    numeric = false;
                }
            }
            recurring |= count >= 2;
        }

        return new ObservedValues(nonTerminal,
                                  strings,
                                  integers,
                                  numeric && !strings.isEmpty(),
                                  recurring,
                                  longestCommonSubstring(allTexts));
    }

    /**
     * Converts a number to an integer slot value.
     *
     * @param number
     *         the parsed value of an occurrence
     *
     * @return the value, or {@code null} if it has a fractional part or more than {@value #MAX_INTEGER_DIGITS} digits
     */
    static @Nullable BigInteger toWholeNumber(BigDecimal number) {
        BigDecimal value = number.stripTrailingZeros();
        if (value.scale() > 0 || value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
            return null;
        }
        return value.toBigInteger();
    }

    /**
     * Computes the longest substring shared by all texts.
     *
     * @param texts
     *         the texts to compare
     *
     * @return the first longest common substring of at least two characters, or {@code null} if there is none
     */
    static @Nullable String longestCommonSubstring(List<String> texts) {
        if (texts.isEmpty()) {
            return null;
        }
        String shortest = texts.get(0);
        for (String t : texts) {
            if (t.length() < shortest.length()) {
                shortest = t;
            }
        }
        for (int len = shortest.length(); len >= MIN_COMMON_SUBSTRING; len--) {
            for (int start = 0; start + len <= shortest.length(); start++) {
                String candidate = shortest.substring(start, start + len);
                if (containedInAll(candidate, texts)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static boolean containedInAll(String candidate, List<String> texts) {
        for (String t : texts) {
            if (!t.contains(candidate)) {
                return false;
            }
        }
        return true;
    }

    String getNonTerminal() {
        return nonTerminal;
    }

    /**
     * Returns whether the non-terminal occurs at least once in a failing input.
     *
     * @return {@code true} iff any value was observed
     */
    boolean isObserved() {
        return !strings.isEmpty();
    }

    Set<String> getStrings() {
        return strings;
    }

    Set<BigInteger> getIntegers() {
        return integers;
    }

    /**
     * Returns whether every failing occurrence is a numeric token. Only such non-terminals are bound to numeric slots.
     *
     * @return {@code true} iff the non-terminal was observed and all its values are numeric
     */
    boolean isNumeric() {
        return numeric;
    }

    boolean isRecurring() {
        return recurring;
    }

    /**
     * Returns the substring values for containment templates: every observed value plus the longest common substring.
     *
     * @return the substring values
     */
    List<String> getSubstrings() {
        if (commonSubstring == null || strings.contains(commonSubstring)) {
            return ImmutableList.copyOf(strings);
        }
        return ImmutableList.<String>builder().addAll(strings).add(commonSubstring).build();
    }

    @Nullable String getCommonSubstring() {
        return commonSubstring;
    }
}
