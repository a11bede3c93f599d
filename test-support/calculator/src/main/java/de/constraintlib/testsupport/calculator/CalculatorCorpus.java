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
package de.constraintlib.testsupport.calculator;

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;
import de.constraintlib.api.exception.ParseException;
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * Fixtures of the calculator language.
 */
public final class CalculatorCorpus {

    public static final Set<String> RELEVANT_NON_TERMINALS =
            ImmutableSet.of(CalculatorParser.NUMBER, CalculatorParser.MAYBEMINUS, CalculatorParser.FUNCTION);

    private CalculatorCorpus() {
        // prevent instantiation
    }

    /**
     * Returns a small corpus with two failing square roots of negative numbers and four passing inputs.
     *
     * @return the initial calculator corpus
     */
    public static Corpus initial() {
        try {
            return Corpus.builder(new CalculatorParser())
                         .add("sqrt(-900)", OracleResult.FAILING)
                         .add("sqrt(-10)", OracleResult.FAILING)
                         .add("sqrt(0)", OracleResult.PASSING)
                         .add("sin(-900)", OracleResult.PASSING)
                         .add("sqrt(2)", OracleResult.PASSING)
                         .add("cos(10)", OracleResult.PASSING)
                         .build();
        } catch (ParseException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Parses inputs and labels them with a {@link CalculatorOracle}.
     *
     * @param texts
     *         calculator inputs
     *
     * @return the labeled corpus
     */
    public static Corpus classified(String... texts) {
        CalculatorParser parser = new CalculatorParser();
        CalculatorOracle oracle = new CalculatorOracle();
        Corpus.Builder builder = Corpus.builder(parser);
        try {
            for (String text : texts) {
                builder.add(text, oracle.classify(text));
            }
        } catch (ParseException | OracleException e) {
            throw new IllegalStateException(e);
        }
        return builder.build();
    }
}
