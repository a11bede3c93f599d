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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import de.constraintlib.api.exception.ParseException;
import de.constraintlib.api.exception.UnsatisfiableException;
import de.constraintlib.api.oracle.InputGenerator;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.constraint.ConstraintEvaluator;
import de.constraintlib.datastructure.derivation.DerivationNode;

/**
 * Generates calculator inputs by rejection sampling: random derivations are drawn from the grammar and kept if they
 * satisfy the requested constraint.
 */
public class CalculatorGenerator implements InputGenerator<Constraint> {

    private static final String[] FUNCTIONS = {"sqrt", "cos", "sin", "tan"};

    private final CalculatorParser parser = new CalculatorParser();
    private final int maxDigits;
    private final int maxSamples;

    public CalculatorGenerator() {
        this(4, 20_000);
    }

    public CalculatorGenerator(int maxDigits, int maxSamples) {
        this.maxDigits = maxDigits;
        this.maxSamples = maxSamples;
    }

    @Override
    public List<String> generate(Constraint constraint, int desiredCount, long seed) throws UnsatisfiableException {
        Random random = new Random(seed);
        Set<String> result = new LinkedHashSet<>();

        for (int i = 0; i < maxSamples && result.size() < desiredCount; i++) {
            String sample = sample(random);
            if (result.contains(sample)) {
                continue;
            }
            DerivationNode tree;
            try {
                tree = parser.parse(sample);
            } catch (ParseException e) {
                throw new IllegalStateException("sampled an underivable input " + sample, e);
            }
            if (ConstraintEvaluator.evaluate(constraint, tree)) {
                result.add(sample);
            }
        }

        if (result.isEmpty()) {
            throw new UnsatisfiableException("no input within " + maxSamples + " samples satisfies " + constraint);
        }
        return new ArrayList<>(result);
    }

    private String sample(Random random) {
        String function = FUNCTIONS[random.nextInt(FUNCTIONS.length)];
        return function + '(' + sampleNumber(random) + ')';
    }

    private String sampleNumber(Random random) {
        if (random.nextInt(10) == 0) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        if (random.nextBoolean()) {
            sb.append('-');
        }
        sb.append((char) ('1' + random.nextInt(9)));
        int length = 1 + random.nextInt(maxDigits);
        for (int i = 1; i < length; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        return sb.toString();
    }
}
