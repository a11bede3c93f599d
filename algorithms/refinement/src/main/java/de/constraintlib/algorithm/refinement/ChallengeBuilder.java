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
package de.constraintlib.algorithm.refinement;

import java.util.ArrayList;
import java.util.List;

import de.constraintlib.algorithm.mining.Candidate;
import de.constraintlib.algorithm.mining.ConjunctionCandidate;
import de.constraintlib.algorithm.mining.NegatedCandidate;

/**
 * Builds challenges from mined candidates. A challenge keeps some literals of a candidate and negates the others;
 * inputs satisfying it probe whether the negated literals are really necessary.
 * <p>
 * Challenges are candidates over the corpus of the challenged candidate: negated literals are {@link NegatedCandidate}s
 * and challenges with more than one literal are {@link ConjunctionCandidate}s, with literals in canonical order. Their
 * constraints are handed to the input generator.
 *
 * @author ConstraintLib contributors
 */
public final class ChallengeBuilder {

    private ChallengeBuilder() {
        // prevent instantiation
    }

    public static List<Candidate> challenges(Candidate candidate, NegationStrategy strategy) {
        List<Candidate> literals = candidate.getLiterals();

        List<Candidate> result = new ArrayList<>();
        switch (strategy) {
            case FIRST_LITERAL:
                result.add(negate(literals, 1));
                break;
            case ALL_COMBINATIONS:
                for (long mask = 1; mask < (1L << literals.size()); mask++) {
                    result.add(negate(literals, mask));
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown negation strategy " + strategy);
        }
        return result;
    }

    /**
     * Negates the literals selected by a bit mask.
     */
    private static Candidate negate(List<Candidate> literals, long mask) {
        List<Candidate> members = new ArrayList<>(literals.size());
        for (int i = 0; i < literals.size(); i++) {
            Candidate literal = literals.get(i);
            members.add((mask & (1L << i)) != 0 ? new NegatedCandidate(literal) : literal);
        }
        return members.size() == 1 ? members.get(0) : new ConjunctionCandidate(members);
    }
}
