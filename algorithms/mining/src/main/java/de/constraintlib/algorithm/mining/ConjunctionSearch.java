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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;

/**
 * Combines candidates into conjunctions.
 * <p>
 * Every combination of 2 to {@code maxConjunctionSize} input candidates whose non-terminals are pairwise disjoint is
 * evaluated. A conjunction is kept if its precision exceeds the precision of each of its literals as well as
 * {@code minPrecision}. Since conjoining literals can only lower recall, callers pass candidates with recall 1 and keep
 * the conjunctions that still have full recall.
 *
 * @author ConstraintLib contributors
 */
public class ConjunctionSearch {

    public static final int DEFAULT_MAX_CONJUNCTION_SIZE = 2;

    private final int maxConjunctionSize;

    public ConjunctionSearch() {
        this(DEFAULT_MAX_CONJUNCTION_SIZE);
    }

    public ConjunctionSearch(int maxConjunctionSize) {
        Preconditions.checkArgument(maxConjunctionSize >= 1, "maximum conjunction size must be positive");
        this.maxConjunctionSize = maxConjunctionSize;
    }

    /**
     * Searches conjunctions of the given literals.
     *
     * @param literals
     *         the candidates to combine, all evaluated on the same corpus
     * @param minPrecision
     *         the exclusive lower precision bound for conjunctions
     *
     * @return the kept conjunctions, in no particular order
     */
    public List<ConjunctionCandidate> search(List<? extends Candidate> literals, double minPrecision) {
        if (literals.size() < 2 || maxConjunctionSize < 2) {
            return new ArrayList<>();
        }
        Set<Integer> indices = ContiguousSet.create(Range.closedOpen(0, literals.size()), DiscreteDomain.integers());

        List<List<Candidate>> combinations = new ArrayList<>();
        for (int k = 2; k <= Math.min(maxConjunctionSize, literals.size()); k++) {
            for (Set<Integer> combination : Sets.combinations(indices, k)) {
                List<Candidate> members = new ArrayList<>(k);
                for (Integer idx : combination) {
                    members.add(literals.get(idx));
                }
                if (ConjunctionCandidate.haveDisjointNonTerminals(members)) {
                    combinations.add(members);
                }
            }
        }

        return combinations.parallelStream()
                           .map(ConjunctionCandidate::new)
                           .filter(c -> improves(c, minPrecision))
                           .collect(Collectors.toList());
    }

    private static boolean improves(ConjunctionCandidate conjunction, double minPrecision) {
        double precision = conjunction.precision();
        if (precision <= minPrecision) {
            return false;
        }
        for (Candidate literal : conjunction.getLiterals()) {
            if (precision <= literal.precision()) {
                return false;
            }
        }
        return true;
    }

    public int getMaxConjunctionSize() {
        return maxConjunctionSize;
    }
}
