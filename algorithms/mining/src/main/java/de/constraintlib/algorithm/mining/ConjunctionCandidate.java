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
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.constraintlib.datastructure.constraint.Conjunction;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * The conjunction of two or more literals over the same corpus. Its truth table is the pointwise AND of the literals'
 * tables.
 * <p>
 * Literals are kept in canonical order (ascending by their rendered text), so the same set of literals always yields
 * the same conjunction. Literals must reference pairwise disjoint sets of non-terminals.
 *
 * @author ConstraintLib contributors
 */
public final class ConjunctionCandidate extends Candidate {

    private static final Comparator<Candidate> CANONICAL = Comparator.comparing(Candidate::render);

    private final ImmutableList<Candidate> literals;
    private final Conjunction constraint;

    public ConjunctionCandidate(List<? extends Candidate> members) {
        super(corpusOf(members));

        List<Candidate> flat = new ArrayList<>();
        for (Candidate c : members) {
            flat.addAll(c.getLiterals());
        }
        flat.sort(CANONICAL);
        Preconditions.checkArgument(flat.size() >= 2, "A conjunction needs at least two literals");
        Preconditions.checkArgument(haveDisjointNonTerminals(flat),
                                    "Literals of a conjunction must reference distinct non-terminals: %s",
                                    flat);

        this.literals = ImmutableList.copyOf(flat);
        List<Constraint> constraints = new ArrayList<>(flat.size());
        for (Candidate c : flat) {
            constraints.add(c.getConstraint());
        }
        this.constraint = new Conjunction(constraints);
    }

    private static Corpus corpusOf(List<? extends Candidate> members) {
        Preconditions.checkArgument(!members.isEmpty(), "A conjunction needs at least two literals");
        Corpus corpus = members.get(0).getCorpus();
        for (Candidate c : members) {
            Preconditions.checkArgument(c.getCorpus() == corpus, "Literals must be evaluated on the same corpus");
        }
        return corpus;
    }

    /**
     * Checks whether no two of the given literals share a non-terminal.
     *
     * @param literals
     *         the literals to check
     *
     * @return {@code true} iff the non-terminal sets of {@code literals} are pairwise disjoint
     */
    public static boolean haveDisjointNonTerminals(List<? extends Candidate> literals) {
        Set<String> seen = new HashSet<>();
        for (Candidate c : literals) {
            for (String nt : c.getNonTerminals()) {
                if (!seen.add(nt)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    protected TruthTable computeTruthTable() {
        TruthTable result = literals.get(0).getTruthTable();
        for (int i = 1; i < literals.size(); i++) {
            result = result.and(literals.get(i).getTruthTable());
        }
        return result;
    }

    @Override
    public Conjunction getConstraint() {
        return constraint;
    }

    @Override
    public List<Candidate> getLiterals() {
        return literals;
    }

    @Override
    public ConjunctionCandidate reevaluate(Corpus newCorpus) {
        List<Candidate> reevaluated = new ArrayList<>(literals.size());
        for (Candidate c : literals) {
            reevaluated.add(c.reevaluate(newCorpus));
        }
        return new ConjunctionCandidate(reevaluated);
    }
}
