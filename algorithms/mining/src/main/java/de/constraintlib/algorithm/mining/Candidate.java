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

import java.util.List;
import java.util.Set;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * A constraint bound to a corpus snapshot. The truth table of the constraint on that corpus is computed on first
 * access and memoized; all statistics are derived from it.
 * <p>
 * Candidates never change after construction. To judge a constraint on another corpus, {@link #reevaluate(Corpus)
 * re-evaluate} it, which yields a new candidate.
 *
 * @author ConstraintLib contributors
 */
public abstract class Candidate {

    private final Corpus corpus;
    private final Supplier<TruthTable> truthTable;

    protected Candidate(Corpus corpus) {
        this.corpus = corpus;
        this.truthTable = Suppliers.memoize(this::computeTruthTable);
    }

    protected abstract TruthTable computeTruthTable();

    public abstract Constraint getConstraint();

    /**
     * Returns the literals of this candidate, in canonical order.
     *
     * @return the literals
     */
    public abstract List<Candidate> getLiterals();

    /**
     * Evaluates the constraint of this candidate on another corpus.
     *
     * @param newCorpus
     *         the corpus to evaluate on
     *
     * @return a candidate for the same constraint, bound to {@code newCorpus}
     */
    public abstract Candidate reevaluate(Corpus newCorpus);

    public Corpus getCorpus() {
        return corpus;
    }

    public TruthTable getTruthTable() {
        return truthTable.get();
    }

    public int getLiteralCount() {
        return getLiterals().size();
    }

    public Set<String> getNonTerminals() {
        return getConstraint().getNonTerminals();
    }

    public double precision() {
        return getTruthTable().precision();
    }

    public double recall() {
        return getTruthTable().recall();
    }

    public int support() {
        return getTruthTable().support();
    }

    /**
     * Returns whether this candidate separates failing from passing inputs exactly.
     *
     * @return {@code true} iff precision and recall are both 1
     */
    public boolean isPerfect() {
        return getTruthTable().isPerfect();
    }

    public String render() {
        return getConstraint().render();
    }

    @Override
    public String toString() {
        return String.format("%s (precision=%.3f, recall=%.3f, support=%d)",
                             render(),
                             precision(),
                             recall(),
                             support());
    }
}
