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
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.github.misberner.buildergen.annotations.GenerateBuilder;
import com.google.common.base.Preconditions;
import de.constraintlib.datastructure.constraint.AtomicConstraint;
import de.constraintlib.datastructure.derivation.Corpus;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mines constraints separating the failing from the passing inputs of a corpus.
 * <p>
 * A mining run instantiates the templates of the {@link PatternCatalog} with the values observed in the failing
 * inputs, evaluates the resulting atomic candidates, keeps those with recall 1 and a precision above
 * {@code minPrecision}, searches conjunctions of the full-recall atoms and finally ranks everything by
 * {@link CandidateRanking}.
 * <p>
 * Mining is a pure function of its inputs: mining the same corpus twice yields the same result. A corpus without
 * failing inputs yields no candidates.
 *
 * @author ConstraintLib contributors
 */
public class ConstraintMiner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintMiner.class);

    private final CandidateInstantiator instantiator;
    private final ConjunctionSearch conjunctionSearch;
    private final @Nullable Double minPrecision;
    private final int maxResults;
    private final MiningObserver observer;

    public ConstraintMiner() {
        this(BuilderDefaults.catalog(),
             BuilderDefaults.maxConjunctionSize(),
             BuilderDefaults.minPrecision(),
             BuilderDefaults.maxResults(),
             BuilderDefaults.observer());
    }

    /**
     * Constructor.
     *
     * @param catalog
     *         the templates to instantiate
     * @param maxConjunctionSize
     *         the maximum number of literals of a conjunction; {@code 1} disables the conjunction search
     * @param minPrecision
     *         the exclusive lower precision bound of reported candidates; {@code null} uses the failure rate of the
     *         mined corpus, i.e. the precision of the trivial constraint
     * @param maxResults
     *         the number of reported candidates; {@code 0} reports all candidates tied at the best rank
     * @param observer
     *         the observer notified about mining progress
     */
    @GenerateBuilder(defaults = BuilderDefaults.class)
    public ConstraintMiner(PatternCatalog catalog,
                           int maxConjunctionSize,
                           Double minPrecision,
                           int maxResults,
                           MiningObserver observer) {
        Preconditions.checkArgument(maxResults >= 0, "maxResults must not be negative");
        this.instantiator = new CandidateInstantiator(catalog);
        this.conjunctionSearch = new ConjunctionSearch(maxConjunctionSize);
        this.minPrecision = minPrecision;
        this.maxResults = maxResults;
        this.observer = observer;
    }

    /**
     * Mines constraints over all non-terminals occurring in the failing inputs.
     *
     * @param corpus
     *         the labeled inputs
     *
     * @return the best candidates, best first; empty if nothing separates the corpus
     */
    public List<Candidate> mine(Corpus corpus) {
        return mine(corpus, Collections.emptySet());
    }

    /**
     * Mines constraints over the given non-terminals.
     *
     * @param corpus
     *         the labeled inputs
     * @param relevantNonTerminals
     *         the non-terminals to bind; if empty, all non-terminals occurring in the failing inputs
     *
     * @return the best candidates, best first; empty if nothing separates the corpus
     */
    public List<Candidate> mine(Corpus corpus, Set<String> relevantNonTerminals) {
        if (corpus.getFailing().isEmpty()) {
            LOGGER.info("{} has no failing inputs, nothing to mine", corpus);
            observer.onMiningFinished(Collections.emptyList());
            return Collections.emptyList();
        }

        Set<String> tags = relevantNonTerminals.isEmpty() ? corpus.failingNonTerminalTags() : relevantNonTerminals;
        double threshold = minPrecision != null ? minPrecision : corpus.failureRate();

        List<AtomicConstraint> constraints = instantiator.instantiate(corpus, tags);
        observer.onCandidatesInstantiated(constraints.size());

        List<AtomicCandidate> atoms = CandidateEvaluator.evaluate(constraints, corpus);
        List<AtomicCandidate> fullRecall = CandidateEvaluator.withFullRecall(atoms);
        List<AtomicCandidate> retained = CandidateEvaluator.filter(fullRecall, threshold);
        observer.onCandidatesEvaluated(atoms.size(), fullRecall.size(), retained.size());

        List<ConjunctionCandidate> conjunctions = new ArrayList<>();
        for (ConjunctionCandidate c : conjunctionSearch.search(fullRecall, threshold)) {
            if (c.getTruthTable().hasFullRecall()) {
                conjunctions.add(c);
            }
        }
        observer.onConjunctionsFound(conjunctions.size());

        List<Candidate> all = new ArrayList<>(retained.size() + conjunctions.size());
        all.addAll(retained);
        all.addAll(conjunctions);
        List<Candidate> result = Collections.unmodifiableList(CandidateRanking.top(all, maxResults));

        LOGGER.debug("Mined {} candidates on {} ({} atomic, {} conjunctions)",
                     result.size(),
                     corpus,
                     retained.size(),
                     conjunctions.size());
        observer.onMiningFinished(result);
        return result;
    }

    public PatternCatalog getCatalog() {
        return instantiator.getCatalog();
    }

    public int getMaxConjunctionSize() {
        return conjunctionSearch.getMaxConjunctionSize();
    }

    public int getMaxResults() {
        return maxResults;
    }

    public static final class BuilderDefaults {

        private BuilderDefaults() {
            // prevent instantiation
        }

        public static PatternCatalog catalog() {
            return PatternCatalog.builtIn();
        }

        public static int maxConjunctionSize() {
            return ConjunctionSearch.DEFAULT_MAX_CONJUNCTION_SIZE;
        }

        public static Double minPrecision() {
            return null;
        }

        public static int maxResults() {
            return 0;
        }

        public static MiningObserver observer() {
            return MiningObserver.NONE;
        }
    }
}
