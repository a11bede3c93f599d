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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.github.misberner.buildergen.annotations.GenerateBuilder;
import com.google.common.base.Preconditions;
import de.constraintlib.algorithm.mining.Candidate;
import de.constraintlib.algorithm.mining.ConstraintMiner;
import de.constraintlib.api.InputParser;
import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;
import de.constraintlib.api.exception.ParseException;
import de.constraintlib.api.exception.UnsatisfiableException;
import de.constraintlib.api.oracle.InputGenerator;
import de.constraintlib.api.oracle.InputOracle;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.datastructure.derivation.DerivationNode;
import de.constraintlib.datastructure.derivation.LabeledInput;
import de.constraintlib.oracle.wrapper.TimeoutInputGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counterexample-guided refinement of mined constraints.
 * <p>
 * Every round mines the current corpus ({@link RefinementState#MINE}). Unless the loop stops, the best candidates are
 * turned into challenges by negating some of their literals ({@link RefinementState#CHALLENGE}), the generator produces
 * inputs satisfying the challenges, the oracle labels them ({@link RefinementState#RELABEL}) and they are added to the
 * corpus ({@link RefinementState#MERGE}) for the next round. Generated inputs that cannot be parsed or classified are
 * dropped, whatever the oracle throws.
 * <p>
 * The loop stops once {@code maxRounds} mining rounds have been run, or once the best candidate of a round is a perfect
 * separator with no more literals than the best candidate of the previous round. It also stops if no challenge is
 * satisfiable, a round adds no new input, mining finds nothing, the wall-clock budget is exhausted or the thread is
 * interrupted. In every case the best candidates known so far are returned with the corpus.
 * <p>
 * The loop itself is sequential; parallelism happens inside the {@link ConstraintMiner}. Instances hold no state
 * between calls to {@code refine} and may be reused.
 *
 * @author ConstraintLib contributors
 */
public class RefinementLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(RefinementLoop.class);

    private final InputParser<DerivationNode> parser;
    private final ConstraintMiner miner;
    private final int inputsPerChallenge;
    private final NegationStrategy negationStrategy;
    private final int challengedCandidates;
    private final long generatorTimeoutMillis;
    private final long timeoutMillis;
    private final long seed;
    private final RefinementObserver observer;

    public RefinementLoop(InputParser<DerivationNode> parser) {
        this(parser,
             BuilderDefaults.miner(),
             BuilderDefaults.inputsPerChallenge(),
             BuilderDefaults.negationStrategy(),
             BuilderDefaults.challengedCandidates(),
             BuilderDefaults.generatorTimeoutMillis(),
             BuilderDefaults.timeoutMillis(),
             BuilderDefaults.seed(),
             BuilderDefaults.observer());
    }

    /**
     * Constructor.
     *
     * @param parser
     *         parses generated inputs
     * @param miner
     *         the miner run in every round
     * @param inputsPerChallenge
     *         the number of inputs requested per challenge
     * @param negationStrategy
     *         which literals of a candidate are negated
     * @param challengedCandidates
     *         the number of best candidates challenged per round
     * @param generatorTimeoutMillis
     *         the time a single generator call may take, {@code 0} for no limit; a timeout counts as unsatisfiable
     * @param timeoutMillis
     *         the wall-clock budget of a whole refinement, {@code 0} for no limit
     * @param seed
     *         the base seed for the generator, varied per round and challenge
     * @param observer
     *         the observer notified about progress
     */
    @GenerateBuilder(defaults = BuilderDefaults.class)
    public RefinementLoop(InputParser<DerivationNode> parser,
                          ConstraintMiner miner,
                          int inputsPerChallenge,
                          NegationStrategy negationStrategy,
                          int challengedCandidates,
                          long generatorTimeoutMillis,
                          long timeoutMillis,
                          long seed,
                          RefinementObserver observer) {
        Preconditions.checkArgument(inputsPerChallenge > 0, "inputsPerChallenge must be positive");
        Preconditions.checkArgument(challengedCandidates > 0, "challengedCandidates must be positive");
        Preconditions.checkArgument(generatorTimeoutMillis >= 0, "generatorTimeoutMillis must not be negative");
        Preconditions.checkArgument(timeoutMillis >= 0, "timeoutMillis must not be negative");
        this.parser = parser;
        this.miner = miner;
        this.inputsPerChallenge = inputsPerChallenge;
        this.negationStrategy = negationStrategy;
        this.challengedCandidates = challengedCandidates;
        this.generatorTimeoutMillis = generatorTimeoutMillis;
        this.timeoutMillis = timeoutMillis;
        this.seed = seed;
        this.observer = observer;
    }

    public RefinementResult refine(Corpus initial,
                                   InputOracle oracle,
                                   InputGenerator<Constraint> generator,
                                   int maxRounds) {
        return refine(initial, oracle, generator, Collections.emptySet(), maxRounds);
    }

    /**
     * Refines the constraints mined from a corpus.
     *
     * @param initial
     *         the initial corpus; must contain failing and passing inputs
     * @param oracle
     *         labels generated inputs
     * @param generator
     *         produces inputs for challenges
     * @param relevantNonTerminals
     *         the non-terminals to mine over; if empty, all non-terminals of the failing inputs
     * @param maxRounds
     *         the maximum number of mining rounds
     *
     * @return the refinement result
     *
     * @throws IllegalArgumentException
     *         if the initial corpus lacks failing or passing inputs, or {@code maxRounds} is not positive
     */
    public RefinementResult refine(Corpus initial,
                                   InputOracle oracle,
                                   InputGenerator<Constraint> generator,
                                   Set<String> relevantNonTerminals,
                                   int maxRounds) {
        Preconditions.checkArgument(maxRounds > 0, "maxRounds must be positive");

        observer.onStateChanged(0, RefinementState.COLLECT);
        Preconditions.checkArgument(!initial.getFailing().isEmpty(), "The initial corpus has no failing input");
        Preconditions.checkArgument(!initial.getPassing().isEmpty(), "The initial corpus has no passing input");

        if (generatorTimeoutMillis > 0) {
            try (TimeoutInputGenerator<Constraint> bounded = new TimeoutInputGenerator<>(generator,
                                                                                                generatorTimeoutMillis,
                                                                                                TimeUnit.MILLISECONDS)) {
                return run(initial, oracle, bounded, relevantNonTerminals, maxRounds);
            }
        }
        return run(initial, oracle, generator, relevantNonTerminals, maxRounds);
    }

    private RefinementResult run(Corpus initial,
                                 InputOracle oracle,
                                 InputGenerator<Constraint> generator,
                                 Set<String> relevantNonTerminals,
                                 int maxRounds) {
        long deadline = timeoutMillis > 0 ? System.currentTimeMillis() + timeoutMillis : Long.MAX_VALUE;

        Corpus corpus = initial;
        List<Candidate> best = Collections.emptyList();
        List<RoundReport> reports = new ArrayList<>();
        TerminationReason reason = null;

        for (int round = 1; reason == null; round++) {
            if (Thread.currentThread().isInterrupted()) {
                reason = TerminationReason.INTERRUPTED;
                break;
            }
            if (System.currentTimeMillis() >= deadline) {
                reason = TerminationReason.TIMEOUT;
                break;
            }
            observer.onRoundStarted(round, corpus);

            observer.onStateChanged(round, RefinementState.MINE);
            List<Candidate> mined = miner.mine(corpus, relevantNonTerminals);
            @Nullable Candidate previousBest = best.isEmpty() ? null : best.get(0);
            best = mined;

            if (mined.isEmpty()) {
                reason = TerminationReason.NO_CANDIDATES;
            } else if (isConverged(mined.get(0), previousBest)) {
                reason = TerminationReason.CONVERGED;
            } else if (round >= maxRounds) {
                reason = TerminationReason.MAX_ROUNDS;
            }
            if (reason != null) {
                finishRound(reports, new RoundReport(round,
                                                     corpus.size(),
                                                     corpus.getFailing().size(),
                                                     mined,
                                                     Collections.emptyList(),
                                                     0,
                                                     0,
                                                     0,
                                                     0));
                break;
            }

            observer.onStateChanged(round, RefinementState.CHALLENGE);
            List<Constraint> challenges = buildChallenges(mined);
            Set<String> generated = new LinkedHashSet<>();
            int unsatisfiable = 0;
            for (int i = 0; i < challenges.size(); i++) {
                Constraint challenge = challenges.get(i);
                try {
                    generated.addAll(generator.generate(challenge, inputsPerChallenge, seedFor(round, i)));
                } catch (UnsatisfiableException e) {
                    unsatisfiable++;
                    observer.onChallengeUnsatisfiable(challenge, e);
                }
            }

            observer.onStateChanged(round, RefinementState.RELABEL);
            List<LabeledInput> labeled = new ArrayList<>();
            int dropped = 0;
            for (String text : generated) {
                if (corpus.containsText(text)) {
                    continue;
                }
                LabeledInput input = relabel(text, oracle);
                if (input == null) {
                    dropped++;
                } else {
                    labeled.add(input);
                }
            }

            observer.onStateChanged(round, RefinementState.MERGE);
            Corpus merged = corpus.merge(labeled);
            int added = merged.size() - corpus.size();
            finishRound(reports, new RoundReport(round,
                                                 corpus.size(),
                                                 corpus.getFailing().size(),
                                                 mined,
                                                 challenges,
                                                 unsatisfiable,
                                                 generated.size(),
                                                 dropped,
                                                 added));
            corpus = merged;

            if (Thread.currentThread().isInterrupted()) {
                reason = TerminationReason.INTERRUPTED;
            } else if (unsatisfiable == challenges.size()) {
                reason = TerminationReason.UNSATISFIABLE;
            } else if (added == 0) {
                reason = TerminationReason.NO_NEW_INPUTS;
            }
        }

        observer.onStateChanged(reports.size(), RefinementState.TERMINATE);
        RefinementResult result = new RefinementResult(best, corpus, reason, reports);
        LOGGER.debug("Refinement stopped: {}", result);
        observer.onTerminated(result);
        return result;
    }

    private static boolean isConverged(Candidate best, @Nullable Candidate previousBest) {
        return previousBest != null && best.isPerfect() && best.getLiteralCount() <= previousBest.getLiteralCount();
    }

    private List<Constraint> buildChallenges(List<Candidate> mined) {
        Set<Constraint> challenges = new LinkedHashSet<>();
        for (Candidate candidate : mined.subList(0, Math.min(challengedCandidates, mined.size()))) {
            for (Candidate challenge : ChallengeBuilder.challenges(candidate, negationStrategy)) {
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace("Challenge '{}' holds for {} known inputs", challenge.render(), challenge.support());
                }
                challenges.add(challenge.getConstraint());
            }
        }
        return new ArrayList<>(challenges);
    }

    private long seedFor(int round, int challengeIndex) {
        return seed + 1_000_003L * round + challengeIndex;
    }

    private @Nullable LabeledInput relabel(String text, InputOracle oracle) {
        try {
            DerivationNode tree = parser.parse(text);
            OracleResult label = oracle.classify(text);
            return new LabeledInput(text, tree, label);
        } catch (ParseException | OracleException e) {
            observer.onInputDropped(text, e);
            return null;
        } catch (RuntimeException e) {
            // includes QueryLimitException
            observer.onInputDropped(text, e);
            return null;
        }
    }

    private void finishRound(List<RoundReport> reports, RoundReport report) {
        reports.add(report);
        observer.onRoundFinished(report);
    }

    public static final class BuilderDefaults {

        private BuilderDefaults() {
            // prevent instantiation
        }

        public static ConstraintMiner miner() {
            return new ConstraintMiner();
        }

        public static int inputsPerChallenge() {
            return 10;
        }

        public static NegationStrategy negationStrategy() {
            return NegationStrategy.FIRST_LITERAL;
        }

        public static int challengedCandidates() {
            return 1;
        }

        public static long generatorTimeoutMillis() {
            return 0;
        }

        public static long timeoutMillis() {
            return 0;
        }

        public static long seed() {
            return 42;
        }

        public static RefinementObserver observer() {
            return RefinementObserver.NONE;
        }
    }
}
