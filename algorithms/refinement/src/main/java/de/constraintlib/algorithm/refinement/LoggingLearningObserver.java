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

import java.util.List;

import de.constraintlib.algorithm.mining.Candidate;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.derivation.Corpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards mining and refinement progress to SLF4J. Round summaries are logged at INFO, per-step details at DEBUG and
 * discarded inputs at WARN.
 *
 * @author ConstraintLib contributors
 */
public class LoggingLearningObserver implements RefinementObserver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingLearningObserver.class);

    @Override
    public void onCandidatesInstantiated(int count) {
        LOGGER.debug("Instantiated {} atomic candidates", count);
    }

    @Override
    public void onCandidatesEvaluated(int evaluated, int fullRecall, int retained) {
        LOGGER.debug("Evaluated {} atomic candidates: {} with full recall, {} retained", evaluated, fullRecall, retained);
    }

    @Override
    public void onConjunctionsFound(int count) {
        LOGGER.debug("Found {} conjunctions", count);
    }

    @Override
    public void onMiningFinished(List<Candidate> result) {
        if (result.isEmpty()) {
            LOGGER.info("Mining found no candidates");
        } else {
            LOGGER.info("Best of {} candidates: {}", result.size(), result.get(0));
        }
    }

    @Override
    public void onStateChanged(int round, RefinementState state) {
        LOGGER.debug("Round {}: {}", round, state);
    }

    @Override
    public void onRoundStarted(int round, Corpus corpus) {
        LOGGER.info("Starting round {} on {}", round, corpus);
    }

    @Override
    public void onChallengeUnsatisfiable(Constraint challenge, Exception cause) {
        LOGGER.info("Challenge '{}' is unsatisfiable: {}", challenge, cause.getMessage());
    }

    @Override
    public void onInputDropped(String text, Exception cause) {
        LOGGER.warn("Dropping generated input '{}'", text, cause);
    }

    @Override
    public void onRoundFinished(RoundReport report) {
        LOGGER.info("{}", report);
    }

    @Override
    public void onTerminated(RefinementResult result) {
        LOGGER.info("Refinement finished: {}", result);
    }
}
