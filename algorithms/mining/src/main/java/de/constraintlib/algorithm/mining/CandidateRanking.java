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
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * The total order in which mined candidates are reported:
 * <ol>
 * <li>perfect separators first, fewer literals first,</li>
 * <li>then by descending product of precision and recall,</li>
 * <li>then by descending support,</li>
 * <li>then by ascending number of literals,</li>
 * <li>then by rendered expression.</li>
 * </ol>
 * The order does not depend on the order in which candidates were produced.
 *
 * @author ConstraintLib contributors
 */
public final class CandidateRanking {

    /**
     * Orders candidates by rank, ignoring their rendered expressions.
     */
    public static final Comparator<Candidate> BY_RANK = Comparator.<Candidate, Boolean>comparing(Candidate::isPerfect)
                                                                  .reversed()
                                                                  .thenComparingInt(CandidateRanking::perfectLiterals)
                                                                  .thenComparing(CandidateRanking::score,
                                                                                 Comparator.reverseOrder())
                                                                  .thenComparing(Candidate::support,
                                                                                 Comparator.reverseOrder())
                                                                  .thenComparingInt(Candidate::getLiteralCount);

    /**
     * The full ranking, with the rendered expression as the final tie-breaker.
     */
    public static final Comparator<Candidate> ORDER = BY_RANK.thenComparing(Candidate::render);

    private CandidateRanking() {
        // prevent instantiation
    }

    private static int perfectLiterals(Candidate c) {
        return c.isPerfect() ? c.getLiteralCount() : 0;
    }

    private static double score(Candidate c) {
        return c.precision() * c.recall();
    }

    /**
     * Ranks candidates and selects the best ones.
     *
     * @param candidates
     *         the candidates to rank
     * @param maxResults
     *         the number of candidates to select; {@code 0} selects all candidates tied at the best rank
     * @param <C>
     *         candidate type
     *
     * @return the selected candidates, best first
     */
    public static <C extends Candidate> List<C> top(Collection<C> candidates, int maxResults) {
        List<C> ranked = new ArrayList<>(candidates);
        ranked.sort(ORDER);
        if (ranked.isEmpty()) {
            return ranked;
        }
        if (maxResults > 0) {
            return new ArrayList<>(ranked.subList(0, Math.min(maxResults, ranked.size())));
        }
        C best = ranked.get(0);
        int end = 1;
        while (end < ranked.size() && BY_RANK.compare(best, ranked.get(end)) == 0) {
            end++;
        }
        return new ArrayList<>(ranked.subList(0, end));
    }
}
