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

/**
 * Which literals of a candidate are negated to build challenges.
 *
 * @author ConstraintLib contributors
 */
public enum NegationStrategy {

    /**
     * Negate the first literal (in canonical order) and keep the others, yielding one challenge per candidate.
     */
    FIRST_LITERAL,

    /**
     * Challenge every non-empty subset of negated literals, yielding {@code 2^n - 1} challenges for {@code n} literals.
     */
    ALL_COMBINATIONS
}
