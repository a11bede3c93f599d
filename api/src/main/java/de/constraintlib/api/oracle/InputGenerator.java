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
package de.constraintlib.api.oracle;

import java.util.List;

import de.constraintlib.api.exception.UnsatisfiableException;

/**
 * A search-based input generator. Given a constraint expression, it produces texts of its grammar whose derivations
 * satisfy that expression. The generator knows nothing about the oracle.
 * <p>
 * The order of the returned inputs is unspecified.
 *
 * @param <C>
 *         constraint expression type
 */
public interface InputGenerator<C> {

    /**
     * Generates inputs satisfying a constraint.
     *
     * @param constraint
     *         the constraint the inputs have to satisfy
     * @param desiredCount
     *         the number of inputs requested; generators may return fewer
     * @param seed
     *         the seed making the search reproducible
     *
     * @return the generated input texts
     *
     * @throws UnsatisfiableException
     *         if no input satisfying {@code constraint} could be found
     */
    List<String> generate(C constraint, int desiredCount, long seed) throws UnsatisfiableException;
}
