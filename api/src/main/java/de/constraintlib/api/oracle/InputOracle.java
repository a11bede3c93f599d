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

import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;

/**
 * A program oracle: runs the system under test on an input and reports whether it fails.
 */
@FunctionalInterface
public interface InputOracle {

    /**
     * Classifies an input.
     *
     * @param text
     *         the input text
     *
     * @return {@link OracleResult#FAILING} if the input triggers the failure, {@link OracleResult#PASSING} otherwise
     *
     * @throws OracleException
     *         if the input could not be classified
     */
    OracleResult classify(String text) throws OracleException;
}
