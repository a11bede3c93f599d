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
package de.constraintlib.api;

import de.constraintlib.api.exception.ParseException;

/**
 * Turns input text into its derivation under some grammar. Parsers are treated as pure functions: parsing the same
 * text twice yields equal derivations.
 *
 * @param <T>
 *         derivation type
 */
@FunctionalInterface
public interface InputParser<T> {

    /**
     * Parses the given text.
     *
     * @param text
     *         the input text
     *
     * @return the derivation of {@code text}
     *
     * @throws ParseException
     *         if {@code text} is not in the language of the grammar
     */
    T parse(String text) throws ParseException;
}
