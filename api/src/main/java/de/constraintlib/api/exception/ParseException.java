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
package de.constraintlib.api.exception;

/**
 * Signals that an input text cannot be derived from the grammar of an {@link de.constraintlib.api.InputParser}.
 * Inputs that fail to parse never enter a corpus.
 */
public class ParseException extends Exception {

    private final String input;

    public ParseException(String input, String message) {
        super(message);
        this.input = input;
    }

    public ParseException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    /**
     * Returns the text that could not be parsed.
     *
     * @return the offending input text
     */
    public String getInput() {
        return input;
    }
}
