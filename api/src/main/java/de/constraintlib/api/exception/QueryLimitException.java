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

// Thrown when an oracle is asked to classify an input, however its query budget has been used up.
public class QueryLimitException extends RuntimeException {

    /**
     * Default constructor.
     *
     * @see RuntimeException#RuntimeException()
     */
    public QueryLimitException() {
        super();
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public QueryLimitException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public QueryLimitException(String s) {
        super(s);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(Throwable)
     */
    public QueryLimitException(Throwable cause) {
        super(cause);
    }

}
