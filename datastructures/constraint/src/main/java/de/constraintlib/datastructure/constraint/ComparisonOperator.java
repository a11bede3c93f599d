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
package de.constraintlib.datastructure.constraint;

/**
 * The comparison operators available to numeric templates.
 */
public enum ComparisonOperator {
    LESS_EQUAL("<="),
    EQUAL("=="),
    GREATER_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Applies this operator to the result of a {@link Comparable#compareTo(Object) comparison}.
     *
     * @param comparison
     *         the sign of {@code left.compareTo(right)}
     *
     * @return whether {@code left <op> right} holds
     */
    public boolean test(int comparison) {
        switch (this) {
            case LESS_EQUAL:
                return comparison <= 0;
            case EQUAL:
                return comparison == 0;
            case GREATER_EQUAL:
                return comparison >= 0;
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }
}
