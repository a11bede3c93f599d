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
 * A visitor over the closed set of {@link Constraint} variants.
 *
 * @param <R>
 *         result type
 */
public interface ConstraintVisitor<R> {

    R visitNumericComparison(NumericComparison constraint);

    R visitStringEquality(StringEquality constraint);

    R visitExistentialMembership(ExistentialMembership constraint);

    R visitLengthRelation(LengthRelation constraint);

    R visitArithmeticRelation(ArithmeticRelation constraint);

    R visitNegation(Negation constraint);

    R visitConjunction(Conjunction constraint);
}
