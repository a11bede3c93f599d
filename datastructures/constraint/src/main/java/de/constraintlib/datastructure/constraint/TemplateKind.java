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
 * The operator kinds of constraint templates. The set is closed: every kind corresponds to exactly one atomic
 * {@link Constraint} variant.
 */
public enum TemplateKind {
    /** {@code int(<N>) <op> <INT>}. */
    NUMERIC_COMPARISON,
    /** {@code str(<N>) == <STR>}. */
    STRING_EQUALITY,
    /** {@code exists <e> in <N>: ...}. */
    EXISTENTIAL_MEMBERSHIP,
    /** {@code int(<N1>) == len(str(<N2>))}. */
    LENGTH_RELATION,
    /** {@code int(<N1>) <op> int(<N2>)}. */
    ARITHMETIC_RELATION
}
