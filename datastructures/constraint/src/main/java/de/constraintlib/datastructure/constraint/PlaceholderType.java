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
 * The types of the slots of a {@link ConstraintTemplate}.
 */
public enum PlaceholderType {
    NON_TERMINAL("<NON_TERMINAL>", String.class),
    INTEGER("<INTEGER>", java.math.BigInteger.class),
    STRING("<STRING>", String.class);

    private final String placeholder;
    private final Class<?> valueType;

    PlaceholderType(String placeholder, Class<?> valueType) {
        this.placeholder = placeholder;
        this.valueType = valueType;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public boolean accepts(Object value) {
        return valueType.isInstance(value);
    }
}
