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
package de.constraintlib.algorithm.mining;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.constraintlib.datastructure.constraint.ConstraintTemplate;
import de.constraintlib.datastructure.constraint.TemplateKind;

/**
 * The templates a {@link ConstraintMiner} instantiates.
 *
 * @author ConstraintLib contributors
 */
public final class PatternCatalog {

    private static final PatternCatalog BUILT_IN = new PatternCatalog(ConstraintTemplate.builtIns());

    private final ImmutableList<ConstraintTemplate> templates;

    private PatternCatalog(Collection<ConstraintTemplate> templates) {
        Preconditions.checkArgument(!templates.isEmpty(), "A pattern catalog needs at least one template");
        this.templates = ImmutableList.copyOf(templates);
    }

    /**
     * Returns the catalog of all built-in templates.
     *
     * @return the built-in catalog
     */
    public static PatternCatalog builtIn() {
        return BUILT_IN;
    }

    public static PatternCatalog of(ConstraintTemplate... templates) {
        return new PatternCatalog(Arrays.asList(templates));
    }

    public static PatternCatalog of(Collection<ConstraintTemplate> templates) {
        return new PatternCatalog(templates);
    }

    /**
     * Restricts the built-in catalog to some template kinds.
     *
     * @param kinds
     *         the kinds to keep
     *
     * @return a catalog with the built-in templates of the given kinds
     */
    public static PatternCatalog builtIn(TemplateKind... kinds) {
        List<TemplateKind> keep = Arrays.asList(kinds);
        ImmutableList.Builder<ConstraintTemplate> result = ImmutableList.builder();
        for (ConstraintTemplate t : ConstraintTemplate.builtIns()) {
            if (keep.contains(t.getKind())) {
                result.add(t);
            }
        }
        return new PatternCatalog(result.build());
    }

    public List<ConstraintTemplate> getTemplates() {
        return templates;
    }

    public int size() {
        return templates.size();
    }

    @Override
    public String toString() {
        return templates.toString();
    }
}
