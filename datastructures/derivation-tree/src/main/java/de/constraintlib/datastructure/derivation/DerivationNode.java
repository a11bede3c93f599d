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
package de.constraintlib.datastructure.derivation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A node of a derivation tree. Inner nodes are labeled with a non-terminal tag, leaves are terminal symbols carrying a
 * piece of the input text. The text covered by a node is the concatenation of the texts of its leaves, so the text of
 * the root reproduces the parsed input exactly.
 * <p>
 * Nodes are immutable. All traversals are iterative, so trees of arbitrary depth (e.g. from self-recursive rules) can
 * be searched without exhausting the call stack.
 *
 * @author ConstraintLib contributors
 */
public final class DerivationNode {

    private final String symbol;
    private final boolean terminal;
    private final ImmutableList<DerivationNode> children;
    private final String text;

    private DerivationNode(String symbol, boolean terminal, ImmutableList<DerivationNode> children, String text) {
        this.symbol = symbol;
        this.terminal = terminal;
        this.children = children;
        this.text = text;
    }

    /**
     * Creates a leaf for a terminal symbol.
     *
     * @param text
     *         the text produced by the terminal, may be empty
     *
     * @return the leaf node
     */
    public static DerivationNode terminal(String text) {
        Objects.requireNonNull(text, "text");
        return new DerivationNode(text, true, ImmutableList.of(), text);
    }

    /**
     * Creates an inner node for a non-terminal.
     *
     * @param tag
     *         the non-terminal tag, without angle brackets
     * @param children
     *         the ordered children; an empty list derives the empty word
     *
     * @return the inner node
     */
    public static DerivationNode nonTerminal(String tag, List<DerivationNode> children) {
        Preconditions.checkArgument(tag != null && !tag.isEmpty(), "non-terminal tag must not be empty");
        ImmutableList<DerivationNode> copy = ImmutableList.copyOf(children);
        StringBuilder sb = new StringBuilder();
        for (DerivationNode child : copy) {
            sb.append(child.text);
        }
        return new DerivationNode(tag, false, copy, sb.toString());
    }

    public static DerivationNode nonTerminal(String tag, DerivationNode... children) {
        return nonTerminal(tag, ImmutableList.copyOf(children));
    }

    /**
     * Returns the non-terminal tag of an inner node or the terminal text of a leaf.
     *
     * @return the symbol of this node
     */
    public String getSymbol() {
        return symbol;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public List<DerivationNode> getChildren() {
        return children;
    }

    /**
     * Returns the contiguous part of the input covered by this node.
     *
     * @return the covered text
     */
    public String getText() {
        return text;
    }

    /**
     * Lazily enumerates all occurrences of a non-terminal in this tree (this node included), left to right in
     * pre-order. Every node is visited at most once per iteration.
     *
     * @param tag
     *         the non-terminal tag to search for
     *
     * @return the occurrences of {@code tag}
     */
    public Iterable<NonTerminalOccurrence> occurrences(String tag) {
        return () -> new OccurrenceIterator(this, tag);
    }

    /**
     * Eagerly collects {@link #occurrences(String)}.
     *
     * @param tag
     *         the non-terminal tag to search for
     *
     * @return the occurrences of {@code tag} in pre-order
     */
    public List<NonTerminalOccurrence> findAll(String tag) {
        return ImmutableList.copyOf(occurrences(tag));
    }

    public boolean contains(String tag) {
        return occurrences(tag).iterator().hasNext();
    }

    /**
     * Returns the tags of all non-terminals in this tree, in order of first appearance.
     *
     * @return the non-terminal tags
     */
    public Set<String> nonTerminalTags() {
        Set<String> tags = new LinkedHashSet<>();
        Deque<DerivationNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            DerivationNode node = stack.pop();
            if (node.terminal) {
                continue;
            }
            tags.add(node.symbol);
            pushChildren(stack, node);
        }
        return ImmutableSet.copyOf(tags);
    }

    /**
     * Returns the concatenated leaf texts, computed by walking the tree. Equals {@link #getText()} for every well-formed
     * tree.
     *
     * @return the concatenation of all terminal leaves
     */
    public String leafText() {
        StringBuilder sb = new StringBuilder();
        Deque<DerivationNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            DerivationNode node = stack.pop();
            if (node.terminal) {
                sb.append(node.text);
            } else {
                pushChildren(stack, node);
            }
        }
        return sb.toString();
    }

    private static void pushChildren(Deque<DerivationNode> stack, DerivationNode node) {
        // reverse order, so the leftmost child is popped first
        for (int i = node.children.size() - 1; i >= 0; i--) {
            stack.push(node.children.get(i));
        }
    }

    @Override
    public String toString() {
        return terminal ? '"' + text + '"' : '<' + symbol + '>';
    }

    private static final class OccurrenceIterator implements Iterator<NonTerminalOccurrence> {

        private final Deque<DerivationNode> stack = new ArrayDeque<>();
        private final String tag;
        private NonTerminalOccurrence next;

        OccurrenceIterator(DerivationNode root, String tag) {
            this.tag = tag;
            this.stack.push(root);
            advance();
        }

        private void advance() {
            next = null;
            while (next == null && !stack.isEmpty()) {
                DerivationNode node = stack.pop();
                if (node.terminal) {
                    continue;
                }
                pushChildren(stack, node);
                if (node.symbol.equals(tag)) {
                    next = new NonTerminalOccurrence(tag, node);
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public NonTerminalOccurrence next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            NonTerminalOccurrence result = next;
            advance();
            return result;
        }
    }
}
