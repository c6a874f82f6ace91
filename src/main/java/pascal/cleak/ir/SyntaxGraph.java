/*
 * CLeak: A Resource-Ownership Checker for C/C++
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of CLeak.
 *
 * CLeak is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * CLeak is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with CLeak. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.cleak.ir;

import pascal.cleak.ir.stmt.Stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Arena of the syntax nodes of one function. Every node is addressed by
 * its index; the link from a node to its enclosing node is stored here
 * by index, so it can never dangle.
 * <p>
 * Nodes are added bottom-up: a node can only be added after all of its
 * children, which is exactly the order in which a front end (or
 * {@link IRBuilder}) creates them.
 */
public class SyntaxGraph implements Iterable<Node> {

    private static final int NO_PARENT = -1;

    private final List<Node> nodes = new ArrayList<>();

    private final List<Integer> parents = new ArrayList<>();

    /**
     * Adds a node whose children are already in this graph,
     * and links the children to it.
     *
     * @return the given node.
     */
    public <N extends Node> N add(N node) {
        int index = nodes.size();
        node.setIndex(index);
        nodes.add(node);
        parents.add(NO_PARENT);
        for (Node child : node.getChildren()) {
            int childIndex = child.getIndex();
            if (childIndex < 0 || childIndex >= index || nodes.get(childIndex) != child) {
                throw new IllegalArgumentException(
                        "Child '" + child + "' of '" + node + "' is not in this graph");
            }
            if (parents.get(childIndex) != NO_PARENT) {
                throw new IllegalArgumentException(
                        "Node '" + child + "' already has an enclosing node");
            }
            parents.set(childIndex, index);
        }
        return node;
    }

    public Node getNode(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return the node that directly encloses the given node,
     * or null if it is a root.
     */
    public Node getParent(Node node) {
        int parent = parents.get(node.getIndex());
        return parent == NO_PARENT ? null : nodes.get(parent);
    }

    /**
     * @return the innermost statement that contains the given node
     * (the node itself if it is a statement), or null if there is none.
     */
    public Stmt getEnclosingStmt(Node node) {
        for (Node n = node; n != null; n = getParent(n)) {
            if (n instanceof Stmt stmt) {
                return stmt;
            }
        }
        return null;
    }

    /**
     * @return true if {@code ancestor} is {@code node} or encloses it.
     */
    public boolean isWithin(Node node, Node ancestor) {
        for (Node n = node; n != null; n = getParent(n)) {
            if (n == ancestor) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lists {@code start} and the nodes below it in source order.
     * Nodes satisfying {@code prune} are listed, but their
     * children are not.
     */
    public List<Node> walk(Node start, Predicate<Node> prune) {
        List<Node> result = new ArrayList<>();
        walk(start, prune, result);
        return result;
    }

    private static void walk(Node node, Predicate<Node> prune, List<Node> result) {
        result.add(node);
        if (!prune.test(node)) {
            for (Node child : node.getChildren()) {
                walk(child, prune, result);
            }
        }
    }

    @Override
    public Iterator<Node> iterator() {
        return Collections.unmodifiableList(nodes).iterator();
    }
}
