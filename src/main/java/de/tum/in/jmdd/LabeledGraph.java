/*
 * This file is part of JMDD.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JMDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JMDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JMDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jmdd;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * An immutable directed graph with labeled nodes and edges, the result of exporting a
 * {@link DecisionDiagram}. Inner nodes are labeled with the name of the variable they decide on,
 * leaves with an output value.
 *
 * @param <L> type of edge labels
 */
public final class LabeledGraph<L> {
    private final int root;
    private final Map<Integer, Node> nodes;
    private final List<Edge<L>> edges;
    private final Map<Integer, List<Edge<L>>> outgoing;

    private LabeledGraph(int root, Map<Integer, Node> nodes, List<Edge<L>> edges) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableList(edges);
        Map<Integer, List<Edge<L>>> outgoing = new LinkedHashMap<>();
        for (Integer id : nodes.keySet()) {
            outgoing.put(id, new ArrayList<>());
        }
        for (Edge<L> edge : edges) {
            outgoing.get(edge.source()).add(edge);
        }
        outgoing.replaceAll((id, list) -> Collections.unmodifiableList(list));
        this.outgoing = outgoing;
    }

    static <L> Builder<L> builder() {
        return new Builder<>();
    }

    public Node root() {
        return nodes.get(root);
    }

    public List<Node> nodes() {
        return new ArrayList<>(nodes.values());
    }

    public Node node(int id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return node;
    }

    public List<Edge<L>> edges() {
        return edges;
    }

    public List<Edge<L>> outgoing(int id) {
        node(id);
        return outgoing.get(id);
    }

    public List<Node> successors(int id) {
        List<Node> successors = new ArrayList<>();
        for (Edge<L> edge : outgoing(id)) {
            successors.add(nodes.get(edge.target()));
        }
        return successors;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns a graph with identical structure and the given function applied to each edge.
     */
    public <M> LabeledGraph<M> mapEdges(Function<Edge<L>, M> mapping) {
        List<Edge<M>> mapped = new ArrayList<>(edges.size());
        for (Edge<L> edge : edges) {
            mapped.add(new Edge<>(edge.source(), edge.target(), mapping.apply(edge)));
        }
        return new LabeledGraph<>(root, new LinkedHashMap<>(nodes), mapped);
    }

    /**
     * Renders this graph in the GraphViz dot format.
     */
    public String toDot() {
        StringBuilder dot = new StringBuilder(64 * (nodes.size() + edges.size()));
        dot.append("digraph MDD {\n");
        dot.append("\tinit__ [label=\"\", style=invis, height=0, width=0];\n");
        dot.append("\tinit__ -> ").append(root).append(";\n");
        for (Node node : nodes.values()) {
            dot.append('\t').append(node.id()).append(" [label=\"").append(escape(node.label()))
                    .append(node.isLeaf() ? "\", shape=box];\n" : "\", shape=circle];\n");
        }
        for (Edge<L> edge : edges) {
            dot.append('\t').append(edge.source()).append(" -> ").append(edge.target())
                    .append(" [label=\"").append(escape(edge.label())).append("\"];\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String escape(@Nullable Object label) {
        return String.valueOf(label).replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public String toString() {
        return String.format("LabeledGraph(%d nodes, %d edges, root %d)", nodes.size(), edges.size(), root);
    }

    public static final class Node {
        private final int id;
        @Nullable
        private final Object label;
        private final boolean leaf;

        Node(int id, @Nullable Object label, boolean leaf) {
            this.id = id;
            this.label = label;
            this.leaf = leaf;
        }

        public int id() {
            return id;
        }

        /**
         * The variable name for inner nodes, the output value for leaves.
         */
        @Nullable
        public Object label() {
            return label;
        }

        public boolean isLeaf() {
            return leaf;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Node)) {
                return false;
            }
            Node other = (Node) o;
            return id == other.id && leaf == other.leaf && Objects.equals(label, other.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, label, leaf);
        }

        @Override
        public String toString() {
            return id + ":" + label;
        }
    }

    public static final class Edge<L> {
        private final int source;
        private final int target;
        private final L label;

        Edge(int source, int target, L label) {
            this.source = source;
            this.target = target;
            this.label = label;
        }

        public int source() {
            return source;
        }

        public int target() {
            return target;
        }

        public L label() {
            return label;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Edge)) {
                return false;
            }
            Edge<?> other = (Edge<?>) o;
            return source == other.source && target == other.target && label.equals(other.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, target, label);
        }

        @Override
        public String toString() {
            return source + " -[" + label + "]-> " + target;
        }
    }

    static final class Builder<L> {
        private final Map<Integer, Node> nodes = new LinkedHashMap<>();
        private final List<Edge<L>> edges = new ArrayList<>();

        private Builder() {}

        Builder<L> addNode(int id, @Nullable Object label, boolean leaf) {
            if (nodes.put(id, new Node(id, label, leaf)) != null) {
                throw new IllegalArgumentException("Duplicate node " + id);
            }
            return this;
        }

        Builder<L> addEdge(int source, int target, L label) {
            edges.add(new Edge<>(source, target, label));
            return this;
        }

        LabeledGraph<L> build(int root) {
            if (!nodes.containsKey(root)) {
                throw new IllegalArgumentException("Root " + root + " is not a node");
            }
            for (Edge<L> edge : edges) {
                if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                    throw new IllegalArgumentException("Edge " + edge + " refers to unknown nodes");
                }
            }
            return new LabeledGraph<>(root, new LinkedHashMap<>(nodes), new ArrayList<>(edges));
        }
    }
}
