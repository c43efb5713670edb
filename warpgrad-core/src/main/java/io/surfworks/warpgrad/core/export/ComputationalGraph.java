package io.surfworks.warpgrad.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Read-only snapshot of the nodes and edges backward-reachable from a set of
 * roots, for external visualizers.
 *
 * <p>Traversal uses the same rank priority as the backward pass and stops at
 * unchained variables. No gradient is computed. Edges go from an input
 * variable to the operation consuming it, and from an operation to each of
 * its outputs that was reached.
 *
 * <pre>{@code
 * String dot = ComputationalGraph.build(List.of(loss)).toDot(DotOptions.defaults().withRankdir("LR"));
 * }</pre>
 */
public final class ComputationalGraph {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public enum Kind {
        VARIABLE,
        OPERATION
    }

    /**
     * A graph node. {@code id} is unique within this graph.
     */
    public record Node(String id, Kind kind, String label, String name, int rank, Object source) {
    }

    public record Edge(Node head, Node tail) {
    }

    private final List<Node> nodes;
    private final List<Edge> edges;

    private ComputationalGraph(List<Node> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    // ==================== Construction ====================

    /**
     * Builds the graph reachable from {@code roots}, each of which is a
     * {@link Variable} or an {@link OperationNode}.
     *
     * @throws IllegalArgumentException if a root is of another type
     */
    public static ComputationalGraph build(List<?> roots) {
        Objects.requireNonNull(roots, "roots cannot be null");
        return new Traversal().run(roots);
    }

    private record Candidate(Object item, int rank, long order) {
    }

    private static final class Traversal {
        private final Map<Object, Node> byIdentity = new IdentityHashMap<>();
        private final Map<Node, Map<Node, Boolean>> seenEdges = new IdentityHashMap<>();
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final PriorityQueue<Candidate> candidates = new PriorityQueue<>(
                Comparator.comparingInt((Candidate c) -> -c.rank()).thenComparingLong(Candidate::order));
        private long pushCount;

        ComputationalGraph run(List<?> roots) {
            for (Object root : roots) {
                if (!(root instanceof Variable) && !(root instanceof OperationNode)) {
                    throw new IllegalArgumentException("Roots must be Variable or OperationNode, got "
                            + (root == null ? "null" : root.getClass().getName()));
                }
                node(root);
                push(root);
            }
            while (!candidates.isEmpty()) {
                Object item = candidates.poll().item();
                if (item instanceof Variable) {
                    Variable v = (Variable) item;
                    OperationNode creator = v.creator();
                    if (creator != null && addEdge(creator, v)) {
                        push(creator);
                    }
                } else {
                    OperationNode op = (OperationNode) item;
                    for (Variable input : op.inputs()) {
                        if (addEdge(input, op)) {
                            push(input);
                        }
                    }
                }
            }
            return new ComputationalGraph(nodes, edges);
        }

        private void push(Object item) {
            int rank = item instanceof Variable ? ((Variable) item).rank() : ((OperationNode) item).rank();
            candidates.add(new Candidate(item, rank, pushCount++));
        }

        private boolean addEdge(Object headItem, Object tailItem) {
            Node head = node(headItem);
            Node tail = node(tailItem);
            Map<Node, Boolean> tails = seenEdges.computeIfAbsent(head, k -> new IdentityHashMap<>());
            if (tails.put(tail, Boolean.TRUE) != null) {
                return false;
            }
            edges.add(new Edge(head, tail));
            return true;
        }

        private Node node(Object item) {
            Node existing = byIdentity.get(item);
            if (existing != null) {
                return existing;
            }
            String id = "n" + nodes.size();
            Node created;
            if (item instanceof Variable) {
                Variable v = (Variable) item;
                created = new Node(id, Kind.VARIABLE, v.label(), v.name(), v.rank(), v);
            } else {
                OperationNode op = (OperationNode) item;
                created = new Node(id, Kind.OPERATION, op.label(), null, op.rank(), op);
            }
            byIdentity.put(item, created);
            nodes.add(created);
            return created;
        }
    }

    // ==================== Queries ====================

    public List<Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Node> nodes(Kind kind) {
        List<Node> result = new ArrayList<>();
        for (Node n : nodes) {
            if (n.kind() == kind) {
                result.add(n);
            }
        }
        return result;
    }

    /**
     * The node standing for {@code item}, or null if it was not reached.
     */
    public Node nodeOf(Object item) {
        for (Node n : nodes) {
            if (n.source() == item) {
                return n;
            }
        }
        return null;
    }

    public boolean hasEdge(Object headItem, Object tailItem) {
        for (Edge e : edges) {
            if (e.head().source() == headItem && e.tail().source() == tailItem) {
                return true;
            }
        }
        return false;
    }

    // ==================== Rendering ====================

    public String toDot() {
        return toDot(DotOptions.defaults());
    }

    /**
     * Renders Graphviz dot: {@code digraph graphname{rankdir=..;} followed by
     * one statement per node and one per edge.
     */
    public String toDot(DotOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        StringBuilder sb = new StringBuilder("digraph graphname{rankdir=").append(options.rankdir()).append(';');
        for (Node n : nodes) {
            Map<String, String> style = n.kind() == Kind.VARIABLE ? options.variableStyle() : options.operationStyle();
            sb.append(n.id()).append(" [label=\"").append(escape(displayLabel(n, options))).append('"');
            for (Map.Entry<String, String> attr : style.entrySet()) {
                if (!"label".equals(attr.getKey())) {
                    sb.append(',').append(attr.getKey()).append("=\"").append(escape(attr.getValue())).append('"');
                }
            }
            sb.append("];");
        }
        for (Edge e : edges) {
            sb.append(e.head().id()).append(" -> ").append(e.tail().id()).append(';');
        }
        return sb.append('}').toString();
    }

    /**
     * JSON document with {@code nodes} and {@code edges} arrays.
     */
    public String toJson() {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode nodeArray = root.putArray("nodes");
        for (Node n : nodes) {
            ObjectNode json = nodeArray.addObject();
            json.put("id", n.id());
            json.put("kind", n.kind().name().toLowerCase());
            json.put("label", n.label());
            if (n.name() != null) {
                json.put("name", n.name());
            }
            json.put("rank", n.rank());
        }
        ArrayNode edgeArray = root.putArray("edges");
        for (Edge e : edges) {
            ObjectNode json = edgeArray.addObject();
            json.put("from", e.head().id());
            json.put("to", e.tail().id());
        }
        try {
            return JSON.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String displayLabel(Node n, DotOptions options) {
        if (options.showName() && n.name() != null) {
            return n.name() + ": " + n.label();
        }
        return n.label();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public String toString() {
        return "ComputationalGraph[nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}
