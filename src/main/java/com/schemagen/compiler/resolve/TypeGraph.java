package com.schemagen.compiler.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import com.schemagen.compiler.error.IllegalRecursionException;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;

import lombok.Value;

/**
 * Containment graph between declared types: one edge per struct field whose
 * type is a declaration.
 *
 * An edge is FIXED when the containing field has no runtime-sized dimension,
 * meaning the inner value is stored inline. A cycle of FIXED edges describes a
 * value of infinite size and is rejected; any cycle that passes through a
 * DYNAMIC edge is legal.
 */
public class TypeGraph {

    public enum EdgeKind {
        FIXED,
        DYNAMIC
    }

    @Value
    public static class Edge {
        TypeDeclaration from;
        TypeDeclaration to;
        FieldNode field;
        EdgeKind kind;
    }

    private enum Mark {
        WHITE,
        GRAY,
        BLACK
    }

    // sorted so that traversal order does not depend on declaration order
    private final Map<String, TypeDeclaration> nodes = new TreeMap<>();
    private final Map<String, List<Edge>> edges = new TreeMap<>();
    private final Map<String, Boolean> onCycle = new HashMap<>();

    public TypeGraph(Collection<? extends TypeDeclaration> declarations) {
        for (TypeDeclaration declaration : declarations) {
            nodes.put(declaration.getQualifiedName(), declaration);
            edges.put(declaration.getQualifiedName(), new ArrayList<>());
        }
        for (TypeDeclaration declaration : declarations) {
            if (declaration instanceof StructNode struct) {
                for (FieldNode field : struct.getFields()) {
                    if (field.getType().isDeclared()) {
                        EdgeKind kind = field.isDynamic() ? EdgeKind.DYNAMIC : EdgeKind.FIXED;
                        edges.get(struct.getQualifiedName())
                                .add(new Edge(struct, field.getType().getDeclaration(), field, kind));
                    }
                }
            }
        }
    }

    public List<Edge> getEdges(TypeDeclaration from) {
        return List.copyOf(edges.getOrDefault(from.getQualifiedName(), List.of()));
    }

    public int getNodeCount() {
        return nodes.size();
    }

    /**
     * @throws IllegalRecursionException naming the first fixed-size cycle found
     */
    public void checkNoFixedCycles() {
        List<Edge> cycle = findFixedCycleEdges();
        if (!cycle.isEmpty()) {
            throw new IllegalRecursionException(cycleNames(cycle), cycle.get(0).getField().getPosition());
        }
    }

    /**
     * The first cycle of FIXED edges in sorted name order, as qualified names
     * with the first name repeated at the end.
     */
    public Optional<List<String>> findFixedCycle() {
        List<Edge> cycle = findFixedCycleEdges();
        return cycle.isEmpty() ? Optional.empty() : Optional.of(cycleNames(cycle));
    }

    /**
     * True when the type can reach itself over edges of any kind.
     */
    public boolean isOnCycle(TypeDeclaration declaration) {
        return onCycle.computeIfAbsent(declaration.getQualifiedName(), this::reachesItself);
    }

    private boolean reachesItself(String start) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            for (Edge edge : edges.getOrDefault(current, List.of())) {
                String target = edge.getTo().getQualifiedName();
                if (target.equals(start)) {
                    return true;
                }
                if (seen.add(target)) {
                    pending.push(target);
                }
            }
        }
        return false;
    }

    private List<Edge> findFixedCycleEdges() {
        Map<String, Mark> marks = new HashMap<>();
        nodes.keySet().forEach(name -> marks.put(name, Mark.WHITE));
        List<Edge> path = new ArrayList<>();

        for (String name : nodes.keySet()) {
            if (marks.get(name) == Mark.WHITE) {
                List<Edge> cycle = visit(name, marks, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private List<Edge> visit(String name, Map<String, Mark> marks, List<Edge> path) {
        marks.put(name, Mark.GRAY);
        for (Edge edge : edges.get(name)) {
            if (edge.getKind() != EdgeKind.FIXED) {
                continue;
            }
            String target = edge.getTo().getQualifiedName();
            path.add(edge);

            Mark mark = marks.getOrDefault(target, Mark.BLACK);
            if (mark == Mark.GRAY) {
                int start = 0;
                while (!path.get(start).getFrom().getQualifiedName().equals(target)) {
                    start++;
                }
                return new ArrayList<>(path.subList(start, path.size()));
            }
            if (mark == Mark.WHITE) {
                List<Edge> cycle = visit(target, marks, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
            path.remove(path.size() - 1);
        }
        marks.put(name, Mark.BLACK);
        return List.of();
    }

    private static List<String> cycleNames(List<Edge> cycle) {
        List<String> names = new ArrayList<>();
        for (Edge edge : cycle) {
            names.add(edge.getFrom().getQualifiedName());
        }
        names.add(cycle.get(0).getFrom().getQualifiedName());
        return names;
    }
}
