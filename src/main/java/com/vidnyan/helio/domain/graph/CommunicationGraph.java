package com.vidnyan.helio.domain.graph;

import com.vidnyan.helio.domain.model.CommunicationEdge;

import java.util.*;

/**
 * Directed graph of synchronous service-to-service communications.
 * Used for circular dependency detection and long call-chain analysis.
 */
public final class CommunicationGraph {

    private final Map<String, List<String>> calls;   // service → services it calls, declaration order
    private final Set<String> services;

    private CommunicationGraph(Map<String, List<String>> calls, Set<String> services) {
        this.calls = Collections.unmodifiableMap(calls);
        this.services = Collections.unmodifiableSet(services);
    }

    /**
     * Build the graph from every {@code sync}-kind edge. Other kinds are ignored.
     */
    public static CommunicationGraph ofSyncEdges(List<CommunicationEdge> edges) {
        Map<String, List<String>> calls = new LinkedHashMap<>();
        Set<String> services = new LinkedHashSet<>();

        for (CommunicationEdge edge : edges) {
            if (!edge.isSync() || edge.source() == null || edge.target() == null) {
                continue;
            }
            calls.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            services.add(edge.source());
            services.add(edge.target());
        }

        return new CommunicationGraph(calls, services);
    }

    /**
     * Services called directly by a service.
     */
    public List<String> getCallees(String service) {
        return calls.getOrDefault(service, List.of());
    }

    /**
     * Services that appear as the source of at least one edge, in first-seen order.
     */
    public Set<String> getCallers() {
        return calls.keySet();
    }

    public Set<String> getAllServices() {
        return services;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /**
     * Find distinct directed cycles.
     * Each cycle is the rotation of the DFS path starting at the repeated node, without the
     * closing node. Cycles with the same members are reported once.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> seenMembers = new HashSet<>();
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();

        for (String service : services) {
            if (!visited.contains(service)) {
                findCyclesRecursive(service, visited, onPath, new ArrayList<>(), cycles, seenMembers);
            }
        }

        return cycles;
    }

    private void findCyclesRecursive(
            String current,
            Set<String> visited,
            Set<String> onPath,
            List<String> path,
            List<List<String>> cycles,
            Set<Set<String>> seenMembers
    ) {
        visited.add(current);
        onPath.add(current);
        path.add(current);

        for (String callee : getCallees(current)) {
            if (onPath.contains(callee)) {
                int cycleStart = path.indexOf(callee);
                List<String> cycle = List.copyOf(path.subList(cycleStart, path.size()));
                if (seenMembers.add(new HashSet<>(cycle))) {
                    cycles.add(cycle);
                }
            } else if (!visited.contains(callee)) {
                findCyclesRecursive(callee, visited, onPath, path, cycles, seenMembers);
            }
        }

        path.remove(path.size() - 1);
        onPath.remove(current);
    }

    /**
     * Enumerate every simple path from each calling service to a leaf, where a leaf is a node
     * with no outgoing edge to a node not already on the path. Single-node paths are skipped.
     */
    public List<List<String>> findCallChains() {
        List<List<String>> chains = new ArrayList<>();
        for (String caller : calls.keySet()) {
            List<String> path = new ArrayList<>();
            path.add(caller);
            walkChains(caller, path, chains);
        }
        return chains;
    }

    private void walkChains(String current, List<String> path, List<List<String>> chains) {
        boolean leaf = true;
        for (String callee : getCallees(current)) {
            if (path.contains(callee)) {
                continue;
            }
            leaf = false;
            path.add(callee);
            walkChains(callee, path, chains);
            path.remove(path.size() - 1);
        }
        if (leaf && path.size() > 1) {
            chains.add(List.copyOf(path));
        }
    }
}
