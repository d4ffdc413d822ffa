package com.podshift.dependency.model.snapshot;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only lookup tables over a {@link Snapshot}.
 *
 * Name resolution rules:
 * - container names and ids resolve to exactly one container
 * - network aliases and compose service names may resolve to several containers
 * - compose services are scoped by project
 *
 * Containers without a usable id are left out of every table; extractors report them
 * as malformed when they meet them.
 */
public final class SnapshotIndex {

    private final Snapshot snapshot;
    private final Map<String, ContainerNode> byId = new TreeMap<>();
    private final Map<String, String> idByName = new TreeMap<>();
    private final Map<String, SortedSet<String>> idsByHost = new TreeMap<>();
    private final Map<String, SortedSet<String>> idsByComposeService = new TreeMap<>();

    private SnapshotIndex(Snapshot snapshot) {
        this.snapshot = snapshot;
        for (ContainerNode container : safe(snapshot.getContainers())) {
            if (container == null || isBlank(container.getId())) {
                continue;
            }
            String id = container.getId();
            byId.putIfAbsent(id, container);

            if (!isBlank(container.getName())) {
                idByName.putIfAbsent(stripSlash(container.getName()), id);
                addHost(stripSlash(container.getName()), id);
            }
            if (container.getNetworks() != null) {
                container.getNetworks().forEach((network, alias) -> {
                    if (!isBlank(alias)) {
                        addHost(alias, id);
                    }
                });
            }
            if (!isBlank(container.getComposeService())) {
                addHost(container.getComposeService(), id);
                idsByComposeService
                        .computeIfAbsent(serviceKey(container.getComposeProject(), container.getComposeService()),
                                k -> new TreeSet<>())
                        .add(id);
            }
        }
    }

    public static SnapshotIndex of(Snapshot snapshot) {
        return new SnapshotIndex(snapshot);
    }

    /** Containers in the snapshot order, nulls included so extractors can report them. */
    public List<ContainerNode> rawContainers() {
        return safe(snapshot.getContainers());
    }

    public List<ComposeService> composeServices() {
        return safe(snapshot.getComposeServices());
    }

    public SortedSet<String> containerIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(byId.keySet()));
    }

    public Optional<ContainerNode> container(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Resolve a container reference given by name (with or without leading slash) or id.
     */
    public Optional<String> resolveContainer(String reference) {
        if (isBlank(reference)) {
            return Optional.empty();
        }
        String name = stripSlash(reference.trim());
        String id = idByName.get(name);
        if (id != null) {
            return Optional.of(id);
        }
        return byId.containsKey(name) ? Optional.of(name) : Optional.empty();
    }

    /**
     * Containers reachable under the given hostname: container names, network aliases
     * and compose service names. Exact, case-sensitive match.
     */
    public SortedSet<String> resolveHost(String hostname) {
        SortedSet<String> ids = idsByHost.get(hostname);
        return ids == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(ids);
    }

    /**
     * Containers running the given compose service within a project.
     */
    public SortedSet<String> resolveComposeService(String project, String service) {
        SortedSet<String> ids = idsByComposeService.get(serviceKey(project, service));
        return ids == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(ids);
    }

    public static String serviceKey(String project, String service) {
        return (project == null ? "" : project) + "/" + service;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String stripSlash(String name) {
        return name.startsWith("/") ? name.substring(1) : name;
    }

    private void addHost(String host, String id) {
        idsByHost.computeIfAbsent(host, k -> new TreeSet<>()).add(id);
    }

    private static <T> List<T> safe(List<T> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    @Override
    public String toString() {
        return byId.keySet().stream().collect(Collectors.joining(",", "SnapshotIndex[", "]"));
    }
}
