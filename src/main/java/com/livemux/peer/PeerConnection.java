package com.livemux.peer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configured identity and sources of one peer.
 *
 * The {@code livemux.connections} property lists peers separated by {@code ;}, each as
 * {@code id|name|source1,source2}. Sources are tried in order.
 */
public class PeerConnection {

    private final String id;
    private final String name;
    private final List<String> sources;

    public PeerConnection(String id, String name, List<String> sources) {
        this.id = id;
        this.name = name;
        this.sources = List.copyOf(sources);
    }

    /**
     * Parse the {@code livemux.connections} property.
     *
     * @throws IllegalArgumentException on malformed entries or duplicate ids
     */
    public static List<PeerConnection> parseAll(String value) {
        List<PeerConnection> connections = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return connections;
        }
        for (String entry : value.split(";")) {
            if (entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split("\\|");
            if (parts.length != 3 || parts[0].isBlank() || parts[2].isBlank()) {
                throw new IllegalArgumentException("Invalid connection '" + entry.trim()
                    + "', expected id|name|source1,source2");
            }
            String id = parts[0].trim();
            for (PeerConnection existing : connections) {
                if (existing.id.equals(id)) {
                    throw new IllegalArgumentException("Duplicate connection id " + id);
                }
            }
            List<String> sources = new ArrayList<>();
            for (String source : Arrays.asList(parts[2].split(","))) {
                if (!source.isBlank()) {
                    sources.add(source.trim());
                }
            }
            String name = parts[1].isBlank() ? id : parts[1].trim();
            connections.add(new PeerConnection(id, name, sources));
        }
        return connections;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getSources() {
        return sources;
    }

    @Override
    public String toString() {
        return id + " (" + name + ") " + sources;
    }
}
