package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reverse lookup from a stream path to the subscriptions whose pattern matches it.
 * Patterns made of literals and {@code *} live in a segment trie; patterns with {@code **} are scanned.
 * Instances are immutable once built so lookups need no locking.
 */
public final class PatternIndex {

    public static final PatternIndex EMPTY = build(ImmutableList.of());

    private final Node root;
    private final ImmutableList<Entry> scanned;

    private PatternIndex(Node root, ImmutableList<Entry> scanned) {
        this.root = root;
        this.scanned = scanned;
    }

    public static PatternIndex build(Iterable<Subscription> subscriptions) {
        Node root = new Node();
        ImmutableList.Builder<Entry> scanned = ImmutableList.builder();
        for (Subscription subscription : subscriptions) {
            GlobPattern glob = GlobPattern.compile(subscription.getPattern());
            if (glob.hasAnySegments()) {
                scanned.add(new Entry(glob, subscription.getSubscriptionId()));
                continue;
            }
            Node node = root;
            for (String segment : glob.getSegments()) {
                node = GlobPattern.SINGLE_SEGMENT.equals(segment)
                    ? node.wildcardChild()
                    : node.literalChild(segment);
            }
            node.subscriptionIds.add(subscription.getSubscriptionId());
        }
        return new PatternIndex(root, scanned.build());
    }

    /**
     * @return the ids of the subscriptions whose pattern matches the path
     */
    public Set<String> affected(String path) {
        List<String> segments = GlobPattern.segmentsOf(path);
        ImmutableSet.Builder<String> result = ImmutableSet.builder();

        List<Node> current = ImmutableList.of(root);
        for (String segment : segments) {
            List<Node> next = new ArrayList<>();
            for (Node node : current) {
                Node literal = node.literals.get(segment);
                if (literal != null) {
                    next.add(literal);
                }
                if (node.wildcard != null) {
                    next.add(node.wildcard);
                }
            }
            if (next.isEmpty()) {
                current = next;
                break;
            }
            current = next;
        }
        for (Node node : current) {
            result.addAll(node.subscriptionIds);
        }

        for (Entry entry : scanned) {
            if (entry.glob.matches(segments)) {
                result.add(entry.subscriptionId);
            }
        }
        return result.build();
    }

    private static final class Node {
        private final Map<String, Node> literals = new HashMap<>();
        private Node wildcard;
        private final Set<String> subscriptionIds = new HashSet<>();

        Node literalChild(String segment) {
            return literals.computeIfAbsent(segment, s -> new Node());
        }

        Node wildcardChild() {
            if (wildcard == null) {
                wildcard = new Node();
            }
            return wildcard;
        }
    }

    private static final class Entry {
        private final GlobPattern glob;
        private final String subscriptionId;

        Entry(GlobPattern glob, String subscriptionId) {
            this.glob = glob;
            this.subscriptionId = subscriptionId;
        }
    }
}
