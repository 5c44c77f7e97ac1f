package com.mikov.emailverifier.validation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Trie over public suffix rules, keyed by reversed domain labels (TLD first).
 * Instances are built once through {@link Builder} and never modified afterwards,
 * so a published trie can be read from any thread.
 */
@Slf4j
public final class SuffixTrie {

    private static final Pattern RULE_PATTERN = Pattern.compile("^(!)?(\\*\\.)?([a-zA-Z0-9-]+\\.)*[a-zA-Z0-9-]+$");
    private static final String WILDCARD = "*";

    private final Node root;
    private final int ruleCount;

    private SuffixTrie(final Node root, final int ruleCount) {
        this.root = root;
        this.ruleCount = ruleCount;
    }

    public static SuffixTrie empty() {
        return new SuffixTrie(new Node(), 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getRuleCount() {
        return ruleCount;
    }

    /**
     * Finds the registrable domain of a hostname: the public suffix plus one label.
     * Exception rules short-circuit, making the excepted name itself registrable.
     *
     * @param hostname lowercase ASCII hostname
     * @return the registrable domain, or null if the hostname is a suffix itself,
     * has a single label, or matches no rule
     */
    public String findRegistrableDomain(final String hostname) {
        final var labels = hostname.split("\\.");
        if (labels.length <= 1) {
            return null;
        }

        var node = root;
        var matchedDepth = 0;
        var accumulated = "";
        for (var depth = 1; depth <= labels.length; depth++) {
            final var label = labels[labels.length - depth];
            accumulated = depth == 1 ? label : label + "." + accumulated;

            var next = node.children.get(label);
            if (next == null) {
                next = node.children.get(WILDCARD);
            }
            if (next == null) {
                break;
            }
            node = next;

            if (node.exception) {
                log.trace("Exception rule matched {}, registrable domain is {}", hostname, accumulated);
                return accumulated;
            }
            if (node.suffix || node.wildcard) {
                matchedDepth = depth;
            }
        }

        if (matchedDepth == 0 || labels.length <= matchedDepth) {
            return null;
        }
        return joinTail(labels, matchedDepth + 1);
    }

    private static String joinTail(final String[] labels, final int count) {
        return String.join(".", List.of(labels).subList(labels.length - count, labels.length));
    }

    private static final class Node {
        private final Map<String, Node> children = new HashMap<>();
        private boolean suffix;
        private boolean exception;
        private boolean wildcard;
    }

    /**
     * Collects rules into a fresh tree. Not thread-safe; publish the result of {@link #build()}.
     */
    public static final class Builder {
        private final Node root = new Node();
        private final List<String> rejected = new ArrayList<>();
        private int ruleCount;

        private Builder() {
        }

        /**
         * Adds one rule line: optional '!' for exceptions, optional '*.' for wildcards,
         * then dot-separated labels. Malformed lines are logged and skipped.
         *
         * @return true if the rule was added
         */
        public boolean add(final String rule) {
            final var trimmed = rule.trim();
            if (!RULE_PATTERN.matcher(trimmed).matches()) {
                log.warn("Ignoring invalid suffix rule: {}", rule);
                rejected.add(rule);
                return false;
            }

            var ruleText = trimmed.toLowerCase(Locale.ROOT);
            final var exception = ruleText.startsWith("!");
            if (exception) {
                ruleText = ruleText.substring(1);
            }

            final var labels = ruleText.split("\\.");
            var wildcard = false;
            var node = root;
            for (var i = labels.length - 1; i >= 0; i--) {
                if (WILDCARD.equals(labels[i])) {
                    wildcard = true;
                    continue;
                }
                node = node.children.computeIfAbsent(labels[i], label -> new Node());
            }

            if (wildcard) {
                final var wildcardNode = node.children.computeIfAbsent(WILDCARD, label -> new Node());
                wildcardNode.suffix = true;
                wildcardNode.wildcard = true;
            } else {
                node.suffix = true;
            }
            if (exception) {
                node.exception = true;
            }
            ruleCount++;
            return true;
        }

        public Builder addAll(final Iterable<String> rules) {
            for (final var rule : rules) {
                add(rule);
            }
            return this;
        }

        public List<String> getRejected() {
            return List.copyOf(rejected);
        }

        public SuffixTrie build() {
            return new SuffixTrie(root, ruleCount);
        }
    }
}
