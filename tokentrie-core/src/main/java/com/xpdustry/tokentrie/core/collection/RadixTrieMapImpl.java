package com.xpdustry.tokentrie.core.collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.xpdustry.tokentrie.core.string.KeyPointer;
import com.xpdustry.tokentrie.core.string.TokenBoundary;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RadixTrieMapImpl<V> implements RadixTrieMap.Mutable<V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RadixTrieMapImpl.class);
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final boolean caseSensitive;
    private final char wildcard;
    private @Nullable Node<V> root = null;

    RadixTrieMapImpl(final Options options) {
        Preconditions.checkNotNull(options, "options");
        this.caseSensitive = options.caseSensitive();
        this.wildcard = this.caseSensitive ? options.wildcard() : Character.toLowerCase(options.wildcard());
    }

    @Override
    public @Nullable V get(final CharSequence key) {
        Preconditions.checkNotNull(key, "key");
        final var result = this.findClosestMatchingNode(KeyPointer.wrap(key));
        return result != null && result.match() instanceof PrefixMatch.Full ? result.node().value : null;
    }

    @Override
    public boolean contains(final CharSequence key, final boolean partial) {
        Preconditions.checkNotNull(key, "key");
        final var pointer = KeyPointer.wrap(key);
        final var result = this.findClosestMatchingNode(pointer);
        if (result == null) {
            return false;
        } else if (result.match() instanceof PrefixMatch.Full) {
            return result.node().value != null || partial;
        } else {
            return partial && result.consumed() == pointer.length();
        }
    }

    @Override
    public @Nullable Entry<V> findByLongestPrefix(final CharSequence search, final boolean wordBoundaryOnly) {
        Preconditions.checkNotNull(search, "search");
        final var pointer = KeyPointer.wrap(search);
        final var end = pointer.posMax();
        try {
            while (true) {
                final var entry = this.findLongestValueBearingPrefix(pointer);
                if (entry == null || !wordBoundaryOnly) {
                    return entry;
                }
                final var after = pointer.pos() + entry.key().length();
                if (after >= end || !TokenBoundary.isNonBoundary(pointer.data(), after)) {
                    return entry;
                }
                if (entry.key().isEmpty()) {
                    return null;
                }
                pointer.setPosMax(after - 1);
            }
        } finally {
            pointer.setPosMax(end);
        }
    }

    @Override
    public List<Token<V>> search(final CharSequence text, final boolean wordBoundaryOnly) {
        Preconditions.checkNotNull(text, "text");

        final List<Token<V>> tokens = new ArrayList<>();
        final var pointer = KeyPointer.of(text);
        var offset = 0;

        while (offset < text.length()) {
            pointer.setPos(offset);
            final var entry = this.findByLongestPrefix(pointer, wordBoundaryOnly);
            if (entry == null || entry.key().isEmpty()) {
                offset++;
                continue;
            }
            final var end = offset + entry.key().length();
            tokens.add(new Token<>(text.subSequence(offset, end).toString(), offset, entry.value()));
            offset = end;
        }

        return tokens;
    }

    @Override
    public Iterable<Entry<V>> iterate(final @Nullable CharSequence prefix, final TraversalOrder order) {
        Preconditions.checkNotNull(order, "order");
        return () -> this.createIterator(prefix, order);
    }

    @Override
    public void set(final CharSequence key, final V value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");

        final var string = this.fold(key.toString());
        if (this.root == null) {
            this.root = new Node<>(string, value, null);
            return;
        }

        final var result = this.findClosestMatchingNode(KeyPointer.of(string));
        if (result == null) {
            this.splitRoot(string, value);
        } else if (result.match() instanceof PrefixMatch.Partial partial) {
            final var node = result.node();
            if (partial.index() == string.length()) {
                this.insertParent(node, partial.index(), value);
            } else if (partial.index() < node.key.length()) {
                this.splitNode(node, partial.index(), string, result.consumed(), value);
            } else {
                node.children.add(new Node<>(string.substring(result.consumed()), value, node));
            }
        } else {
            result.node().value = value;
        }
    }

    @Override
    public @Nullable ExportedNode<V> toExportableTree() {
        return this.root == null ? null : this.export(this.root);
    }

    @Override
    public String toJson() {
        return GSON.toJson(this.toExportableTree());
    }

    private @Nullable ClosestMatch<V> findClosestMatchingNode(final KeyPointer pointer) {
        if (this.root == null) {
            return null;
        }

        final var rootMatch = this.matchPrefix(this.root.key, pointer);
        if (rootMatch instanceof PrefixMatch.Full) {
            return new ClosestMatch<>(this.root, rootMatch, this.root.key, pointer.length());
        }
        if (!(rootMatch instanceof PrefixMatch.Partial partial)) {
            return null;
        }

        var candidate = this.root;
        var candidateMatch = partial;
        var consumed = partial.index();
        final var fullKey = new StringBuilder(this.root.key);
        final var start = pointer.pos();
        pointer.setPos(start + consumed);

        try {
            while (candidateMatch.index() == candidate.key.length()) {
                Node<V> next = null;
                PrefixMatch.Partial nextMatch = null;
                for (final var child : candidate.children) {
                    final var match = this.matchPrefix(child.key, pointer);
                    if (match instanceof PrefixMatch.Full) {
                        fullKey.append(child.key);
                        return new ClosestMatch<>(child, match, fullKey.toString(), consumed + child.key.length());
                    } else if (match instanceof PrefixMatch.Partial progress && progress.index() > 0) {
                        next = child;
                        nextMatch = progress;
                        break;
                    }
                }
                if (next == null) {
                    break;
                }
                candidate = next;
                candidateMatch = nextMatch;
                pointer.setPos(pointer.pos() + nextMatch.index());
                consumed += nextMatch.index();
                fullKey.append(next.key);
            }
        } finally {
            pointer.setPos(start);
        }

        return new ClosestMatch<>(candidate, candidateMatch, fullKey.toString(), consumed);
    }

    private PrefixMatch matchPrefix(final String prefix, final KeyPointer pointer) {
        final var data = pointer.data();
        final var pos = pointer.pos();
        final var remaining = pointer.posMax() - pos;
        var index = 0;
        for (; index < remaining; index++) {
            if (index >= prefix.length() || !this.charsEqual(prefix.charAt(index), data.charAt(pos + index))) {
                return index > 0 || prefix.isEmpty() ? PrefixMatch.partial(index) : PrefixMatch.NONE;
            }
        }
        return index == prefix.length() ? PrefixMatch.FULL : PrefixMatch.partial(index);
    }

    private boolean charsEqual(final char stored, final char searched) {
        return stored == this.wildcard
                || stored == (this.caseSensitive ? searched : Character.toLowerCase(searched));
    }

    private @Nullable Entry<V> findLongestValueBearingPrefix(final KeyPointer pointer) {
        final var result = this.findClosestMatchingNode(pointer);
        if (result == null) {
            return null;
        }

        var node = result.node();
        var fullKey = result.fullKey();
        final var settled = result.match() instanceof PrefixMatch.Full
                || (result.match() instanceof PrefixMatch.Partial partial && partial.index() == node.key.length());

        if (settled && node.value == null) {
            return null;
        } else if (!settled) {
            do {
                fullKey = fullKey.substring(0, fullKey.length() - node.key.length());
                node = node.parent;
            } while (node != null && node.value == null);
            if (node == null) {
                return null;
            }
        }

        return new Entry<>(fullKey, node.value);
    }

    private void splitRoot(final String key, final V value) {
        final var previous = Preconditions.checkNotNull(this.root);
        final var root = new Node<V>("", null, null);
        root.children.add(previous);
        root.children.add(new Node<>(key, value, root));
        previous.parent = root;
        this.root = root;
        LOGGER.trace("Split the root to insert unrelated key {}", key);
    }

    private void insertParent(final Node<V> node, final int index, final V value) {
        final var parent = new Node<>(node.key.substring(0, index), value, node.parent);
        parent.children.add(node);
        if (node == this.root) {
            this.root = parent;
        } else {
            final var siblings = Preconditions.checkNotNull(node.parent).children;
            siblings.set(siblings.indexOf(node), parent);
        }
        node.key = node.key.substring(index);
        node.parent = parent;
        LOGGER.trace("Inserted parent {} above {}", parent.key, node.key);
    }

    private void splitNode(
            final Node<V> node, final int index, final String key, final int consumed, final V value) {
        final var demoted = new Node<>(node.key.substring(index), node.value, node);
        demoted.children = node.children;
        for (final var child : demoted.children) {
            child.parent = demoted;
        }

        final var exact = consumed == key.length();
        node.key = node.key.substring(0, index);
        node.value = exact ? value : null;
        node.children = new ArrayList<>();
        node.children.add(demoted);
        if (!exact) {
            node.children.add(new Node<>(key.substring(consumed), value, node));
        }
        LOGGER.trace("Split node {}|{} to insert {}", node.key, demoted.key, key);
    }

    private Iterator<Entry<V>> createIterator(final @Nullable CharSequence prefix, final TraversalOrder order) {
        if (this.root == null) {
            return Collections.emptyIterator();
        }
        if (prefix == null || prefix.length() == 0) {
            return new NodeIterator<>(this.root, this.root.key, order);
        }
        final var pointer = KeyPointer.wrap(prefix);
        final var result = this.findClosestMatchingNode(pointer);
        if (result == null || result.consumed() != pointer.length()) {
            return Collections.emptyIterator();
        }
        return new NodeIterator<>(result.node(), result.fullKey(), order);
    }

    private ExportedNode<V> export(final Node<V> node) {
        final List<ExportedNode<V>> children = new ArrayList<>(node.children.size());
        for (final var child : node.children) {
            children.add(this.export(child));
        }
        return new ExportedNode<>(node.key, node.value, children);
    }

    private String fold(final String key) {
        if (this.caseSensitive) {
            return key;
        }
        final var chars = key.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    private static final class Node<V> {
        private String key;
        private @Nullable V value;
        private @Nullable Node<V> parent;
        private List<Node<V>> children = new ArrayList<>();

        private Node(final String key, final @Nullable V value, final @Nullable Node<V> parent) {
            this.key = key;
            this.value = value;
            this.parent = parent;
        }
    }

    private record ClosestMatch<V>(Node<V> node, PrefixMatch match, String fullKey, int consumed) {}

    private record Pending<V>(Node<V> node, String key) {}

    private static final class NodeIterator<V> extends AbstractIterator<Entry<V>> {

        private final Deque<Pending<V>> pending = new ArrayDeque<>();
        private final TraversalOrder order;

        private NodeIterator(final Node<V> start, final String key, final TraversalOrder order) {
            this.pending.add(new Pending<>(start, key));
            this.order = order;
        }

        @Override
        protected @Nullable Entry<V> computeNext() {
            while (!this.pending.isEmpty()) {
                final var current = this.order == TraversalOrder.BREADTH_FIRST
                        ? this.pending.removeFirst()
                        : this.pending.removeLast();
                if (this.order == TraversalOrder.BREADTH_FIRST) {
                    for (final var child : current.node().children) {
                        this.pending.addLast(new Pending<>(child, current.key() + child.key));
                    }
                } else {
                    for (int i = current.node().children.size() - 1; i >= 0; i--) {
                        final var child = current.node().children.get(i);
                        this.pending.addLast(new Pending<>(child, current.key() + child.key));
                    }
                }
                final var value = current.node().value;
                if (value != null) {
                    return new Entry<>(current.key(), value);
                }
            }
            return this.endOfData();
        }
    }
}
