package com.xpdustry.tokentrie.core.collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.Streams;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

public interface RadixTrieMap<V> extends Iterable<RadixTrieMap.Entry<V>> {

    static <V> RadixTrieMap.Mutable<V> create() {
        return create(Options.DEFAULT);
    }

    static <V> RadixTrieMap.Mutable<V> create(final Options options) {
        return new RadixTrieMapImpl<>(options);
    }

    static <V> RadixTrieMap.Mutable<V> create(final Iterable<Entry<V>> entries, final Options options) {
        Preconditions.checkNotNull(entries, "entries");
        final var trie = RadixTrieMap.<V>create(options);
        for (final var entry : entries) {
            trie.set(entry.key(), entry.value());
        }
        return trie;
    }

    @Nullable V get(final CharSequence key);

    boolean contains(final CharSequence key, final boolean partial);

    @Nullable Entry<V> findByLongestPrefix(final CharSequence search, final boolean wordBoundaryOnly);

    default @Nullable Entry<V> findByLongestPrefix(final CharSequence search) {
        return this.findByLongestPrefix(search, true);
    }

    List<Token<V>> search(final CharSequence text, final boolean wordBoundaryOnly);

    Iterable<Entry<V>> iterate(final @Nullable CharSequence prefix, final TraversalOrder order);

    default Iterable<Entry<V>> iterate(final @Nullable CharSequence prefix) {
        return this.iterate(prefix, TraversalOrder.BREADTH_FIRST);
    }

    default Iterable<Entry<V>> iterate() {
        return this.iterate(null, TraversalOrder.BREADTH_FIRST);
    }

    @Override
    default Iterator<Entry<V>> iterator() {
        return this.iterate().iterator();
    }

    default Stream<Entry<V>> stream() {
        return Streams.stream(this);
    }

    @Nullable ExportedNode<V> toExportableTree();

    String toJson();

    record Entry<V>(String key, V value) {}

    record Token<V>(String word, int index, V value) {}

    record ExportedNode<V>(String key, @Nullable V value, List<ExportedNode<V>> children) {}

    record Options(boolean caseSensitive, char wildcard) {

        public static final Options DEFAULT = new Options(false, '*');

        public Options withCaseSensitive(final boolean caseSensitive) {
            return new Options(caseSensitive, this.wildcard);
        }

        public Options withWildcard(final char wildcard) {
            return new Options(this.caseSensitive, wildcard);
        }
    }

    interface Mutable<V> extends RadixTrieMap<V> {

        void set(final CharSequence key, final V value);
    }
}
