package com.mikov.emailverifier.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SuffixTrieTest {

    private static SuffixTrie trie(final String... rules) {
        return SuffixTrie.builder().addAll(List.of(rules)).build();
    }

    @Test
    void findsRegistrableDomainUnderPlainSuffixes() {
        final var trie = trie("com", "co.uk");

        assertThat(trie.findRegistrableDomain("example.com")).isEqualTo("example.com");
        assertThat(trie.findRegistrableDomain("mail.example.com")).isEqualTo("example.com");
        assertThat(trie.findRegistrableDomain("com")).isNull();
        assertThat(trie.findRegistrableDomain("foo.co.uk")).isEqualTo("foo.co.uk");
        assertThat(trie.findRegistrableDomain("co.uk")).isNull();
    }

    @Test
    void wildcardMakesEveryChildASuffix() {
        final var trie = trie("*.ck");

        assertThat(trie.findRegistrableDomain("a.ck")).isNull();
        assertThat(trie.findRegistrableDomain("b.a.ck")).isEqualTo("b.a.ck");
        assertThat(trie.findRegistrableDomain("c.b.a.ck")).isEqualTo("b.a.ck");
    }

    @Test
    void exceptionRuleOverridesWildcard() {
        final var trie = trie("*.ck", "!pref.ck");

        assertThat(trie.findRegistrableDomain("foo.ck")).isNull();
        assertThat(trie.findRegistrableDomain("pref.ck")).isEqualTo("pref.ck");
        assertThat(trie.findRegistrableDomain("b.pref.ck")).isEqualTo("pref.ck");
    }

    @Test
    void unknownSuffixIsNotRegistrable() {
        final var trie = trie("com");

        assertThat(trie.findRegistrableDomain("example.invalid")).isNull();
        assertThat(trie.findRegistrableDomain("localhost")).isNull();
    }

    @Test
    void skipsMalformedRules() {
        final var builder = SuffixTrie.builder();

        assertThat(builder.add("com")).isTrue();
        assertThat(builder.add("// ===BEGIN ICANN DOMAINS===")).isFalse();
        assertThat(builder.add("exa mple.com")).isFalse();
        assertThat(builder.add("")).isFalse();

        final var trie = builder.build();
        assertThat(trie.getRuleCount()).isEqualTo(1);
        assertThat(builder.getRejected()).hasSize(3);
        assertThat(trie.findRegistrableDomain("example.com")).isEqualTo("example.com");
    }

    @Test
    void emptyTrieMatchesNothing() {
        assertThat(SuffixTrie.empty().findRegistrableDomain("example.com")).isNull();
    }
}
