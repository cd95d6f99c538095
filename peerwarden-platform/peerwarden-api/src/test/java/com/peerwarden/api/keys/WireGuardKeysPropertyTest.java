package com.peerwarden.api.keys;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for WireGuard key format checks.
 */
class WireGuardKeysPropertyTest {

    @Property(tries = 200)
    void everyEncoded32ByteValueIsValid(@ForAll @Size(32) byte[] raw) {
        String key = WireGuardKeys.encode(raw);

        assertThat(key).hasSize(44).endsWith("=");
        assertThat(WireGuardKeys.isValid(key)).isTrue();
        assertThat(WireGuardKeys.decode(key)).isEqualTo(raw);
    }

    @Property(tries = 100)
    void otherLengthsAreRejected(@ForAll("wrongLengthKeys") String key) {
        assertThat(WireGuardKeys.isValid(key)).isFalse();
    }

    @Property(tries = 100)
    void foreignCharactersAreRejected(
            @ForAll @Size(32) byte[] raw,
            @ForAll @IntRange(min = 0, max = 42) int position,
            @ForAll("foreignChars") char foreign) {
        char[] chars = WireGuardKeys.encode(raw).toCharArray();
        chars[position] = foreign;

        assertThat(WireGuardKeys.isValid(new String(chars))).isFalse();
    }

    @Example
    void nonStringsAndNullAreRejected() {
        assertThat(WireGuardKeys.isValid(null)).isFalse();
        assertThat(WireGuardKeys.isValid(42)).isFalse();
        assertThat(WireGuardKeys.isValid(new byte[32])).isFalse();
    }

    @Example
    void keyWithoutPaddingIsRejected() {
        String key = WireGuardKeys.encode(new byte[32]);

        assertThat(WireGuardKeys.isValid(key.substring(0, 43) + "A")).isFalse();
        assertThat(WireGuardKeys.isValid(key.substring(0, 42) + "==")).isFalse();
    }

    @Example
    void redactKeepsOnlyAPrefix() {
        String key = WireGuardKeys.encode(new byte[32]);

        assertThat(WireGuardKeys.redact(key)).isEqualTo(key.substring(0, 8) + "...");
        assertThat(WireGuardKeys.redact(null)).isEqualTo("null");
        assertThat(WireGuardKeys.redact("short")).isEqualTo("...");
    }

    @Example
    void encodeRejectsWrongLengths() {
        assertThatThrownBy(() -> WireGuardKeys.encode(new byte[31]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WireGuardKeys.decode("not a key"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Provide
    Arbitrary<String> wrongLengthKeys() {
        return Arbitraries.strings().withChars("ABCDEFabcdef0123456789+/")
                .ofMinLength(0).ofMaxLength(60)
                .filter(s -> s.length() != 43)
                .map(s -> s + "=");
    }

    @Provide
    Arbitrary<Character> foreignChars() {
        return Arbitraries.of('-', '_', ' ', '=', '.', '!', '\n');
    }
}
