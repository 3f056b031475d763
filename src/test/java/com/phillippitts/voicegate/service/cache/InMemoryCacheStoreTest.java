package com.phillippitts.voicegate.service.cache;

import com.phillippitts.voicegate.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCacheStoreTest {

    private final MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");

    @Test
    void entryExpiresAfterTtl() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, clock);
        store.set("k", bytes("v"), 60);

        clock.advance(Duration.ofSeconds(59));
        assertThat(store.get("k")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("v")));

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get("k")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void storedValueIsCopied() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, clock);
        byte[] value = bytes("abc");
        store.set("k", value, 60);

        value[0] = 'z';
        store.get("k").get()[1] = 'z';

        assertThat(store.get("k")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("abc")));
    }

    @Test
    void fullStoreEvictsEntryClosestToExpiry() {
        InMemoryCacheStore store = new InMemoryCacheStore(2, clock);
        store.set("long", bytes("1"), 600);
        store.set("short", bytes("2"), 60);

        store.set("new", bytes("3"), 300);

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get("short")).isEmpty();
        assertThat(store.get("long")).isPresent();
        assertThat(store.get("new")).isPresent();
    }

    @Test
    void fullStorePrefersPurgingExpiredEntries() {
        InMemoryCacheStore store = new InMemoryCacheStore(2, clock);
        store.set("a", bytes("1"), 10);
        store.set("b", bytes("2"), 600);
        clock.advance(Duration.ofSeconds(11));

        store.set("c", bytes("3"), 5);

        assertThat(store.get("b")).isPresent();
        assertThat(store.get("c")).isPresent();
    }

    @Test
    void overwritingExistingKeyDoesNotEvict() {
        InMemoryCacheStore store = new InMemoryCacheStore(1, clock);
        store.set("k", bytes("1"), 60);

        store.set("k", bytes("2"), 60);

        assertThat(store.get("k")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("2")));
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, clock);
        store.set("a", bytes("1"), 10);
        store.set("b", bytes("2"), 10);
        store.set("c", bytes("3"), 100);
        clock.advance(Duration.ofSeconds(10));

        assertThat(store.purgeExpired()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveTtl() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, clock);

        assertThatThrownBy(() -> store.set("k", bytes("v"), 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
