package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.exception.ProviderConfigurationException;
import com.phillippitts.voicegate.testutil.FakeProviderFactory;
import com.phillippitts.voicegate.testutil.FakeSttProvider;
import com.phillippitts.voicegate.testutil.FakeTtsProvider;
import com.phillippitts.voicegate.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.phillippitts.voicegate.testutil.FakeProviderFactory.descriptor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private final FakeProviderFactory stt = new FakeProviderFactory(ProviderCategory.STT);
    private final FakeProviderFactory tts = new FakeProviderFactory(ProviderCategory.TTS);
    private final ProviderRegistry registry = new ProviderRegistry(List.of(stt, tts));

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void ordersCandidatesByPriorityKeepingRegistrationOrderOnTies() {
        stt.add(new FakeSttProvider("c")).add(new FakeSttProvider("a")).add(new FakeSttProvider("b"));

        registry.register(List.of(
                descriptor("c", ProviderCategory.STT, 2),
                descriptor("a", ProviderCategory.STT, 1),
                descriptor("b", ProviderCategory.STT, 2)));

        assertThat(registry.candidates(ProviderCategory.STT)).extracting(ProviderCandidate::name)
                .containsExactly("a", "c", "b");
        assertThat(registry.candidates(ProviderCategory.TTS)).isEmpty();
    }

    @Test
    void disabledProvidersAreConfiguredButNotCandidates() {
        stt.add(new FakeSttProvider("a"));

        RegistrySnapshot snapshot = registry.register(List.of(
                descriptor("a", ProviderCategory.STT, 1),
                new ProviderDescriptor("off", FakeProviderFactory.TYPE, ProviderCategory.STT, 0, false, Map.of())));

        assertThat(snapshot.candidates(ProviderCategory.STT)).extracting(ProviderCandidate::name).containsExactly("a");
        assertThat(snapshot.descriptor("off")).isPresent();
        assertThat(snapshot.descriptors()).hasSize(2);
        assertThat(stt.createdCount()).isEqualTo(1);
    }

    @Test
    void duplicateNamesAreRejectedAndPreviousConfigurationStays() {
        stt.add(new FakeSttProvider("a"));
        tts.add(new FakeTtsProvider("a"));
        RegistrySnapshot before = registry.register(List.of(descriptor("a", ProviderCategory.STT, 1)));

        assertThatThrownBy(() -> registry.register(List.of(
                descriptor("a", ProviderCategory.STT, 1),
                descriptor("a", ProviderCategory.TTS, 1))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("Duplicate provider name");

        assertThat(registry.snapshot()).isSameAs(before);
    }

    @Test
    void unknownTypeIsRejected() {
        ProviderDescriptor unknown = new ProviderDescriptor("x", "mystery", ProviderCategory.STT, 1, true, Map.of());

        assertThatThrownBy(() -> registry.register(List.of(unknown)))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("No stt factory for type 'mystery'");
    }

    @Test
    void adapterOfWrongCategoryIsRejectedAndClosed() {
        FakeTtsProvider wrong = new FakeTtsProvider("a");
        stt.add(wrong);

        assertThatThrownBy(() -> registry.register(List.of(descriptor("a", ProviderCategory.STT, 1))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("stt contract");
    }

    @Test
    void failedRegistrationClosesAdaptersBuiltSoFar() {
        FakeSttProvider a = new FakeSttProvider("a");
        stt.add(a);

        assertThatThrownBy(() -> registry.register(List.of(
                descriptor("a", ProviderCategory.STT, 1),
                descriptor("missing", ProviderCategory.STT, 2))))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("Adapter construction failed");

        assertThat(a.closedCount()).isEqualTo(1);
        assertThat(registry.candidates(ProviderCategory.STT)).isEmpty();
    }

    @Test
    void unchangedDescriptorReusesAdapter() {
        stt.add(new FakeSttProvider("a"));
        List<ProviderDescriptor> config = List.of(descriptor("a", ProviderCategory.STT, 1));

        registry.register(config);
        registry.register(List.of(descriptor("a", ProviderCategory.STT, 5)));

        assertThat(stt.createdCount()).isEqualTo(1);
        assertThat(registry.cachedAdapterCount()).isEqualTo(1);
    }

    @Test
    void changedSettingsRebuildAdapterAndRetireOldOneUntilClose() {
        FakeSttProvider a = new FakeSttProvider("a");
        stt.add(a);
        registry.register(List.of(descriptor("a", ProviderCategory.STT, 1)));

        registry.register(List.of(new ProviderDescriptor("a", FakeProviderFactory.TYPE, ProviderCategory.STT, 1,
                true, Map.of("model", "large"))));

        assertThat(stt.createdCount()).isEqualTo(2);
        assertThat(registry.cachedAdapterCount()).isEqualTo(1);
        assertThat(a.closedCount()).isZero();

        registry.close();

        assertThat(a.closedCount()).isPositive();
        assertThat(registry.snapshot().descriptors()).isEmpty();
    }

    @Test
    void droppedAdapterIsClosedByFirstReloadAfterGracePeriod() {
        MutableClock clock = MutableClock.at("2026-03-02T10:00:00Z");
        FakeSttProvider a = new FakeSttProvider("a");
        FakeSttProvider b = new FakeSttProvider("b");
        stt.add(a).add(b);
        ProviderRegistry reloading = new ProviderRegistry(List.of(stt, tts), clock, Duration.ofMinutes(5));
        try {
            reloading.register(List.of(descriptor("a", ProviderCategory.STT, 1)));
            reloading.register(List.of(descriptor("b", ProviderCategory.STT, 1)));

            assertThat(a.closedCount()).isZero();
            assertThat(reloading.retiredAdapterCount()).isEqualTo(1);

            clock.advance(Duration.ofMinutes(1));
            reloading.register(List.of(descriptor("b", ProviderCategory.STT, 1)));
            assertThat(a.closedCount()).isZero();

            clock.advance(Duration.ofMinutes(5));
            reloading.register(List.of(descriptor("b", ProviderCategory.STT, 1)));

            assertThat(a.closedCount()).isEqualTo(1);
            assertThat(b.closedCount()).isZero();
            assertThat(reloading.retiredAdapterCount()).isZero();
        } finally {
            reloading.close();
        }
        assertThat(a.closedCount()).isEqualTo(1);
        assertThat(b.closedCount()).isEqualTo(1);
    }

    @Test
    void adapterReturnedAgainForNewSettingsIsNotClosedOnReload() {
        FakeSttProvider a = new FakeSttProvider("a");
        stt.add(a);
        ProviderRegistry reloading = new ProviderRegistry(List.of(stt, tts),
                MutableClock.at("2026-03-02T10:00:00Z"), Duration.ZERO);
        try {
            reloading.register(List.of(descriptor("a", ProviderCategory.STT, 1)));
            reloading.register(List.of(new ProviderDescriptor("a", FakeProviderFactory.TYPE, ProviderCategory.STT,
                    1, true, Map.of("model", "large"))));

            assertThat(a.closedCount()).isZero();
            assertThat(reloading.retiredAdapterCount()).isZero();
        } finally {
            reloading.close();
        }
        assertThat(a.closedCount()).isEqualTo(1);
    }

    @Test
    void chainOverrideRestrictsAndReorders() {
        stt.add(new FakeSttProvider("a")).add(new FakeSttProvider("b")).add(new FakeSttProvider("c"));
        tts.add(new FakeTtsProvider("t"));
        RegistrySnapshot snapshot = registry.register(List.of(
                descriptor("a", ProviderCategory.STT, 1),
                descriptor("b", ProviderCategory.STT, 2),
                descriptor("c", ProviderCategory.STT, 3),
                descriptor("t", ProviderCategory.TTS, 1)));

        assertThat(snapshot.candidates(ProviderCategory.STT, List.of("c", "ghost", "t", "a", "c")))
                .extracting(ProviderCandidate::name).containsExactly("c", "a");
        assertThat(snapshot.candidates(ProviderCategory.STT, List.of()))
                .extracting(ProviderCandidate::name).containsExactly("a", "b", "c");
    }

    @Test
    void duplicateFactoriesAreRejected() {
        assertThatThrownBy(() -> new ProviderRegistry(List.of(stt, new FakeProviderFactory(ProviderCategory.STT))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeIsIdempotent() {
        FakeSttProvider a = new FakeSttProvider("a");
        stt.add(a);
        registry.register(List.of(descriptor("a", ProviderCategory.STT, 1)));

        registry.close();
        registry.close();

        assertThat(a.closedCount()).isEqualTo(1);
    }
}
