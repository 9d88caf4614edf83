package com.phillippitts.serverwarden.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatusKindTest {

    @Test
    void lifecycleIsTotallyOrdered() {
        assertThat(StatusKind.ONLINE.isAtLeast(StatusKind.LOADING)).isTrue();
        assertThat(StatusKind.LOADING.isAtLeast(StatusKind.STARTING)).isTrue();
        assertThat(StatusKind.STARTING.isAtLeast(StatusKind.OFFLINE)).isTrue();
        assertThat(StatusKind.OFFLINE.isAtLeast(StatusKind.UNKNOWN)).isTrue();
        assertThat(StatusKind.STARTING.isAtLeast(StatusKind.ONLINE)).isFalse();
    }

    @Test
    void onlyShutdownAndOfflineOverrideProgress() {
        assertThat(StatusKind.SHUTTING_DOWN.isRegressionOverride()).isTrue();
        assertThat(StatusKind.OFFLINE.isRegressionOverride()).isTrue();
        assertThat(StatusKind.STARTING.isRegressionOverride()).isFalse();
        assertThat(StatusKind.ONLINE.isRegressionOverride()).isFalse();
    }

    @Test
    void initialStatusIsUnknownAndOffline() {
        ServerStatus status = ServerStatus.initial();

        assertThat(status.kind()).isEqualTo(StatusKind.UNKNOWN);
        assertThat(status.isOnline()).isFalse();
        assertThat(status.highestKindReached()).isEqualTo(StatusKind.UNKNOWN);
        assertThat(status.playerCount()).isZero();
    }
}
