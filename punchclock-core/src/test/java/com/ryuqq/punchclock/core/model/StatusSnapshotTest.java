package com.ryuqq.punchclock.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusSnapshotTest {

    private static StatusSnapshot snapshot(boolean enter, boolean exit) {
        return new StatusSnapshot(enter, exit, true, true, "2026/03/02", "09:00:01", "Taipei", Instant.EPOCH);
    }

    @Test
    void isAvailable_동작별_가용성_반환() {
        StatusSnapshot status = snapshot(true, false);

        assertThat(status.isAvailable(Action.ENTER)).isTrue();
        assertThat(status.isAvailable(Action.EXIT)).isFalse();
        assertThat(status.anyAvailable()).isTrue();
        assertThat(snapshot(false, false).anyAvailable()).isFalse();
    }

    @Test
    void isAvailable_SIMULATE는_정의되지_않음() {
        assertThatThrownBy(() -> snapshot(true, true).isAvailable(Action.SIMULATE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void LoginCredentials_toString은_비밀번호를_가림() {
        LoginCredentials credentials = new LoginCredentials("ACME", "u001", "s3cret");

        assertThat(credentials.toString()).doesNotContain("s3cret").contains("****");
    }
}
