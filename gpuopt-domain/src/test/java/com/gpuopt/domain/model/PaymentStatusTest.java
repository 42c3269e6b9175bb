package com.gpuopt.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentStatusTest {

    @Test
    void pendingMovesToEitherTerminalStatus() {
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.COMPLETED)).isTrue();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.FAILED)).isTrue();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PENDING)).isFalse();
    }

    @Test
    void terminalStatusesNeverMove() {
        for (PaymentStatus next : PaymentStatus.values()) {
            assertThat(PaymentStatus.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(PaymentStatus.FAILED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void parsesStoredCodes() {
        assertThat(PaymentStatus.fromCode("completed")).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(PaymentStatus.FAILED.code()).isEqualTo("failed");
        assertThatThrownBy(() -> PaymentStatus.fromCode(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
