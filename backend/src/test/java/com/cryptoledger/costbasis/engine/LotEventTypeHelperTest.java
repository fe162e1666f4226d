package com.cryptoledger.costbasis.engine;

import com.cryptoledger.domain.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class LotEventTypeHelperTest {

    @Test
    @DisplayName("buy and transfer in are acquisitions")
    void acquisitions() {
        assertThat(LotEventTypeHelper.isAcquisition(TransactionType.BUY)).isTrue();
        assertThat(LotEventTypeHelper.isAcquisition(TransactionType.TRANSFER_IN)).isTrue();
        assertThat(LotEventTypeHelper.isAcquisition(TransactionType.SELL)).isFalse();
    }

    @Test
    @DisplayName("sell and transfer out are disposals")
    void disposals() {
        assertThat(LotEventTypeHelper.isDisposal(TransactionType.SELL)).isTrue();
        assertThat(LotEventTypeHelper.isDisposal(TransactionType.TRANSFER_OUT)).isTrue();
        assertThat(LotEventTypeHelper.isDisposal(TransactionType.BUY)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(TransactionType.class)
    @DisplayName("each type falls into exactly one category")
    void exactlyOneCategory(TransactionType type) {
        int categories = (LotEventTypeHelper.isAcquisition(type) ? 1 : 0)
                + (LotEventTypeHelper.isDisposal(type) ? 1 : 0)
                + (LotEventTypeHelper.isIgnored(type) ? 1 : 0);
        assertThat(categories).isEqualTo(1);
    }

    @Test
    @DisplayName("long term starts strictly after 365 days")
    void gainTermThreshold() {
        assertThat(GainTerm.forHoldingPeriod(0)).isEqualTo(GainTerm.SHORT);
        assertThat(GainTerm.forHoldingPeriod(365)).isEqualTo(GainTerm.SHORT);
        assertThat(GainTerm.forHoldingPeriod(366)).isEqualTo(GainTerm.LONG);
        assertThat(GainTerm.LONG.label()).isEqualTo("long");
    }
}
