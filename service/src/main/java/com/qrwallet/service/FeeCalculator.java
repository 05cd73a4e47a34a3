package com.qrwallet.service;

import com.qrwallet.config.WalletProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Peer transfer fee: a percentage of the amount clamped to [minFee, maxFee], in the sender's currency.
 */
@Component
@RequiredArgsConstructor
public class FeeCalculator {

    private final WalletProperties properties;

    public BigDecimal fee(BigDecimal amount) {
        WalletProperties.Transfer transfer = properties.getTransfer();
        BigDecimal fee = amount.multiply(transfer.getFeeRate())
                .max(transfer.getMinFee())
                .min(transfer.getMaxFee());
        return fee.setScale(2, RoundingMode.HALF_UP);
    }
}
