package com.qrwallet.gateway.momo;

import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.response.MomoBalanceResponse;
import com.qrwallet.gateway.GatewayResult;

import java.math.BigDecimal;

/**
 * Mobile-money provider API (collections and disbursements).
 *
 * <p>Requests are asynchronous: an accepted request yields status PENDING and its final outcome is learned from
 * {@link #getStatus} or the provider callback. A rejected request yields FAILED. An unreachable provider raises
 * {@code SERVICE_MOMO_ERROR}.
 */
public interface MomoClient {

    GatewayResult requestToPay(String referenceId, BigDecimal amount, String currency, String phoneNumber,
                               String payerMessage, String payeeNote);

    GatewayResult transfer(String referenceId, BigDecimal amount, String currency, String phoneNumber,
                           String payerMessage, String payeeNote);

    /**
     * @return providerStatus is the provider's status string ({@code SUCCESSFUL}, {@code FAILED}, {@code PENDING});
     * providerReference is the financial transaction id, if any
     */
    GatewayResult getStatus(MomoProduct product, String referenceId);

    MomoBalanceResponse getBalance(MomoProduct product);
}
