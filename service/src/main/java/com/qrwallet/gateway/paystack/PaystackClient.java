package com.qrwallet.gateway.paystack;

import com.qrwallet.api.model.WithdrawalType;
import com.qrwallet.api.response.BankAccountResponse;
import com.qrwallet.api.response.BankResponse;
import com.qrwallet.gateway.GatewayResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Card and bank payment gateway.
 *
 * <p>Amounts are passed in major units and converted to the gateway's minor units by the implementation.
 * A gateway that answers with a business failure yields a {@link GatewayResult} with status FAILED; a gateway
 * that cannot be reached raises {@code SERVICE_PAYSTACK_ERROR}.
 */
public interface PaystackClient {

    /**
     * @return providerReference is the recipient code
     */
    GatewayResult createTransferRecipient(WithdrawalType type, String name, String accountNumber, String bankCode,
                                          String currency);

    /**
     * @return status OTP_REQUIRED when the payout waits for an OTP; providerReference is the transfer code
     */
    GatewayResult initiateTransfer(BigDecimal amount, String recipientCode, String reference, String reason);

    GatewayResult finalizeTransfer(String transferCode, String otp);

    /**
     * Status query for a charge. SUCCESS only when the charge settled.
     */
    GatewayResult verifyTransaction(String reference);

    /**
     * Status query for a payout.
     */
    GatewayResult verifyTransfer(String reference);

    /**
     * @return raw carries {@code authorization_url}, {@code access_code} and {@code reference}
     */
    GatewayResult initializeTransaction(String email, BigDecimal amount, String currency, String reference,
                                        Map<String, Object> metadata);

    GatewayResult chargeMobileMoney(String email, BigDecimal amount, String currency, String phone, String provider,
                                    String reference, Map<String, Object> metadata);

    List<BankResponse> listBanks(String country);

    BankAccountResponse resolveAccount(String accountNumber, String bankCode);
}
