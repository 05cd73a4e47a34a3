package com.qrwallet.api;

import com.qrwallet.api.request.ChargeMobileMoneyRequest;
import com.qrwallet.api.request.InitializeTransactionRequest;
import com.qrwallet.api.request.VerifyPaymentRequest;
import com.qrwallet.api.response.BankAccountResponse;
import com.qrwallet.api.response.BankResponse;
import com.qrwallet.api.response.InitializeTransactionResponse;
import com.qrwallet.api.response.MobileMoneyChargeResponse;
import com.qrwallet.api.response.PaymentVerificationResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Card/bank gateway payment API: wallet top-ups and bank directory.
 */
@RequestMapping("/api/v1/payments")
public interface PaymentApi {

    /**
     * Verifies a charge with the gateway and credits the caller's wallet once per reference.
     */
    @PostMapping("/verify")
    ResponseEntity<PaymentVerificationResponse> verifyPayment(@RequestBody @Valid VerifyPaymentRequest request);

    /**
     * Starts a hosted checkout; the wallet is credited when the charge succeeds.
     */
    @PostMapping("/initialize")
    ResponseEntity<InitializeTransactionResponse> initializeTransaction(
            @RequestBody @Valid InitializeTransactionRequest request);

    /**
     * Tops up the wallet with a mobile-money charge.
     */
    @PostMapping("/mobile-money")
    ResponseEntity<MobileMoneyChargeResponse> chargeMobileMoney(@RequestBody @Valid ChargeMobileMoneyRequest request);

    /**
     * Lists banks supported for payouts in a country ({@code nigeria} when omitted).
     */
    @GetMapping("/banks")
    ResponseEntity<List<BankResponse>> getBanks(@RequestParam(value = "country", required = false) String country);

    /**
     * Resolves the account holder name of a bank account.
     */
    @GetMapping("/banks/resolve")
    ResponseEntity<BankAccountResponse> verifyBankAccount(
            @RequestParam("accountNumber") String accountNumber,
            @RequestParam("bankCode") String bankCode);
}
