package com.qrwallet.controller;

import com.qrwallet.api.PaymentApi;
import com.qrwallet.api.request.ChargeMobileMoneyRequest;
import com.qrwallet.api.request.InitializeTransactionRequest;
import com.qrwallet.api.request.VerifyPaymentRequest;
import com.qrwallet.api.response.BankAccountResponse;
import com.qrwallet.api.response.BankResponse;
import com.qrwallet.api.response.InitializeTransactionResponse;
import com.qrwallet.api.response.MobileMoneyChargeResponse;
import com.qrwallet.api.response.PaymentVerificationResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.DepositService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for wallet top-ups through the card/bank gateway and its bank directory.
 */
@RestController
@Tag(name = "Payments", description = "Card and mobile money deposits, banks and account resolution")
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentController implements PaymentApi {

    private final DepositService depositService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<PaymentVerificationResponse> verifyPayment(VerifyPaymentRequest request) {
        return ResponseEntity.ok(depositService.verifyPayment(callerContext.requireUserId(), request.reference()));
    }

    @Override
    public ResponseEntity<InitializeTransactionResponse> initializeTransaction(InitializeTransactionRequest request) {
        return ResponseEntity.ok(depositService.initializeTransaction(callerContext.requireUserId(), request));
    }

    @Override
    public ResponseEntity<MobileMoneyChargeResponse> chargeMobileMoney(ChargeMobileMoneyRequest request) {
        String userId = callerContext.requireUserId();
        log.info("Mobile money charge requested: userId={}, amount={}, provider={}",
                userId, request.amount(), request.provider());
        return ResponseEntity.ok(depositService.chargeMobileMoney(userId, request));
    }

    @Override
    public ResponseEntity<List<BankResponse>> getBanks(String country) {
        callerContext.requireUserId();
        return ResponseEntity.ok(depositService.getBanks(country));
    }

    @Override
    public ResponseEntity<BankAccountResponse> verifyBankAccount(String accountNumber, String bankCode) {
        callerContext.requireUserId();
        return ResponseEntity.ok(depositService.verifyBankAccount(accountNumber, bankCode));
    }
}
