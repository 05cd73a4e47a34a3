package com.qrwallet.controller;

import com.qrwallet.api.WithdrawalApi;
import com.qrwallet.api.request.FinalizeTransferRequest;
import com.qrwallet.api.request.WithdrawalRequest;
import com.qrwallet.api.response.FinalizeTransferResponse;
import com.qrwallet.api.response.WithdrawalResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.WithdrawalService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for payouts to bank accounts and mobile money through the card/bank gateway.
 */
@RestController
@Tag(name = "Withdrawals", description = "Bank and mobile money withdrawals through the card gateway")
@Validated
@RequiredArgsConstructor
@Slf4j
public class WithdrawalController implements WithdrawalApi {

    private final WithdrawalService withdrawalService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<WithdrawalResponse> initiateWithdrawal(WithdrawalRequest request) {
        String userId = callerContext.requireUserId();
        log.info("Withdrawal requested: userId={}, amount={}, type={}", userId, request.amount(), request.type());
        return ResponseEntity.ok(withdrawalService.initiateWithdrawal(userId, request));
    }

    @Override
    public ResponseEntity<FinalizeTransferResponse> finalizeTransfer(FinalizeTransferRequest request) {
        return ResponseEntity.ok(withdrawalService.finalizeTransfer(callerContext.requireUserId(), request));
    }
}
