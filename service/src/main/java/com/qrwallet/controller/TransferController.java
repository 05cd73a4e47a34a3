package com.qrwallet.controller;

import com.qrwallet.api.TransferApi;
import com.qrwallet.api.request.SendMoneyRequest;
import com.qrwallet.api.response.SendMoneyResponse;
import com.qrwallet.api.response.TransactionReceiptResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.TransferService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for peer-to-peer transfers and the caller's transaction history.
 */
@RestController
@Tag(name = "Transfers", description = "Peer-to-peer transfers and transaction history")
@Validated
@RequiredArgsConstructor
@Slf4j
public class TransferController implements TransferApi {

    private final TransferService transferService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<SendMoneyResponse> sendMoney(SendMoneyRequest request) {
        String userId = callerContext.requireUserId();
        log.info("Send money requested: userId={}, recipientWalletId={}, amount={}",
                userId, request.recipientWalletId(), request.amount());
        return ResponseEntity.ok(transferService.sendMoney(userId, request));
    }

    @Override
    public ResponseEntity<List<TransactionReceiptResponse>> listTransactions(Integer limit) {
        return ResponseEntity.ok(transferService.listTransactions(callerContext.requireUserId(), limit));
    }
}
