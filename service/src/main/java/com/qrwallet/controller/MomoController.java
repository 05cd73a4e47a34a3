package com.qrwallet.controller;

import com.qrwallet.api.MomoApi;
import com.qrwallet.api.request.MomoPaymentRequest;
import com.qrwallet.api.response.MomoBalanceResponse;
import com.qrwallet.api.response.MomoTransactionResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.MomoService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Mobile Money", description = "Mobile money collections and disbursements")
@Validated
@RequiredArgsConstructor
@Slf4j
public class MomoController implements MomoApi {

    private final MomoService momoService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<MomoTransactionResponse> requestToPay(MomoPaymentRequest request) {
        String userId = callerContext.requireUserId();
        log.info("MoMo collection requested: userId={}, amount={}, currency={}",
                userId, request.amount(), request.currency());
        return ResponseEntity.ok(momoService.requestToPay(userId, request));
    }

    @Override
    public ResponseEntity<MomoTransactionResponse> transfer(MomoPaymentRequest request) {
        String userId = callerContext.requireUserId();
        log.info("MoMo disbursement requested: userId={}, amount={}, currency={}",
                userId, request.amount(), request.currency());
        return ResponseEntity.ok(momoService.transfer(userId, request));
    }

    @Override
    public ResponseEntity<MomoTransactionResponse> checkStatus(String referenceId) {
        return ResponseEntity.ok(momoService.checkStatus(callerContext.requireUserId(), referenceId));
    }

    @Override
    public ResponseEntity<MomoBalanceResponse> getBalance(String product) {
        callerContext.requireUserId();
        return ResponseEntity.ok(momoService.getBalance(product));
    }
}
