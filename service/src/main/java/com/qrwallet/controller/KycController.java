package com.qrwallet.controller;

import com.qrwallet.api.KycApi;
import com.qrwallet.api.request.UpdateKycStatusRequest;
import com.qrwallet.api.response.KycStatusResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.KycService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "KYC", description = "KYC status updates")
@Validated
@RequiredArgsConstructor
@Slf4j
public class KycController implements KycApi {

    private final KycService kycService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<KycStatusResponse> updateKycStatus(UpdateKycStatusRequest request) {
        String userId = callerContext.requireUserId();
        log.info("KYC status update requested: userId={}, status={}", userId, request.status());
        return ResponseEntity.ok(kycService.updateKycStatus(userId, request.status()));
    }
}
