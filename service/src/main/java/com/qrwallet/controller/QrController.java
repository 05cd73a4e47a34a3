package com.qrwallet.controller;

import com.qrwallet.api.QrApi;
import com.qrwallet.api.request.SignQrRequest;
import com.qrwallet.api.request.VerifyQrRequest;
import com.qrwallet.api.response.QrVerificationResponse;
import com.qrwallet.api.response.SignedQrResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.QrSigningService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "QR Codes", description = "Signed QR payment payloads")
@Validated
@RequiredArgsConstructor
public class QrController implements QrApi {

    private final QrSigningService qrSigningService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<SignedQrResponse> signQrPayload(SignQrRequest request) {
        return ResponseEntity.ok(qrSigningService.sign(callerContext.requireUserId(), request));
    }

    @Override
    public ResponseEntity<QrVerificationResponse> verifyQrSignature(VerifyQrRequest request) {
        callerContext.requireUserId();
        return ResponseEntity.ok(qrSigningService.verify(request));
    }
}
