package com.qrwallet.api;

import com.qrwallet.api.request.SignQrRequest;
import com.qrwallet.api.request.VerifyQrRequest;
import com.qrwallet.api.response.QrVerificationResponse;
import com.qrwallet.api.response.SignedQrResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Signed payment-request QR codes.
 */
@RequestMapping("/api/v1/qr")
public interface QrApi {

    @PostMapping("/sign")
    ResponseEntity<SignedQrResponse> signQrPayload(@RequestBody @Valid SignQrRequest request);

    @PostMapping("/verify")
    ResponseEntity<QrVerificationResponse> verifyQrSignature(@RequestBody @Valid VerifyQrRequest request);
}
