package com.qrwallet.api;

import com.qrwallet.api.request.UpdateKycStatusRequest;
import com.qrwallet.api.response.KycStatusResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

@RequestMapping("/api/v1/kyc")
public interface KycApi {

    /**
     * Sets the caller's KYC status. {@code verified} is accepted only once the caller's
     * KYC documents have been approved.
     */
    @PutMapping("/status")
    ResponseEntity<KycStatusResponse> updateKycStatus(@RequestBody UpdateKycStatusRequest request);
}
