package com.qrwallet.api.response;

import com.qrwallet.api.model.KycStatus;

public record KycStatusResponse(KycStatus kycStatus) {
}
