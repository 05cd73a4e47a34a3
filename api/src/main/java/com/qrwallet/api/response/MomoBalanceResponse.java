package com.qrwallet.api.response;

import com.qrwallet.api.model.MomoProduct;

public record MomoBalanceResponse(
        MomoProduct product,
        String availableBalance,
        String currency
) {
}
