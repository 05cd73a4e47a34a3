package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Public view of a wallet found by its public ID. Only {@code found} is set when no wallet matches.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WalletLookupResponse(
        boolean found,
        String walletId,
        String recipientName,
        String profilePhotoUrl
) {
    public static WalletLookupResponse notFound() {
        return new WalletLookupResponse(false, null, null, null);
    }
}
