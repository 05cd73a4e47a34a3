package com.qrwallet.api.request;

/**
 * @param status One of {@code pending}, {@code verified}, {@code rejected}
 */
public record UpdateKycStatusRequest(String status) {
}
