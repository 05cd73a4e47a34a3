package com.qrwallet.api.response;

public record BankResponse(String name, String code, String type) {
}
