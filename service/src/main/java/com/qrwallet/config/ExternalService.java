package com.qrwallet.config;

/**
 * External integrations whose secrets are checked by {@link ServiceReadinessGate}.
 */
public enum ExternalService {
    PAYSTACK("paystack"),
    QR("qr"),
    MOMO_COLLECTIONS("momo_collections"),
    MOMO_DISBURSEMENTS("momo_disbursements"),
    MOMO_WEBHOOK("momo_webhook");

    private final String serviceName;

    ExternalService(String serviceName) {
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
