package io.github.drompincen.complianceboard.client.api;

/** A read the gateway answered with a non-2xx status. */
public class ComplianceApiException extends RuntimeException {

    private final int status;

    public ComplianceApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
