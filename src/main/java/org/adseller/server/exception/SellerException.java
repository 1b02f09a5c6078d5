package org.adseller.server.exception;

@SuppressWarnings("serial")
public class SellerException extends RuntimeException {

    public SellerException(String message) {
        super(message);
    }

    public SellerException(String message, Throwable cause) {
        super(message, cause);
    }
}
