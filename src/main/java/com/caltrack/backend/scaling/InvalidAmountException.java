package com.caltrack.backend.scaling;

/**
 * Amount (or divisor) that cannot be used for scaling. The caller can retry with a corrected amount.
 */
public class InvalidAmountException extends RuntimeException {

    private final double amount;

    public InvalidAmountException(String code, double amount) {
        super(code);
        this.amount = amount;
    }

    public double amount() {
        return amount;
    }
}
