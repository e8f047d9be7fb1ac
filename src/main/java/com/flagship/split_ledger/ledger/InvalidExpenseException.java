package com.flagship.split_ledger.ledger;

/**
 * Thrown when an expense draft violates a precondition. Nothing is persisted.
 */
public class InvalidExpenseException extends IllegalArgumentException {

    public InvalidExpenseException(String message) {
        super(message);
    }
}
