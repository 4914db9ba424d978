package com.expense.audit.repository;

/**
 * The expense CSV could not be read or written.
 */
public class ExpenseStorageException extends RuntimeException {

    public ExpenseStorageException(String message) {
        super(message);
    }

    public ExpenseStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
