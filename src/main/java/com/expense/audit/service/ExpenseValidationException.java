package com.expense.audit.service;

import lombok.Getter;

/**
 * A submitted expense record failed validation. Carries the offending column.
 */
@Getter
public class ExpenseValidationException extends RuntimeException {

    private final String field;

    public ExpenseValidationException(String message, String field) {
        super(message);
        this.field = field;
    }
}
