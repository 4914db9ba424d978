package com.expense.audit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExpenseAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseAuditApplication.class, args);
    }
}
