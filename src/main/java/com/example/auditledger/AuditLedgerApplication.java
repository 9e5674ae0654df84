package com.example.auditledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AuditLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditLedgerApplication.class, args);
    }
}
