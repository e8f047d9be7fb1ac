package com.flagship.split_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SplitLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SplitLedgerApplication.class, args);
    }
}
