package com.flagship.gate_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
public class GateLedgerApplication {

    public static void main(String[] args) {
        // Ledger timestamps and log lines are read in UTC
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(GateLedgerApplication.class, args);
    }
}
