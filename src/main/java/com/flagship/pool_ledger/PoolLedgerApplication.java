package com.flagship.pool_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PoolLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoolLedgerApplication.class, args);
    }

}
