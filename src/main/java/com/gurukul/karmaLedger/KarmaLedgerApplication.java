package com.gurukul.karmaLedger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KarmaLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KarmaLedgerApplication.class, args);
    }
}
