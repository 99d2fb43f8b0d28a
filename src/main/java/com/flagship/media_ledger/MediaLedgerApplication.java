package com.flagship.media_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MediaLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaLedgerApplication.class, args);
    }
}
