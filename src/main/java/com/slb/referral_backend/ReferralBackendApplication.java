package com.slb.referral_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReferralBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReferralBackendApplication.class, args);
    }
}
