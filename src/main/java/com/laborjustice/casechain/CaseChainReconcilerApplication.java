package com.laborjustice.casechain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaseChainReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseChainReconcilerApplication.class, args);
    }
}
