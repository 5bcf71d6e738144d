package com.thetaguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThetaGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThetaGuardApplication.class, args);
    }
}
