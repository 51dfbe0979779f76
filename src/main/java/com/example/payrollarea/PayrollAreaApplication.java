package com.example.payrollarea;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PayrollAreaApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayrollAreaApplication.class, args);
    }
}
