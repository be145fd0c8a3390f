package com.paymentsengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Payments Engine.
 *
 * Payments Engine replays a CSV of deposits, withdrawals and dispute events against
 * client accounts and prints the final state of every account it touched.
 */
@SpringBootApplication
public class PaymentsEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PaymentsEngineApplication.class, args)));
    }
}
