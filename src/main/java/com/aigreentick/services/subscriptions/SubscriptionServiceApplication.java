package com.aigreentick.services.subscriptions;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Subscription Payment Service
 *
 * This microservice handles:
 * - Plan catalogue (gaming, gym, movies, sports)
 * - Subscription lifecycle (pending → active/failed → expired)
 * - M-Pesa STK push initiation and OAuth token management
 * - Payment outcome webhooks and status-query fallback
 * - Scheduled expiry sweep
 *
 * Integration: Safaricom Daraja API (Lipa na M-Pesa Online)
 *
 * @author AiGreenTick Team
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Subscription Payment Service API",
                version = "1.0.0",
                description = "Time-boxed subscriptions paid through M-Pesa STK push.",
                contact = @Contact(
                        name = "AiGreenTick Support",
                        email = "support@aigreentick.com"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8083", description = "Local Development"),
                @Server(url = "https://api.aigreentick.com", description = "Production")
        }
)
public class SubscriptionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubscriptionServiceApplication.class, args);
    }
}
