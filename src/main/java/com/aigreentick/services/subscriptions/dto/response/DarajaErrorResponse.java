package com.aigreentick.services.subscriptions.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Error body Daraja returns with 4xx/5xx statuses:
 * { "requestId": "...", "errorCode": "400.002.02", "errorMessage": "Bad Request - Invalid PhoneNumber" }
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DarajaErrorResponse {

    private String requestId;
    private String errorCode;
    private String errorMessage;
}
