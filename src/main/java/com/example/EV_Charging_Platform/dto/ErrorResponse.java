package com.example.EV_Charging_Platform.dto;

/**
 * Data Transfer Object for a failed request
 */
public class ErrorResponse {

    public String error;
    public String message;

    public ErrorResponse() {}

    public ErrorResponse(String error, String message) {
        this.error = error;
        this.message = message;
    }
}
