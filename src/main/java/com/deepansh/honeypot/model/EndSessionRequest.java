package com.deepansh.honeypot.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EndSessionRequest {

    @NotBlank(message = "sessionId is required")
    @JsonAlias("session_id")
    private String sessionId;
}
