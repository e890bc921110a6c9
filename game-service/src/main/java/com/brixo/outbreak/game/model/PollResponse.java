package com.brixo.outbreak.game.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Respuesta a la consulta de un dispositivo.
 * Los nombres de campo se mantienen en snake_case porque el firmware de los
 * wearables los lee así.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PollResponse(
        String role,
        String status,
        @JsonProperty("game_timeout") int gameTimeout,
        @JsonProperty("game_duration") int gameDuration,
        @JsonProperty("remaining_seconds") Long remainingSeconds,
        Outcome outcome) {
}
