package com.brixo.outbreak.game.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Vista de sólo lectura del estado de la partida para el panel del operador.
 * remainingSeconds sólo se informa en "active" y outcome sólo en "end".
 * humanHealth y zombieHealth suman la salud reportada por los miembros de cada
 * equipo.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameSummary(
        String phase,
        GameSettings settings,
        Instant startedAt,
        Long remainingSeconds,
        int deviceCount,
        List<String> humans,
        List<String> zombies,
        int humanHealth,
        int zombieHealth,
        Outcome outcome) {
}
