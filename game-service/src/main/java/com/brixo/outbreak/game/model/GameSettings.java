package com.brixo.outbreak.game.model;

/**
 * Configuración de la partida que fija el operador al entrar en "prepare".
 *
 * @param humanPercentage porcentaje objetivo de humanos, en [0, 100]
 * @param timeoutSeconds  timeout que se entrega a los clientes, en segundos
 * @param durationMinutes duración de la partida, en minutos
 */
public record GameSettings(int humanPercentage, int timeoutSeconds, int durationMinutes) {

    public GameSettings withDurationMinutes(int minutes) {
        return new GameSettings(humanPercentage, timeoutSeconds, minutes);
    }
}
