package com.brixo.outbreak.game.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resultado de una partida terminada, calculado a partir del tamaño de los
 * grupos.
 */
public enum Outcome {
    HUMANS_WIN("hwin"),
    ZOMBIES_WIN("zwin"),
    DRAW("draw");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Outcome of(int humans, int zombies) {
        if (humans > zombies) {
            return HUMANS_WIN;
        }
        if (zombies > humans) {
            return ZOMBIES_WIN;
        }
        return DRAW;
    }
}
