package com.brixo.outbreak.game.model;

/**
 * Fase de la partida: sleep → prepare → active → end.
 * La etiqueta es el status canónico que se estampa en cada dispositivo.
 */
public enum Phase {
    SLEEPING("sleep"),
    PREPARING("prepare"),
    ACTIVE("active"),
    ENDED("end");

    private final String label;

    Phase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
