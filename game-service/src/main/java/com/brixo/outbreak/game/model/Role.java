package com.brixo.outbreak.game.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Rol asignado a un dispositivo durante una partida.
 * HUMAN y ZOMBIE son los dos equipos enfrentados; NEUTRAL es el rol fuera de
 * partida. La etiqueta es el valor que viaja por la API.
 */
public enum Role {
    NEUTRAL("neutral"),
    HUMAN("human"),
    ZOMBIE("zombie");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** true para los dos roles de equipo (HUMAN, ZOMBIE). */
    public boolean isTeam() {
        return this != NEUTRAL;
    }

    /**
     * Resuelve una etiqueta recibida de un cliente. Etiquetas desconocidas o null
     * devuelven vacío, nunca lanzan.
     */
    public static Optional<Role> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.label.equalsIgnoreCase(label.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
