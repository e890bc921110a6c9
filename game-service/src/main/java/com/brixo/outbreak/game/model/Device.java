package com.brixo.outbreak.game.model;

import java.time.Instant;

/**
 * Dispositivo registrado (wearable que consulta periódicamente el servidor).
 * El status lo estampa siempre el servidor con la fase actual; el que envía el
 * cliente no se guarda.
 */
public record Device(
        String id,
        String ip,
        int rssi,
        Role role,
        String status,
        int health,
        int battery,
        String comment,
        Instant lastSeen) {

    public Device withRole(Role newRole) {
        return new Device(id, ip, rssi, newRole, status, health, battery, comment, lastSeen);
    }

    public Device withStatus(Phase phase) {
        return new Device(id, ip, rssi, role, phase.label(), health, battery, comment, lastSeen);
    }
}
