package com.brixo.outbreak.game.model;

/**
 * Datos que envía un dispositivo en cada consulta. Todos los campos son
 * obligatorios; la validación ocurre en {@code PollRequestParser}.
 *
 * @param role   rol solicitado por el cliente, sólo tiene efecto durante "active"
 * @param status status que reporta el cliente; se acepta pero no se guarda
 */
public record PollRequest(
        String id,
        String ip,
        int rssi,
        String role,
        String status,
        int health,
        int battery,
        String comment) {
}
