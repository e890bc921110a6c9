package com.brixo.outbreak.game.controller;

import com.brixo.outbreak.game.exception.InvalidInputException;
import com.brixo.outbreak.game.model.GameSettings;
import com.brixo.outbreak.game.model.GameSummary;
import com.brixo.outbreak.game.model.Role;
import com.brixo.outbreak.game.service.GameCoordinatorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * API del operador: conduce la partida por sus fases.
 *
 * GET  /api/game           → resumen del estado
 * POST /api/game/reset     → sleep
 * POST /api/game/prepare   → prepare (human_percentage, game_timeout, game_duration)
 * POST /api/game/activate  → active, reparte roles
 * POST /api/game/extend    → +N minutos (por defecto 1)
 * POST /api/game/shorten   → -N minutos (por defecto 1, duración mínima 1)
 * POST /api/game/move      → el operador mueve un jugador de equipo (id, role)
 * POST /api/game/end       → end
 */
@RestController
@RequestMapping("/api/game")
public class GameController {

    private static final Logger log = LoggerFactory.getLogger(GameController.class);

    private final GameCoordinatorService coordinator;

    public GameController(GameCoordinatorService coordinator) {
        this.coordinator = coordinator;
    }

    /** Retorna el resumen de la partida. */
    @GetMapping
    public ResponseEntity<GameSummary> getSummary() {
        return ResponseEntity.ok(coordinator.summary());
    }

    /** Vuelve a "sleep" y pone todos los dispositivos en neutral. */
    @PostMapping("/reset")
    public ResponseEntity<GameSummary> reset() {
        return ResponseEntity.ok(coordinator.reset());
    }

    /**
     * Pasa a "prepare" con la configuración del formulario.
     * Valores no enteros o fuera de rango responden 400 y la fase no cambia.
     */
    @PostMapping("/prepare")
    public ResponseEntity<?> prepare(
            @RequestParam(name = "human_percentage", required = false) String humanPercentage,
            @RequestParam(name = "game_timeout", required = false) String gameTimeout,
            @RequestParam(name = "game_duration", required = false) String gameDuration) {
        try {
            GameSettings settings = new GameSettings(
                    parseInt("human_percentage", humanPercentage),
                    parseInt("game_timeout", gameTimeout),
                    parseInt("game_duration", gameDuration));
            return ResponseEntity.ok(coordinator.enterPreparing(settings));
        } catch (InvalidInputException ex) {
            log.warn("Configuración de partida rechazada: {}", ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }

    /** Pasa a "active" y reparte humanos y zombies. */
    @PostMapping("/activate")
    public ResponseEntity<GameSummary> activate() {
        return ResponseEntity.ok(coordinator.enterActive());
    }

    /** Suma minutos a la duración. minutes menor que 1 responde 400. */
    @PostMapping("/extend")
    public ResponseEntity<?> extend(
            @RequestParam(name = "minutes", defaultValue = "1") int minutes) {
        try {
            return ResponseEntity.ok(coordinator.extendDuration(minutes));
        } catch (InvalidInputException ex) {
            log.warn("Ampliación rechazada: {}", ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }

    /** Resta minutos a la duración. minutes menor que 1 responde 400. */
    @PostMapping("/shorten")
    public ResponseEntity<?> shorten(
            @RequestParam(name = "minutes", defaultValue = "1") int minutes) {
        try {
            return ResponseEntity.ok(coordinator.shortenDuration(minutes));
        } catch (InvalidInputException ex) {
            log.warn("Reducción rechazada: {}", ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }

    /**
     * Mueve un jugador al otro equipo durante "active".
     * Responde 400 si la partida no está activa, el rol no es human/zombie o el
     * jugador es el último de su equipo.
     */
    @PostMapping("/move")
    public ResponseEntity<?> move(
            @RequestParam(name = "id") String id,
            @RequestParam(name = "role") String role) {
        try {
            Role target = Role.fromLabel(role)
                    .orElseThrow(() -> new InvalidInputException("Rol desconocido: " + role));
            return ResponseEntity.ok(coordinator.moveDevice(id, target));
        } catch (InvalidInputException ex) {
            log.warn("Movimiento de {} rechazado: {}", id, ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }

    /** Pasa a "end"; los equipos quedan congelados. */
    @PostMapping("/end")
    public ResponseEntity<GameSummary> end() {
        return ResponseEntity.ok(coordinator.enterEnded());
    }

    private static int parseInt(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("Falta el campo '" + field + "'");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("El campo '" + field + "' debe ser entero: " + value, e);
        }
    }
}
