package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.model.Device;
import com.brixo.outbreak.game.model.GameSettings;
import com.brixo.outbreak.game.model.GameSummary;
import com.brixo.outbreak.game.model.Outcome;
import com.brixo.outbreak.game.model.Phase;
import com.brixo.outbreak.game.model.PollRequest;
import com.brixo.outbreak.game.model.PollResponse;
import com.brixo.outbreak.game.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Punto de entrada único al estado compartido (registro + fase + grupos).
 *
 * Cada operación toma el lock durante toda la secuencia leer fase → mutar →
 * construir respuesta, así una transición y una consulta nunca se entrelazan y
 * la pareja (rol, fase) devuelta siempre es coherente.
 */
@Service
public class GameCoordinatorService {

    private static final Logger log = LoggerFactory.getLogger(GameCoordinatorService.class);

    private final Lock lock;
    private final GameState state;
    private final DeviceRegistryService registry;
    private final PhaseController phaseController;
    private final RoleAssigner roleAssigner;
    private final Clock clock;

    public GameCoordinatorService(Lock gameStateLock, GameState state,
            DeviceRegistryService registry, PhaseController phaseController,
            RoleAssigner roleAssigner, Clock clock) {
        this.lock = gameStateLock;
        this.state = state;
        this.registry = registry;
        this.phaseController = phaseController;
        this.roleAssigner = roleAssigner;
        this.clock = clock;
    }

    // ── Dispositivos ──────────────────────────────────────────────────────────

    /**
     * Procesa la consulta de un dispositivo: resuelve su rol según la fase,
     * actualiza el registro y devuelve rol, fase y configuración.
     *
     * Durante "active" el rol sale de los grupos; si el cliente pide el equipo
     * contrario se aplica el cambio. En el resto de fases el rol pedido se ignora.
     */
    public PollResponse pollDevice(PollRequest request) {
        return locked(() -> {
            Phase phase = state.phase();
            Role role = registry.resolveRole(request.id(), phase);
            if (phase == Phase.ACTIVE) {
                Role.fromLabel(request.role())
                        .ifPresent(requested -> roleAssigner.requestSwap(state, request.id(), requested));
                role = state.groupRoleOf(request.id()).orElse(role);
            }
            registry.upsert(request, phase, role, clock.instant());
            log.debug("Dispositivo {} ({}) → rol {}, fase {}", request.id(), request.ip(),
                    role.label(), phase.label());

            GameSettings settings = state.settings();
            return new PollResponse(
                    role.label(),
                    phase.label(),
                    settings.timeoutSeconds(),
                    settings.durationMinutes(),
                    remainingSeconds(),
                    outcome());
        });
    }

    /** Lista ordenada por id de todos los dispositivos conocidos. */
    public List<Device> snapshot() {
        return locked(registry::findAll);
    }

    /** Busca un dispositivo por su id. */
    public Optional<Device> findDevice(String id) {
        return locked(() -> registry.findById(id));
    }

    // ── Operador ──────────────────────────────────────────────────────────────

    /** Vuelve a "sleep" con todos los dispositivos en neutral. */
    public GameSummary reset() {
        return locked(() -> {
            phaseController.reset();
            return buildSummary();
        });
    }

    /**
     * Pasa a "prepare" con la configuración dada. Lanza InvalidInputException si
     * la configuración no es válida; el estado no cambia.
     */
    public GameSummary enterPreparing(GameSettings settings) {
        return locked(() -> {
            phaseController.enterPreparing(settings);
            return buildSummary();
        });
    }

    /** Pasa a "active" y reparte los equipos. */
    public GameSummary enterActive() {
        return locked(() -> {
            phaseController.enterActive();
            return buildSummary();
        });
    }

    /** Suma minutos a la duración; minutes debe ser al menos 1. */
    public GameSummary extendDuration(int minutes) {
        return locked(() -> {
            phaseController.extendDuration(minutes);
            return buildSummary();
        });
    }

    /** Resta minutos a la duración sin bajar de 1; minutes debe ser al menos 1. */
    public GameSummary shortenDuration(int minutes) {
        return locked(() -> {
            phaseController.shortenDuration(minutes);
            return buildSummary();
        });
    }

    /**
     * Mueve un jugador al otro equipo por orden del operador. Lanza
     * InvalidInputException si el movimiento no es válido; el estado no cambia.
     */
    public GameSummary moveDevice(String id, Role target) {
        return locked(() -> {
            phaseController.moveDevice(id, target);
            return buildSummary();
        });
    }

    /** Pasa a "end"; los equipos quedan congelados para el resultado. */
    public GameSummary enterEnded() {
        return locked(() -> {
            phaseController.enterEnded();
            return buildSummary();
        });
    }

    /** Resumen del estado actual de la partida. */
    public GameSummary summary() {
        return locked(this::buildSummary);
    }

    // ── Internos (siempre con el lock tomado) ─────────────────────────────────

    private GameSummary buildSummary() {
        return new GameSummary(
                state.phase().label(),
                state.settings(),
                state.startedAt(),
                remainingSeconds(),
                registry.size(),
                state.humans(),
                state.zombies(),
                totalHealth(state.humans()),
                totalHealth(state.zombies()),
                outcome());
    }

    /** Ids que ya no están en el registro no suman. */
    private int totalHealth(List<String> ids) {
        return ids.stream()
                .map(registry::findById)
                .flatMap(Optional::stream)
                .mapToInt(Device::health)
                .sum();
    }

    private Long remainingSeconds() {
        if (state.phase() != Phase.ACTIVE || state.startedAt() == null) {
            return null;
        }
        Instant deadline = state.startedAt().plus(Duration.ofMinutes(state.settings().durationMinutes()));
        long remaining = Duration.between(clock.instant(), deadline).getSeconds();
        return Math.max(0L, remaining);
    }

    private Outcome outcome() {
        if (state.phase() != Phase.ENDED) {
            return null;
        }
        return Outcome.of(state.humans().size(), state.zombies().size());
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
