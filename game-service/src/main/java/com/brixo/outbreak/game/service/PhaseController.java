package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.exception.InvalidInputException;
import com.brixo.outbreak.game.model.GameSettings;
import com.brixo.outbreak.game.model.Phase;
import com.brixo.outbreak.game.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Máquina de fases de la partida y sus efectos sobre el registro.
 *
 * Todas las transiciones las dispara el operador y repetirlas no tiene efecto
 * adicional. "end" es terminal: sólo {@link #reset()} vuelve a "sleep".
 * No sincroniza; el llamador debe tener el lock de {@link GameCoordinatorService}.
 */
@Service
public class PhaseController {

    private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

    private final GameState state;
    private final DeviceRegistryService registry;
    private final RoleAssigner roleAssigner;
    private final Clock clock;

    public PhaseController(GameState state, DeviceRegistryService registry,
            RoleAssigner roleAssigner, Clock clock) {
        this.state = state;
        this.registry = registry;
        this.roleAssigner = roleAssigner;
        this.clock = clock;
    }

    /** Vuelve a "sleep": todos NEUTRAL, grupos vacíos y reloj de partida a cero. */
    public void reset() {
        state.setPhase(Phase.SLEEPING);
        state.clearGroups();
        state.setStartedAt(null);
        registry.neutralizeAll(Phase.SLEEPING);
        log.info("Partida reiniciada ({} dispositivos a neutral)", registry.size());
    }

    /**
     * Guarda la configuración y pasa a "prepare". Los roles no se tocan.
     *
     * @throws InvalidInputException si algún valor está fuera de rango; en ese
     *                               caso ni la configuración ni la fase cambian
     */
    public void enterPreparing(GameSettings settings) {
        validate(settings);
        if (state.phase() == Phase.ENDED) {
            log.warn("Ignorando prepare: la partida terminó, hace falta reset");
            return;
        }
        state.setSettings(settings);
        state.setPhase(Phase.PREPARING);
        registry.restampAll(Phase.PREPARING);
        log.info("Fase prepare: {}% humanos, timeout {}s, duración {} min",
                settings.humanPercentage(), settings.timeoutSeconds(), settings.durationMinutes());
    }

    /**
     * Pasa a "active" y reparte los dispositivos conocidos en humanos y zombies.
     * El instante de inicio sólo se fija la primera vez.
     */
    public void enterActive() {
        if (state.phase() == Phase.ACTIVE) {
            return;
        }
        if (state.phase() == Phase.ENDED) {
            log.warn("Ignorando activate: la partida terminó, hace falta reset");
            return;
        }
        if (state.startedAt() == null) {
            state.setStartedAt(clock.instant());
        }
        RoleAssigner.Partition partition = roleAssigner.partition(
                registry.ids(), state.settings().humanPercentage());
        state.replaceGroups(partition.humans(), partition.zombies());
        state.setPhase(Phase.ACTIVE);
        registry.restampAll(Phase.ACTIVE);
        partition.humans().forEach(id -> registry.assignRole(id, Role.HUMAN));
        partition.zombies().forEach(id -> registry.assignRole(id, Role.ZOMBIE));
        log.info("Partida activa: {} humanos, {} zombies",
                partition.humans().size(), partition.zombies().size());
    }

    /**
     * Suma minutos a la duración, sin importar la fase.
     *
     * @throws InvalidInputException si deltaMinutes es menor que 1
     */
    public void extendDuration(int deltaMinutes) {
        requirePositiveMinutes(deltaMinutes);
        GameSettings current = state.settings();
        state.setSettings(current.withDurationMinutes(current.durationMinutes() + deltaMinutes));
        log.info("Duración ampliada a {} min", state.settings().durationMinutes());
    }

    /**
     * Resta minutos a la duración sin bajar de 1.
     *
     * @throws InvalidInputException si deltaMinutes es menor que 1
     */
    public void shortenDuration(int deltaMinutes) {
        requirePositiveMinutes(deltaMinutes);
        GameSettings current = state.settings();
        int minutes = Math.max(1, current.durationMinutes() - deltaMinutes);
        state.setSettings(current.withDurationMinutes(minutes));
        log.info("Duración reducida a {} min", minutes);
    }

    /**
     * El operador mueve un jugador al otro equipo durante "active".
     * Nunca deja vacío el equipo de origen.
     *
     * @throws InvalidInputException si la partida no está activa, el rol no es de
     *                               equipo, el dispositivo no está en el equipo
     *                               contrario o es el último de su equipo
     */
    public void moveDevice(String id, Role target) {
        if (state.phase() != Phase.ACTIVE) {
            throw new InvalidInputException("Sólo se pueden mover jugadores con la partida activa");
        }
        if (!target.isTeam()) {
            throw new InvalidInputException("Rol de destino no válido: " + target.label());
        }
        Role current = state.groupRoleOf(id)
                .orElseThrow(() -> new InvalidInputException("El dispositivo no está en ningún equipo: " + id));
        if (current == target) {
            throw new InvalidInputException("El dispositivo ya es " + target.label() + ": " + id);
        }
        List<String> source = current == Role.HUMAN ? state.humans() : state.zombies();
        if (source.size() <= 1) {
            throw new InvalidInputException("No se puede dejar sin jugadores al equipo " + current.label());
        }
        state.moveTo(id, target);
        registry.assignRole(id, target);
        log.info("Operador mueve {} de {} a {}", id, current.label(), target.label());
    }

    /** Pasa a "end". Los grupos quedan como estaban para el resumen final. */
    public void enterEnded() {
        state.setPhase(Phase.ENDED);
        registry.restampAll(Phase.ENDED);
        log.info("Partida terminada: {} humanos, {} zombies",
                state.humans().size(), state.zombies().size());
    }

    private static void requirePositiveMinutes(int deltaMinutes) {
        if (deltaMinutes < 1) {
            throw new InvalidInputException("minutes debe ser positivo: " + deltaMinutes);
        }
    }

    private static void validate(GameSettings settings) {
        if (settings.humanPercentage() < 0 || settings.humanPercentage() > 100) {
            throw new InvalidInputException(
                    "human_percentage debe estar entre 0 y 100: " + settings.humanPercentage());
        }
        if (settings.timeoutSeconds() < 1) {
            throw new InvalidInputException(
                    "game_timeout debe ser positivo: " + settings.timeoutSeconds());
        }
        if (settings.durationMinutes() < 1) {
            throw new InvalidInputException(
                    "game_duration debe ser positivo: " + settings.durationMinutes());
        }
    }
}
