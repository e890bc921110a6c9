package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.model.GameSettings;
import com.brixo.outbreak.game.model.Phase;
import com.brixo.outbreak.game.model.Role;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Estado único de la partida: fase, configuración, instante de inicio y los dos
 * grupos de equipo.
 *
 * No es thread-safe; sólo se toca dentro de la sección crítica de
 * {@link GameCoordinatorService}. Los grupos son siempre disjuntos.
 */
public class GameState {

    private Phase phase = Phase.SLEEPING;
    private GameSettings settings;
    private Instant startedAt;
    private final Set<String> humans = new LinkedHashSet<>();
    private final Set<String> zombies = new LinkedHashSet<>();

    public GameState(GameSettings defaults) {
        this.settings = defaults;
    }

    public Phase phase() {
        return phase;
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    public GameSettings settings() {
        return settings;
    }

    void setSettings(GameSettings settings) {
        this.settings = settings;
    }

    public Instant startedAt() {
        return startedAt;
    }

    void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public List<String> humans() {
        return List.copyOf(humans);
    }

    public List<String> zombies() {
        return List.copyOf(zombies);
    }

    /** Rol de equipo según la pertenencia a los grupos; vacío si no está en ninguno. */
    public Optional<Role> groupRoleOf(String id) {
        if (humans.contains(id)) {
            return Optional.of(Role.HUMAN);
        }
        if (zombies.contains(id)) {
            return Optional.of(Role.ZOMBIE);
        }
        return Optional.empty();
    }

    void replaceGroups(List<String> newHumans, List<String> newZombies) {
        humans.clear();
        zombies.clear();
        humans.addAll(newHumans);
        zombies.addAll(newZombies);
    }

    void clearGroups() {
        humans.clear();
        zombies.clear();
    }

    /** Mueve el id al grupo indicado, quitándolo del otro. */
    void moveTo(String id, Role role) {
        if (role == Role.HUMAN) {
            zombies.remove(id);
            humans.add(id);
        } else if (role == Role.ZOMBIE) {
            humans.remove(id);
            zombies.add(id);
        }
    }
}
