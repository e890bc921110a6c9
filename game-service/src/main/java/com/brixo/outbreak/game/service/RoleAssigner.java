package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.model.Phase;
import com.brixo.outbreak.game.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Reparte los dispositivos en humanos y zombies al empezar la partida y valida
 * los cambios de equipo que piden los clientes durante "active".
 */
@Service
public class RoleAssigner {

    private static final Logger log = LoggerFactory.getLogger(RoleAssigner.class);

    private final Random random;

    public RoleAssigner(Random random) {
        this.random = random;
    }

    /** Resultado de un reparto. Ambas listas son disjuntas. */
    public record Partition(List<String> humans, List<String> zombies) {
    }

    /**
     * Baraja los ids y toma los primeros {@link #humanCount} como humanos; el resto
     * son zombies.
     */
    public Partition partition(Collection<String> deviceIds, int humanPercentage) {
        List<String> shuffled = new ArrayList<>(deviceIds);
        Collections.shuffle(shuffled, random);
        int humans = humanCount(shuffled.size(), humanPercentage);
        Partition partition = new Partition(
                List.copyOf(shuffled.subList(0, humans)),
                List.copyOf(shuffled.subList(humans, shuffled.size())));
        log.debug("Reparto de roles: {} humanos, {} zombies", partition.humans().size(),
                partition.zombies().size());
        return partition;
    }

    /**
     * round(total * percentage / 100) con redondeo half-up, con mínimo de un humano
     * cuando hay dispositivos. No hay mínimo de zombies.
     */
    public static int humanCount(int total, int humanPercentage) {
        if (total <= 0) {
            return 0;
        }
        int rounded = (total * humanPercentage + 50) / 100;
        return Math.min(total, Math.max(1, rounded));
    }

    /**
     * Cambia de equipo un dispositivo si la partida está activa, el rol pedido es
     * HUMAN o ZOMBIE y el dispositivo pertenece al otro grupo.
     *
     * @return true si el cambio se aplicó; false deja el estado intacto
     */
    public boolean requestSwap(GameState state, String id, Role requested) {
        if (state.phase() != Phase.ACTIVE || !requested.isTeam()) {
            return false;
        }
        Role current = state.groupRoleOf(id).orElse(null);
        if (current == null || current == requested) {
            log.debug("Cambio de rol rechazado para {}: actual={}, pedido={}", id, current, requested);
            return false;
        }
        state.moveTo(id, requested);
        log.info("Dispositivo {} cambia de {} a {}", id, current.label(), requested.label());
        return true;
    }
}
