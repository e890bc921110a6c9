package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.model.Device;
import com.brixo.outbreak.game.model.Phase;
import com.brixo.outbreak.game.model.PollRequest;
import com.brixo.outbreak.game.model.Role;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro de dispositivos conectados.
 *
 * Sólo vive en memoria: se pierde al reiniciar el servicio y nunca se eliminan
 * entradas. Las mutaciones llegan siempre desde {@link GameCoordinatorService},
 * que las serializa.
 */
@Service
public class DeviceRegistryService {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();

    /** Lista todos los dispositivos ordenados por id. */
    public List<Device> findAll() {
        return devices.values().stream()
                .sorted(Comparator.comparing(Device::id))
                .toList();
    }

    /** Busca un dispositivo por su id. */
    public Optional<Device> findById(String id) {
        return Optional.ofNullable(devices.get(id));
    }

    /** Ids conocidos, ordenados. */
    public List<String> ids() {
        return devices.keySet().stream().sorted().toList();
    }

    /** Número de dispositivos registrados. */
    public int size() {
        return devices.size();
    }

    /**
     * Rol que corresponde a un dispositivo en la fase dada, sin contar cambios de
     * equipo: en "sleep" siempre NEUTRAL; en el resto se conserva el rol previo o
     * NEUTRAL si es la primera vez que aparece.
     */
    public Role resolveRole(String id, Phase phase) {
        if (phase == Phase.SLEEPING) {
            return Role.NEUTRAL;
        }
        return findById(id).map(Device::role).orElse(Role.NEUTRAL);
    }

    /**
     * Registra o actualiza un dispositivo. El status se toma de la fase, nunca del
     * cliente, y lastSeen se fija a {@code now}.
     */
    public Device upsert(PollRequest request, Phase phase, Role role, Instant now) {
        Device device = new Device(
                request.id(),
                request.ip(),
                request.rssi(),
                role,
                phase.label(),
                request.health(),
                request.battery(),
                request.comment(),
                now);
        devices.put(device.id(), device);
        return device;
    }

    /** Estampa el status de la fase en todos los dispositivos. */
    public void restampAll(Phase phase) {
        devices.replaceAll((id, device) -> device.withStatus(phase));
    }

    /** Vuelve todos los dispositivos a NEUTRAL con el status de la fase dada. */
    public void neutralizeAll(Phase phase) {
        devices.replaceAll((id, device) -> device.withStatus(phase).withRole(Role.NEUTRAL));
    }

    /** Asigna un rol; ids desconocidos se ignoran. */
    public void assignRole(String id, Role role) {
        devices.computeIfPresent(id, (key, device) -> device.withRole(role));
    }
}
