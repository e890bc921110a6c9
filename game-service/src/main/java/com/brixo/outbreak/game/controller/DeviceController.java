package com.brixo.outbreak.game.controller;

import com.brixo.outbreak.game.exception.InvalidInputException;
import com.brixo.outbreak.game.model.Device;
import com.brixo.outbreak.game.model.PollRequest;
import com.brixo.outbreak.game.service.GameCoordinatorService;
import com.brixo.outbreak.game.service.PollRequestParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * API de los wearables y del registro de dispositivos.
 *
 * GET  /api/device?data={json} → consulta periódica del dispositivo
 * POST /api/device             → misma consulta con el JSON en el body
 * GET  /api/devices            → lista ordenada por id
 * GET  /api/devices/{id}       → un dispositivo, 404 si no existe
 */
@RestController
@RequestMapping("/api")
public class DeviceController {

    private static final Logger log = LoggerFactory.getLogger(DeviceController.class);

    private final GameCoordinatorService coordinator;
    private final PollRequestParser parser;

    public DeviceController(GameCoordinatorService coordinator, PollRequestParser parser) {
        this.coordinator = coordinator;
        this.parser = parser;
    }

    /** Consulta del firmware: el JSON completo viaja en el parámetro "data". */
    @GetMapping("/device")
    public ResponseEntity<?> poll(@RequestParam(name = "data", required = false) String data) {
        return handlePoll(data);
    }

    /** Variante con el JSON en el body, para clientes que no usan query string. */
    @PostMapping("/device")
    public ResponseEntity<?> pollWithBody(@RequestBody(required = false) String body) {
        return handlePoll(body);
    }

    /** Lista todos los dispositivos conocidos. */
    @GetMapping("/devices")
    public ResponseEntity<List<Device>> getAllDevices() {
        return ResponseEntity.ok(coordinator.snapshot());
    }

    /** Busca un dispositivo por su id. */
    @GetMapping("/devices/{id}")
    public ResponseEntity<Device> getDevice(@PathVariable String id) {
        return coordinator.findDevice(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private ResponseEntity<?> handlePoll(String raw) {
        try {
            PollRequest request = parser.parse(raw);
            return ResponseEntity.ok(coordinator.pollDevice(request));
        } catch (InvalidInputException ex) {
            log.warn("Consulta de dispositivo rechazada: {}", ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }
}
