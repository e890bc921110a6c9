package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.exception.InvalidInputException;
import com.brixo.outbreak.game.model.PollRequest;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.JsonNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Convierte el JSON que envían los wearables en un {@link PollRequest}.
 * El firmware manda el objeto completo en el parámetro "data" de un GET:
 * { "id", "ip", "rssi", "role", "status", "health", "battery", "comment" }.
 */
@Component
public class PollRequestParser {

    private static final Logger log = LoggerFactory.getLogger(PollRequestParser.class);

    static final String NO_DATA = "No data provided";
    static final String INVALID_JSON = "Invalid JSON format";
    static final String MISSING_FIELDS = "Missing required fields";

    private static final List<String> REQUIRED_FIELDS = List.of(
            "id", "ip", "rssi", "role", "status", "health", "battery", "comment");

    private final ObjectMapper objectMapper;

    public PollRequestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InvalidInputException si falta el payload, no es un objeto JSON, falta
     *                               algún campo, un campo de texto no es texto o un
     *                               campo numérico no es un entero de 32 bits
     */
    public PollRequest parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException(NO_DATA);
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(raw);
        } catch (JacksonException e) {
            log.warn("JSON inválido en consulta de dispositivo: {}", e.getMessage());
            throw new InvalidInputException(INVALID_JSON, e);
        }
        if (data == null || !data.isObject()) {
            throw new InvalidInputException(INVALID_JSON);
        }
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = data.get(field);
            if (value == null || value.isNull()) {
                log.warn("Consulta sin campo obligatorio '{}'", field);
                throw new InvalidInputException(MISSING_FIELDS);
            }
        }
        return new PollRequest(
                text(data, "id"),
                text(data, "ip"),
                integer(data, "rssi"),
                text(data, "role"),
                text(data, "status"),
                integer(data, "health"),
                integer(data, "battery"),
                text(data, "comment"));
    }

    private static String text(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value.getNodeType() != JsonNodeType.STRING) {
            throw new InvalidInputException("El campo '" + field + "' debe ser texto");
        }
        return value.asString();
    }

    /** Sólo enteros que caben en un int; decimales y valores fuera de rango se rechazan. */
    private static int integer(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value.isInt()) {
            return value.intValue();
        }
        if (value.getNodeType() == JsonNodeType.STRING) {
            try {
                return Integer.parseInt(value.asString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidInputException("El campo '" + field + "' debe ser entero", e);
            }
        }
        throw new InvalidInputException("El campo '" + field + "' debe ser entero");
    }
}
