package com.brixo.outbreak.game.service;

import com.brixo.outbreak.game.exception.InvalidInputException;
import com.brixo.outbreak.game.model.PollRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.databind.json.JsonMapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PollRequestParserTest {

    private final PollRequestParser parser = new PollRequestParser(JsonMapper.builder().build());

    @Test
    void parsesCompletePayload() {
        PollRequest request = parser.parse("""
                {"id":"AA:BB:CC","ip":"192.168.4.20","rssi":-61,"role":"zombie",
                 "status":"game","health":87,"battery":54,"comment":"v1.3"}
                """);

        assertThat(request).isEqualTo(new PollRequest(
                "AA:BB:CC", "192.168.4.20", -61, "zombie", "game", 87, 54, "v1.3"));
    }

    @Test
    void acceptsNumericStringsForIntegerFields() {
        PollRequest request = parser.parse("""
                {"id":"d1","ip":"10.0.0.2","rssi":"-70","role":"neutral",
                 "status":"sleep","health":"100","battery":"3","comment":""}
                """);

        assertThat(request.rssi()).isEqualTo(-70);
        assertThat(request.health()).isEqualTo(100);
        assertThat(request.battery()).isEqualTo(3);
    }

    @Test
    void rejectsMissingPayload() {
        assertThatThrownBy(() -> parser.parse(null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(PollRequestParser.NO_DATA);
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(PollRequestParser.NO_DATA);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> parser.parse("{\"id\": \"d1\""))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(PollRequestParser.INVALID_JSON);
        assertThatThrownBy(() -> parser.parse("[1, 2]"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(PollRequestParser.INVALID_JSON);
    }

    @Test
    void rejectsMissingField() {
        assertThatThrownBy(() -> parser.parse("""
                {"id":"d1","ip":"10.0.0.2","rssi":-70,"role":"neutral",
                 "status":"sleep","health":100,"battery":3}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(PollRequestParser.MISSING_FIELDS);
    }

    @Test
    void rejectsNonIntegerTelemetry() {
        assertThatThrownBy(() -> parser.parse("""
                {"id":"d1","ip":"10.0.0.2","rssi":"strong","role":"neutral",
                 "status":"sleep","health":100,"battery":3,"comment":""}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("rssi");
    }

    @ParameterizedTest
    @ValueSource(strings = {"-58.9", "4294967396", "1e20", "true"})
    void rejectsTelemetryThatIsNotA32BitInteger(String rssi) {
        assertThatThrownBy(() -> parser.parse(payloadWithRssi(rssi)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("rssi");
    }

    @Test
    void rejectsWideIntegersInEveryTelemetryField() {
        assertThatThrownBy(() -> parser.parse("""
                {"id":"d1","ip":"10.0.0.2","rssi":-60,"role":"neutral",
                 "status":"sleep","health":4294967396,"battery":3,"comment":""}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("health");
        assertThatThrownBy(() -> parser.parse("""
                {"id":"d1","ip":"10.0.0.2","rssi":-60,"role":"neutral",
                 "status":"sleep","health":100,"battery":1e20,"comment":""}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("battery");
    }

    @Test
    void rejectsNonTextIdentifiers() {
        assertThatThrownBy(() -> parser.parse("""
                {"id":{"mac":"AA"},"ip":"10.0.0.2","rssi":-60,"role":"neutral",
                 "status":"sleep","health":100,"battery":3,"comment":""}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("id");
        assertThatThrownBy(() -> parser.parse("""
                {"id":"d1","ip":["10.0.0.2"],"rssi":-60,"role":"neutral",
                 "status":"sleep","health":100,"battery":3,"comment":""}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("ip");
    }

    @Test
    void rejectsExplicitNullAsMissing() {
        assertThatThrownBy(() -> parser.parse("""
                {"id":"d1","ip":"10.0.0.2","rssi":-60,"role":null,
                 "status":"sleep","health":100,"battery":3,"comment":""}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(PollRequestParser.MISSING_FIELDS);
    }

    private static String payloadWithRssi(String rssi) {
        return "{\"id\":\"d1\",\"ip\":\"10.0.0.2\",\"rssi\":" + rssi + ",\"role\":\"neutral\","
                + "\"status\":\"sleep\",\"health\":100,\"battery\":3,\"comment\":\"\"}";
    }
}
