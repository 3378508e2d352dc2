package com.ciro.gatemux.web;

import com.ciro.gatemux.ObjectMapperFactory;
import com.ciro.gatemux.connection.GatewayEndpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigRequestTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final GatewayEndpoint current = GatewayEndpoint.of("ws://old.test:1", "tok", "pw");

    @Test
    void absentFieldsKeepCurrentValues() throws Exception {
        GatewayEndpoint merged = GatewayConfigRequest.merge(current, mapper.readTree("{}"));
        assertEquals(current, merged);

        merged = GatewayConfigRequest.merge(current, mapper.readTree("{\"url\":\"\",\"token\":null}"));
        assertEquals(current, merged);
    }

    @Test
    void updatesUrlAndTokenButNeverPassword() throws Exception {
        GatewayEndpoint merged = GatewayConfigRequest.merge(current,
                mapper.readTree("{\"url\":\"wss://new.test/gw\",\"token\":\"t2\"}"));
        assertEquals("wss://new.test/gw", merged.url().toString());
        assertEquals("t2", merged.token());
        assertEquals("pw", merged.password());
    }

    @Test
    void stripsControlCharacters() throws Exception {
        GatewayEndpoint merged = GatewayConfigRequest.merge(current,
                mapper.readTree("{\"url\":\"ws://new.test\\u0000\\n\"}"));
        assertEquals("ws://new.test", merged.url().toString());
    }

    @Test
    void rejectsWrongTypesAndSchemes() throws Exception {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> GatewayConfigRequest.merge(current, mapper.readTree("{\"url\":1}")));
        assertEquals("url must be a string", e.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> GatewayConfigRequest.merge(current, mapper.readTree("{\"token\":true}")));
        assertThrows(IllegalArgumentException.class,
                () -> GatewayConfigRequest.merge(current, mapper.readTree("{\"url\":\"https://x.test\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> GatewayConfigRequest.merge(current, mapper.readTree("{\"url\":\"ws://" + "a".repeat(600) + "\"}")));
    }
}
