package org.adseller.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.json.ObjectMapperProvider;

public abstract class VertxTest {

    protected static ObjectMapper mapper;
    protected static JacksonMapper jacksonMapper;

    static {
        mapper = ObjectMapperProvider.mapper();
        jacksonMapper = new JacksonMapper(mapper);
    }
}
