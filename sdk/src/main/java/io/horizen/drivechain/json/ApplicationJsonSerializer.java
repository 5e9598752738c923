package io.horizen.drivechain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.horizen.drivechain.serialization.Views;

public class ApplicationJsonSerializer {

    private final Class<?> defaultView;
    private final ObjectMapper objectMapper;
    private static ApplicationJsonSerializer instance;

    private ApplicationJsonSerializer() {
        objectMapper = new ObjectMapper();
        defaultView = Views.Default.class;
    }

    public static synchronized ApplicationJsonSerializer getInstance() {
        if (instance == null) {
            instance = new ApplicationJsonSerializer();
            instance.setDefaultConfiguration();
        }

        return instance;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private void setDefaultConfiguration() {
        objectMapper.disable(MapperFeature.DEFAULT_VIEW_INCLUSION);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
        SimpleModule module = new SimpleModule();
        module.addSerializer(byte[].class, new BytesSerializer());
        objectMapper.registerModule(module);
    }

    public String serialize(Object value) throws JsonProcessingException {
        return objectMapper.writerWithView(defaultView).writeValueAsString(value);
    }
}
