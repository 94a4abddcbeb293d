package com.eyelevel.archiveunzipper.common.json.jackson;

import com.eyelevel.archiveunzipper.common.json.JsonSerializer;
import com.eyelevel.archiveunzipper.exception.json.JsonSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link JsonSerializer} backed by the application's shared {@link ObjectMapper}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        try {
            String json = objectMapper.writeValueAsString(object);
            log.trace("Serialized {}: {}", object.getClass().getSimpleName(), json);
            return json;
        } catch (JsonProcessingException e) {
            throw new JsonSerializationException(
                    "Could not write " + object.getClass().getSimpleName() + " as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
