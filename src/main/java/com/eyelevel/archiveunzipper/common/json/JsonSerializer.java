package com.eyelevel.archiveunzipper.common.json;

/**
 * Writes objects as compact JSON text.
 */
public interface JsonSerializer {

    /**
     * @param object the value to write; its Jackson annotations decide the field names and order.
     * @return the JSON text.
     * @throws com.eyelevel.archiveunzipper.exception.json.JsonSerializationException if the value cannot be written.
     */
    <T> String serialize(T object);
}
