package com.eyelevel.documentindexer.common.json;

/**
 * Reads provider responses into typed objects without tying callers to a JSON library.
 */
public interface JsonParser {

    /**
     * @throws com.eyelevel.documentindexer.exception.json.JsonParsingException if the text is not valid
     *                                                                           JSON for {@code valueType}.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * @throws com.eyelevel.documentindexer.exception.json.JsonParsingException if the bytes are not valid
     *                                                                           JSON for {@code valueType}.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
