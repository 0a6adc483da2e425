/*
 * This file is part of RskJ
 * Copyright (C) 2018 RSK Labs Ltd.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package co.rsk.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * This implements basic JSON-RPC serialization using Jackson.
 */
public class JacksonBasedRpcSerializer implements JsonRpcSerializer {
    //From https://fasterxml.github.io/jackson-databind/javadoc/2.5/com/fasterxml/jackson/databind/ObjectMapper.html
    // ObjectMapper is thread-safe as long as the config methods are not called after the serialiation begins.
    private final ObjectMapper mapper;

    public JacksonBasedRpcSerializer() {
        this(new ObjectMapper());
    }

    /**
     * Uses a copy of the given mapper, so the caller's instance keeps its configuration.
     */
    public JacksonBasedRpcSerializer(ObjectMapper mapper) {
        // a reply carrying trailing garbage after the JSON value is not valid JSON
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String serializeMessage(JsonRpcMessage message) throws JsonProcessingException {
        return mapper.writeValueAsString(message);
    }

    @Override
    public void serializeMessage(OutputStream os, JsonRpcMessage message) throws IOException {
        mapper.writeValue(os, message);
    }

    @Override
    public String serializeBatch(List<? extends JsonRpcMessage> messages) throws JsonProcessingException {
        return mapper.writeValueAsString(messages);
    }

    @Override
    public JsonNode toTree(JsonRpcMessage message) {
        return mapper.valueToTree(message);
    }

    @Override
    public JsonNode deserialize(String content) throws JsonProcessingException {
        return mapper.readTree(content);
    }
}
