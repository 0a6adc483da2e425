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
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Basic JSON-RPC serialization methods.
 */
public interface JsonRpcSerializer {
    /**
     * @return a JsonRpcMessage serialized into a JSON string
     * @throws JsonProcessingException when serialization fails
     */
    String serializeMessage(JsonRpcMessage message) throws JsonProcessingException;

    /**
     * @param os the destination of the JsonRpcMessage serialized into a JSON string as bytes
     * @throws IOException when serialization fails
     */
    void serializeMessage(OutputStream os, JsonRpcMessage message) throws IOException;

    /**
     * @return the messages serialized, in order, into a JSON array string
     * @throws JsonProcessingException when serialization fails
     */
    String serializeBatch(List<? extends JsonRpcMessage> messages) throws JsonProcessingException;

    /**
     * @return the message as a JSON tree, in the shape it will take on the wire
     */
    JsonNode toTree(JsonRpcMessage message);

    /**
     * @return the JSON tree read from the given text
     * @throws JsonProcessingException when the text is not valid JSON
     */
    JsonNode deserialize(String content) throws JsonProcessingException;
}
