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
package co.rsk.jsonrpc.client;

import co.rsk.jsonrpc.JsonRpcError;
import co.rsk.jsonrpc.JsonRpcRequestId;
import co.rsk.jsonrpc.JsonRpcSerializer;
import co.rsk.jsonrpc.client.exception.ParseResponseException;
import co.rsk.jsonrpc.client.exception.ReceivedErrorResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Objects;

import static co.rsk.jsonrpc.JsonRpcFieldNames.*;

/**
 * Reduces a raw JSON-RPC reply to its outcome.
 *
 * <ul>
 *     <li>no reply (null or empty text) gives null;</li>
 *     <li>a single response gives its {@code result} node, which is a {@code NullNode} for a null result;</li>
 *     <li>a batch is validated element by element and returned as the very same array;</li>
 *     <li>a single {@code error} response raises {@link ReceivedErrorResponseException}.</li>
 * </ul>
 */
public class JsonRpcResponseProcessor {

    private static final Logger logger = LoggerFactory.getLogger("jsonrpc.response");

    private final JsonRpcSerializer serializer;
    private final JsonRpcSchemaValidator validator;

    public JsonRpcResponseProcessor(JsonRpcSerializer serializer, JsonRpcSchemaValidator validator) {
        this.serializer = Objects.requireNonNull(serializer);
        this.validator = Objects.requireNonNull(validator);
    }

    /**
     * @throws ParseResponseException when the text is not valid JSON
     * @throws co.rsk.jsonrpc.client.exception.JsonRpcValidationException when validation is on and the reply is malformed
     * @throws ReceivedErrorResponseException when the reply is a single error response
     */
    @Nullable
    public JsonNode processResponse(@Nullable String response) {
        if (response != null) {
            logResponse(response);
        }

        if (response == null || response.isEmpty()) {
            return null;
        }

        JsonNode node;
        try {
            node = serializer.deserialize(response);
        } catch (JsonProcessingException e) {
            throw new ParseResponseException(response, e);
        }

        if (node.isMissingNode()) {
            throw new ParseResponseException(response, "no JSON content");
        }

        return process(node);
    }

    /**
     * Same as {@link #processResponse(String)} for a reply the transport already parsed.
     */
    @Nullable
    public JsonNode processResponse(@Nullable JsonNode response) {
        if (response == null || response.isMissingNode()) {
            return null;
        }

        logResponse(response.toString());
        return process(response);
    }

    private JsonNode process(JsonNode node) {
        validator.validate(node, JsonRpcSchema.RESPONSE);

        if (node.isArray()) {
            // batch callers correlate and unwrap the members themselves
            return node;
        }

        JsonNode error = node.get(ERROR);
        if (error != null) {
            throw new ReceivedErrorResponseException(toError(error), toRequestId(node.get(ID)));
        }

        return node.get(RESULT);
    }

    private static JsonRpcError toError(JsonNode error) {
        return new JsonRpcError(
                error.path(ERROR_CODE).asInt(),
                error.path(ERROR_MESSAGE).asText(""),
                error.get(ERROR_DATA)
        );
    }

    @Nullable
    private static JsonRpcRequestId toRequestId(@Nullable JsonNode id) {
        if (id == null) {
            return null;
        }

        if (id.isNull()) {
            return JsonRpcRequestId.NULL;
        }

        if (id.isTextual()) {
            return new JsonRpcRequestId(id.textValue());
        }

        if (id.isIntegralNumber()) {
            return id.canConvertToLong() ? new JsonRpcRequestId(id.longValue()) : new JsonRpcRequestId(id.bigIntegerValue());
        }

        return null;
    }

    private static void logResponse(String response) {
        logger.info(response);
    }
}
