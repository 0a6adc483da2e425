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

import co.rsk.jsonrpc.JacksonBasedRpcSerializer;
import co.rsk.jsonrpc.JsonRpcMessage;
import co.rsk.jsonrpc.JsonRpcNotification;
import co.rsk.jsonrpc.JsonRpcRequest;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON-RPC 2.0 client over an injected {@link JsonRpcTransport}.
 *
 * Every call is synchronous: the request is built, validated, logged and handed to the transport,
 * and the raw reply is logged and reduced by the {@link JsonRpcResponseProcessor} before returning.
 * Transport {@link IOException}s reach the caller untouched.
 */
public class JsonRpcClient {

    private static final Logger logger = LoggerFactory.getLogger("jsonrpc.request");

    private final JsonRpcTransport transport;
    private final JacksonBasedRpcSerializer serializer;
    private final JsonRpcSchemaValidator validator;
    private final JsonRpcRequestBuilder requestBuilder;
    private final JsonRpcResponseProcessor responseProcessor;

    public JsonRpcClient(JsonRpcTransport transport) {
        this(transport, JsonRpcClientProperties.builder().build());
    }

    public JsonRpcClient(JsonRpcTransport transport, JsonRpcClientProperties properties) {
        this(transport, properties, new JacksonBasedRpcSerializer());
    }

    public JsonRpcClient(JsonRpcTransport transport, JsonRpcClientProperties properties, JacksonBasedRpcSerializer serializer) {
        this.transport = Objects.requireNonNull(transport);
        this.serializer = Objects.requireNonNull(serializer);
        this.validator = new JsonRpcSchemaValidator(properties);
        this.requestBuilder = new JsonRpcRequestBuilder(properties.getIdGenerator(), serializer.getMapper());
        this.responseProcessor = new JsonRpcResponseProcessor(serializer, validator);
    }

    /**
     * Calls a method with positional params.
     *
     * @return the result node, a NullNode for a null result, or null when the transport returned nothing
     */
    @Nullable
    public JsonNode request(String method, Object... params) throws IOException {
        return send(requestBuilder.buildRequest(method, Arrays.asList(params), null));
    }

    @Nullable
    public JsonNode requestNamed(String method, Map<String, ?> params) throws IOException {
        return send(requestBuilder.buildRequest(method, null, params));
    }

    /**
     * Sends a notification: same as {@link #request(String, Object...)} without an id.
     * Whatever the transport returns is still processed, so an error reply still raises.
     */
    @Nullable
    public JsonNode notify(String method, Object... params) throws IOException {
        return send(requestBuilder.buildNotification(method, Arrays.asList(params), null));
    }

    @Nullable
    public JsonNode notifyNamed(String method, Map<String, ?> params) throws IOException {
        return send(requestBuilder.buildNotification(method, null, params));
    }

    /**
     * Calls a method and converts its result to the given type.
     */
    @Nullable
    public <T> T call(Class<T> resultType, String method, Object... params) throws IOException {
        return convertResult(request(method, params), resultType);
    }

    /**
     * Sends a request or notification built elsewhere, e.g. with a caller-chosen id.
     */
    @Nullable
    public JsonNode send(JsonRpcMessage message) throws IOException {
        validator.validate(serializer.toTree(message), JsonRpcSchema.REQUEST);
        return send(serializer.serializeMessage(message));
    }

    /**
     * Sends several requests and notifications in one batch.
     *
     * @return the batch response array, unchanged, for the caller to correlate by id
     */
    @Nullable
    public JsonNode send(List<? extends JsonRpcNotification> batch) throws IOException {
        ArrayNode tree = serializer.getMapper().createArrayNode();
        for (JsonRpcNotification message : batch) {
            tree.add(serializer.toTree(message));
        }
        validator.validate(tree, JsonRpcSchema.REQUEST);

        return send(serializer.serializeBatch(batch));
    }

    /**
     * Sends an already serialized message as is.
     */
    @Nullable
    public JsonNode send(String request) throws IOException {
        logRequest(request);
        String response = transport.sendMessage(request);
        return processResponse(response);
    }

    @Nullable
    public JsonNode processResponse(@Nullable String response) {
        return responseProcessor.processResponse(response);
    }

    @Nullable
    public JsonNode processResponse(@Nullable JsonNode response) {
        return responseProcessor.processResponse(response);
    }

    /**
     * Creates an implementation of the given interface whose methods are sent as JSON-RPC calls.
     *
     * @see JsonRpcClientProxy
     */
    @SuppressWarnings("unchecked")
    public <T> T createProxy(Class<T> api) {
        if (!api.isInterface()) {
            throw new IllegalArgumentException(String.format("%s is not an interface", api.getName()));
        }

        return (T) Proxy.newProxyInstance(api.getClassLoader(), new Class<?>[]{api}, new JsonRpcClientProxy(this));
    }

    public JsonRpcRequestBuilder getRequestBuilder() {
        return requestBuilder;
    }

    public JsonRpcTransport getTransport() {
        return transport;
    }

    public JsonRpcRequest buildRequest(String method, Object... params) {
        return requestBuilder.buildRequest(method, Arrays.asList(params), Collections.emptyMap());
    }

    public JsonRpcNotification buildNotification(String method, Object... params) {
        return requestBuilder.buildNotification(method, Arrays.asList(params), Collections.emptyMap());
    }

    @Nullable
    <T> T convertResult(@Nullable JsonNode result, Type resultType) throws IOException {
        if (result == null) {
            return null;
        }

        ObjectMapper mapper = serializer.getMapper();
        JavaType type = mapper.getTypeFactory().constructType(resultType);
        return mapper.readerFor(type).readValue(result);
    }

    private static void logRequest(String request) {
        logger.info(request);
    }
}
