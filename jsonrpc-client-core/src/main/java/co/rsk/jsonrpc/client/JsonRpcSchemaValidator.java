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

import co.rsk.jsonrpc.client.exception.JsonRpcValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

import static co.rsk.jsonrpc.JsonRpcFieldNames.*;

/**
 * Checks requests and responses against the JSON-RPC 2.0 object schema.
 *
 * A batch is a non-empty array whose elements are each checked on their own.
 * When validation is disabled every node passes through unchecked.
 */
public class JsonRpcSchemaValidator {

    private static final String VERSION = "2.0";

    private static final Set<String> REQUEST_MEMBERS = members(JSONRPC, METHOD, PARAMS, ID);
    private static final Set<String> RESPONSE_MEMBERS = members(JSONRPC, RESULT, ERROR, ID);
    private static final Set<String> ERROR_MEMBERS = members(ERROR_CODE, ERROR_MESSAGE, ERROR_DATA);

    private final boolean enabled;

    public JsonRpcSchemaValidator(JsonRpcClientProperties properties) {
        this(properties.isValidate());
    }

    public JsonRpcSchemaValidator(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return the given node, unchanged
     * @throws JsonRpcValidationException when the node doesn't conform to the schema
     */
    public JsonNode validate(JsonNode node, JsonRpcSchema schema) {
        if (!enabled) {
            return node;
        }

        if (node.isArray()) {
            if (node.size() == 0) {
                throw new JsonRpcValidationException(schema, "", "a batch should contain at least one element");
            }

            for (int i = 0; i < node.size(); i++) {
                validateObject(node.get(i), schema, "/" + i);
            }
        } else {
            validateObject(node, schema, "");
        }

        return node;
    }

    private static void validateObject(JsonNode node, JsonRpcSchema schema, String path) {
        if (!node.isObject()) {
            throw new JsonRpcValidationException(schema, path, "expected an object, but was " + node.getNodeType());
        }

        validateVersion(node, schema, path);

        if (schema == JsonRpcSchema.REQUEST) {
            validateRequest(node, path);
        } else {
            validateResponse(node, path);
        }
    }

    private static void validateVersion(JsonNode node, JsonRpcSchema schema, String path) {
        JsonNode version = node.get(JSONRPC);
        if (version == null) {
            throw new JsonRpcValidationException(schema, path, "missing required member '" + JSONRPC + "'");
        }

        if (!version.isTextual() || !VERSION.equals(version.textValue())) {
            throw new JsonRpcValidationException(schema, path + "/" + JSONRPC, "expected \"" + VERSION + "\", but was " + version);
        }
    }

    private static void validateRequest(JsonNode node, String path) {
        requireKnownMembers(node, REQUEST_MEMBERS, JsonRpcSchema.REQUEST, path);

        JsonNode method = node.get(METHOD);
        if (method == null || !method.isTextual()) {
            throw new JsonRpcValidationException(JsonRpcSchema.REQUEST, path + "/" + METHOD, "expected a string method name");
        }

        JsonNode params = node.get(PARAMS);
        if (params != null && !params.isArray() && !params.isObject()) {
            throw new JsonRpcValidationException(JsonRpcSchema.REQUEST, path + "/" + PARAMS, "expected an array or an object");
        }

        // a request without id is a notification
        JsonNode id = node.get(ID);
        if (id != null) {
            validateId(id, JsonRpcSchema.REQUEST, path);
        }
    }

    private static void validateResponse(JsonNode node, String path) {
        requireKnownMembers(node, RESPONSE_MEMBERS, JsonRpcSchema.RESPONSE, path);

        JsonNode id = node.get(ID);
        if (id == null) {
            throw new JsonRpcValidationException(JsonRpcSchema.RESPONSE, path, "missing required member '" + ID + "'");
        }
        validateId(id, JsonRpcSchema.RESPONSE, path);

        boolean hasResult = node.has(RESULT);
        boolean hasError = node.has(ERROR);
        if (hasResult == hasError) {
            throw new JsonRpcValidationException(
                    JsonRpcSchema.RESPONSE,
                    path,
                    hasResult ? "both 'result' and 'error' are present" : "either 'result' or 'error' is required"
            );
        }

        if (hasError) {
            validateError(node.get(ERROR), path + "/" + ERROR);
        }
    }

    private static void validateError(JsonNode error, String path) {
        if (!error.isObject()) {
            throw new JsonRpcValidationException(JsonRpcSchema.RESPONSE, path, "expected an error object, but was " + error.getNodeType());
        }

        requireKnownMembers(error, ERROR_MEMBERS, JsonRpcSchema.RESPONSE, path);

        JsonNode code = error.get(ERROR_CODE);
        if (code == null || !code.isIntegralNumber() || !code.canConvertToInt()) {
            throw new JsonRpcValidationException(JsonRpcSchema.RESPONSE, path + "/" + ERROR_CODE, "expected an integer error code");
        }

        JsonNode message = error.get(ERROR_MESSAGE);
        if (message == null || !message.isTextual()) {
            throw new JsonRpcValidationException(JsonRpcSchema.RESPONSE, path + "/" + ERROR_MESSAGE, "expected a string error message");
        }
    }

    private static void validateId(JsonNode id, JsonRpcSchema schema, String path) {
        if (!id.isIntegralNumber() && !id.isTextual() && !id.isNull()) {
            throw new JsonRpcValidationException(schema, path + "/" + ID, "expected an integer, a string or null, but was " + id.getNodeType());
        }
    }

    private static void requireKnownMembers(JsonNode node, Set<String> allowed, JsonRpcSchema schema, String path) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new JsonRpcValidationException(schema, path + "/" + name, "unexpected member");
            }
        }
    }

    private static Set<String> members(String... names) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
    }
}
