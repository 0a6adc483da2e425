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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A JSON-RPC call that doesn't expect a correlated reply.
 *
 * Notifications never carry an id: the member is left out of the serialized form,
 * since an explicit {@code "id": null} is a valid request id on its own.
 */
public class JsonRpcNotification extends JsonRpcMessage {
    private final String method;
    private final JsonNode params;

    public JsonRpcNotification(String method, @Nullable JsonNode params) {
        super(JsonRpcVersion.V2_0);
        this.method = Objects.requireNonNull(method);
        this.params = requireStructured(params);
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return the params as a JSON array (positional) or object (named), or null when the call has none
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Nullable
    public JsonNode getParams() {
        return params;
    }

    private static JsonNode requireStructured(@Nullable JsonNode params) {
        if (params != null && !params.isArray() && !params.isObject()) {
            throw new IllegalArgumentException(
                    String.format("JSON-RPC params should be an array or an object, but was %s.", params.getNodeType())
            );
        }

        return params;
    }
}
