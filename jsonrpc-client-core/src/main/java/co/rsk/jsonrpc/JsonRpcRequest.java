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
 * A JSON-RPC call that expects a reply correlated by its id.
 */
public class JsonRpcRequest extends JsonRpcNotification {
    private final JsonRpcRequestId id;

    public JsonRpcRequest(String method, @Nullable JsonNode params, JsonRpcRequestId id) {
        super(method, params);
        this.id = Objects.requireNonNull(id);
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public JsonRpcRequestId getId() {
        return id;
    }
}
