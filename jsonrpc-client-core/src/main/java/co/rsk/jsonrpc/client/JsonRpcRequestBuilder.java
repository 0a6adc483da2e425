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

import co.rsk.jsonrpc.JsonRpcNotification;
import co.rsk.jsonrpc.JsonRpcRequest;
import co.rsk.jsonrpc.JsonRpcRequestId;
import co.rsk.jsonrpc.client.exception.InvalidParamsUsageException;
import co.rsk.jsonrpc.client.id.IdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds JSON-RPC requests and notifications ready for serialization.
 *
 * Positional and named params are mutually exclusive. Giving both is rejected before
 * an id is allocated; giving neither leaves the {@code params} member out.
 */
public class JsonRpcRequestBuilder {
    private final IdGenerator idGenerator;
    private final ObjectMapper mapper;

    public JsonRpcRequestBuilder(IdGenerator idGenerator, ObjectMapper mapper) {
        this.idGenerator = Objects.requireNonNull(idGenerator);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public JsonRpcRequest buildRequest(String method, @Nullable List<?> args, @Nullable Map<String, ?> kwargs) {
        JsonNode params = toParams(method, args, kwargs);
        return new JsonRpcRequest(method, params, idGenerator.next());
    }

    /**
     * Builds a request with a caller-chosen id. The id generator is not touched.
     */
    public JsonRpcRequest buildRequest(String method, JsonRpcRequestId id, @Nullable List<?> args, @Nullable Map<String, ?> kwargs) {
        return new JsonRpcRequest(method, toParams(method, args, kwargs), id);
    }

    public JsonRpcNotification buildNotification(String method, @Nullable List<?> args, @Nullable Map<String, ?> kwargs) {
        return new JsonRpcNotification(method, toParams(method, args, kwargs));
    }

    @Nullable
    private JsonNode toParams(String method, @Nullable List<?> args, @Nullable Map<String, ?> kwargs) {
        boolean positional = args != null && !args.isEmpty();
        boolean named = kwargs != null && !kwargs.isEmpty();

        if (positional && named) {
            throw new InvalidParamsUsageException(method);
        }

        if (positional) {
            return mapper.valueToTree(args);
        }

        if (named) {
            return mapper.valueToTree(kwargs);
        }

        return null;
    }
}
