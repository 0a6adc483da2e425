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
package co.rsk.jsonrpc.client.exception;

import co.rsk.jsonrpc.client.JsonRpcSchema;

/**
 * A request or response doesn't conform to the JSON-RPC 2.0 object schema.
 */
public class JsonRpcValidationException extends JsonRpcClientException {
    private static final long serialVersionUID = -5271063870291455722L;

    private final JsonRpcSchema schema;
    private final String path;

    public JsonRpcValidationException(JsonRpcSchema schema, String path, String reason) {
        super(String.format("Invalid JSON-RPC %s at '%s': %s", schema.getName(), path, reason));
        this.schema = schema;
        this.path = path;
    }

    public JsonRpcSchema getSchema() {
        return schema;
    }

    /**
     * @return the JSON pointer of the offending member, empty for the root
     */
    public String getPath() {
        return path;
    }
}
