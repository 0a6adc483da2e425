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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The standard JSON-RPC error object for responses.
 *
 * The optional {@code data} member is kept as an opaque JSON value. A missing member is null,
 * while an explicit JSON null is a {@link com.fasterxml.jackson.databind.node.NullNode}.
 */
public class JsonRpcError {

	// Error codes as defined in https://www.jsonrpc.org/specification#error_object
	public static final int PARSE_ERROR = -32700;
	public static final int INVALID_REQUEST = -32600;
	public static final int METHOD_NOT_FOUND = -32601;
	public static final int INVALID_PARAMS = -32602;
	public static final int INTERNAL_ERROR = -32603;
	public static final int SERVER_ERROR_MIN = -32099;
	public static final int SERVER_ERROR_MAX = -32000;

	private final int code;
	private final String message;
	private final JsonNode data;

	public JsonRpcError(int code, String message) {
		this(code, message, null);
	}

	public JsonRpcError(int code, String message, @Nullable JsonNode data) {
		this.code = code;
		this.message = Objects.requireNonNull(message);
		this.data = data;
	}

	public int getCode() {
		return code;
	}

	public String getMessage() {
		return message;
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@Nullable
	public JsonNode getData() {
		return data;
	}

	public boolean hasData() {
		return data != null;
	}

	/**
	 * @return true for the -32099..-32000 range reserved for implementation-defined server errors
	 */
	@JsonIgnore
	public boolean isServerError() {
		return code >= SERVER_ERROR_MIN && code <= SERVER_ERROR_MAX;
	}

	@Override
	public String toString() {
		return data == null
				? String.format("%d: %s", code, message)
				: String.format("%d: %s (%s)", code, message, data);
	}
}
