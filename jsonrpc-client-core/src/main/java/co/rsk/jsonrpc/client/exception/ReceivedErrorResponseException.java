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

import co.rsk.jsonrpc.JsonRpcError;
import co.rsk.jsonrpc.JsonRpcRequestId;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The remote peer answered with a well-formed {@code error} object.
 *
 * This is an expected outcome rather than a bug signal: callers catch it and branch on {@link #getCode()}.
 */
public class ReceivedErrorResponseException extends JsonRpcClientException {
    private static final long serialVersionUID = 1493862157405621963L;

    private final transient JsonRpcError error;
    private final transient JsonRpcRequestId id;

    public ReceivedErrorResponseException(JsonRpcError error, @Nullable JsonRpcRequestId id) {
        super(error.toString());
        this.error = Objects.requireNonNull(error);
        this.id = id;
    }

    public JsonRpcError getError() {
        return error;
    }

    public int getCode() {
        return error.getCode();
    }

    /**
     * @return the message member of the error object, which is also this exception's message prefix
     */
    public String getErrorMessage() {
        return error.getMessage();
    }

    /**
     * @return the opaque data member, or null when the error object has none
     */
    @Nullable
    public JsonNode getData() {
        return error.getData();
    }

    /**
     * @return the id of the failed response, or null when validation was off and the member was missing or not an integer, string or null
     */
    @Nullable
    public JsonRpcRequestId getId() {
        return id;
    }
}
