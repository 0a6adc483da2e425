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

/**
 * Base class of every failure raised by the client core itself.
 * Transport failures are not wrapped; they reach the caller as the transport threw them.
 */
public class JsonRpcClientException extends RuntimeException {
    private static final long serialVersionUID = -2716356302387215461L;

    public JsonRpcClientException(String message) {
        super(message);
    }

    public JsonRpcClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
