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
 * The reply text is not valid JSON. The underlying parser failure, if any, is the cause.
 */
public class ParseResponseException extends JsonRpcClientException {
    private static final long serialVersionUID = 4180962458932640143L;

    private final String response;

    public ParseResponseException(String response, Throwable cause) {
        super("Failed to parse JSON-RPC response: " + cause.getMessage(), cause);
        this.response = response;
    }

    public ParseResponseException(String response, String reason) {
        super("Failed to parse JSON-RPC response: " + reason);
        this.response = response;
    }

    /**
     * @return the raw text that couldn't be parsed
     */
    public String getResponse() {
        return response;
    }
}
