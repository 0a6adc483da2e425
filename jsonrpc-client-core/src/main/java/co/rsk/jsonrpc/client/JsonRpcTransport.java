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

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Moves serialized requests to a JSON-RPC server and brings the raw reply back.
 *
 * Implementations own every wire concern: framing, timeouts, cancellation. The client doesn't
 * catch what they throw.
 */
@FunctionalInterface
public interface JsonRpcTransport {
    /**
     * @param request the serialized request, notification or batch
     * @return the raw reply text, or null/empty when the transport got no body
     * @throws IOException when the message couldn't be delivered or the reply couldn't be read
     */
    @Nullable
    String sendMessage(String request) throws IOException;
}
