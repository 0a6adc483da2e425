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
package co.rsk.jsonrpc.http;

import co.rsk.jsonrpc.client.JsonRpcClient;
import co.rsk.jsonrpc.client.JsonRpcClientProperties;
import co.rsk.jsonrpc.config.JsonRpcClientConfigLoader;
import com.typesafe.config.Config;

/**
 * Creates JSON-RPC clients that talk HTTP.
 */
public final class HttpJsonRpcClientFactory {

    private HttpJsonRpcClientFactory() {
        throw new IllegalAccessError("Utility class");
    }

    /**
     * @return a client configured from system properties, the user config file and reference.conf
     */
    public static JsonRpcClient create() {
        return create(new JsonRpcClientConfigLoader().getConfig());
    }

    public static JsonRpcClient create(Config config) {
        return new JsonRpcClient(
                new OkHttpTransport(OkHttpTransportProperties.fromConfig(config)),
                JsonRpcClientProperties.fromConfig(config)
        );
    }

    public static JsonRpcClient create(String url) {
        return new JsonRpcClient(new OkHttpTransport(OkHttpTransportProperties.builder().url(url).build()));
    }
}
