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

import co.rsk.jsonrpc.client.JsonRpcTransport;
import com.squareup.okhttp.MediaType;
import com.squareup.okhttp.OkHttpClient;
import com.squareup.okhttp.Request;
import com.squareup.okhttp.RequestBody;
import com.squareup.okhttp.Response;
import com.squareup.okhttp.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sends JSON-RPC messages as HTTP POST bodies.
 *
 * The reply body is returned whatever the HTTP status, since servers commonly answer JSON-RPC
 * errors with a non-2xx status and a well-formed error object.
 */
public class OkHttpTransport implements JsonRpcTransport {

    private static final Logger logger = LoggerFactory.getLogger("jsonrpc");

    private final OkHttpClient httpClient;
    private final OkHttpTransportProperties properties;
    private final MediaType mediaType;

    public OkHttpTransport(OkHttpTransportProperties properties) {
        this(new OkHttpClient(), properties);
    }

    /**
     * Timeouts are applied to a clone of the given client, which shares its connection pool but not its settings.
     */
    public OkHttpTransport(OkHttpClient httpClient, OkHttpTransportProperties properties) {
        this.properties = Objects.requireNonNull(properties);
        this.httpClient = httpClient.clone();
        this.httpClient.setConnectTimeout(properties.getConnectTimeoutMillis(), TimeUnit.MILLISECONDS);
        this.httpClient.setReadTimeout(properties.getReadTimeoutMillis(), TimeUnit.MILLISECONDS);
        this.mediaType = MediaType.parse(properties.getContentType());
        if (this.mediaType == null) {
            throw new IllegalArgumentException(String.format("%s is not a valid content type", properties.getContentType()));
        }
    }

    @Override
    public String sendMessage(String request) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(properties.getUrl())
                .header("Accept", "application/json")
                .post(RequestBody.create(mediaType, request));
        for (Map.Entry<String, String> header : properties.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        Response response = httpClient.newCall(builder.build()).execute();
        if (!response.isSuccessful()) {
            logger.warn("JSON-RPC server {} answered with HTTP status {}", properties.getUrl(), response.code());
        }

        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    @Override
    public String toString() {
        return "OkHttpTransport[" + properties.getUrl() + "]";
    }
}
