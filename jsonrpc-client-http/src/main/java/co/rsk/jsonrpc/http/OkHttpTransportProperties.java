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

import co.rsk.jsonrpc.config.JsonRpcConfigurationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public class OkHttpTransportProperties {
    public static final String PROPERTY_URL = "jsonrpc.client.http.url";
    public static final String PROPERTY_CONNECT_TIMEOUT = "jsonrpc.client.http.connectTimeout";
    public static final String PROPERTY_READ_TIMEOUT = "jsonrpc.client.http.readTimeout";
    public static final String PROPERTY_CONTENT_TYPE = "jsonrpc.client.http.contentType";
    public static final String PROPERTY_HEADERS = "jsonrpc.client.http.headers";

    private String url;
    private long connectTimeoutMillis;
    private long readTimeoutMillis;
    private String contentType;
    private Map<String, String> headers;

    //Default values
    private OkHttpTransportProperties() {
        this.connectTimeoutMillis = 10_000;
        this.readTimeoutMillis = 30_000;
        this.contentType = "application/json";
        this.headers = Collections.emptyMap();
    }

    public String getUrl() {
        return url;
    }

    public long getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public long getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public String getContentType() {
        return contentType;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @throws JsonRpcConfigurationException on missing or ill-typed settings
     */
    public static OkHttpTransportProperties fromConfig(Config config) {
        try {
            Map<String, String> headers = new LinkedHashMap<>();
            for (Map.Entry<String, ConfigValue> header : config.getObject(PROPERTY_HEADERS).entrySet()) {
                headers.put(header.getKey(), String.valueOf(header.getValue().unwrapped()));
            }

            return builder()
                    .url(config.getString(PROPERTY_URL))
                    .connectTimeoutMillis(config.getDuration(PROPERTY_CONNECT_TIMEOUT, TimeUnit.MILLISECONDS))
                    .readTimeoutMillis(config.getDuration(PROPERTY_READ_TIMEOUT, TimeUnit.MILLISECONDS))
                    .contentType(config.getString(PROPERTY_CONTENT_TYPE))
                    .headers(headers)
                    .build();
        } catch (ConfigException | IllegalArgumentException e) {
            throw new JsonRpcConfigurationException("Invalid JSON-RPC HTTP configuration: " + e.getMessage(), e);
        }
    }

    public static OkHttpTransportPropertiesBuilder builder() {
        return new OkHttpTransportPropertiesBuilder();
    }

    //Builder pattern
    public static class OkHttpTransportPropertiesBuilder {
        private String url;
        private Long connectTimeoutMillis;
        private Long readTimeoutMillis;
        private String contentType;
        private Map<String, String> headers;

        public OkHttpTransportPropertiesBuilder() {
        }

        public OkHttpTransportProperties build() {
            if (url == null || url.isEmpty()) {
                throw new IllegalArgumentException("JSON-RPC server url is required");
            }

            OkHttpTransportProperties properties = new OkHttpTransportProperties();
            properties.url = url;
            if (connectTimeoutMillis != null) {
                properties.connectTimeoutMillis = connectTimeoutMillis;
            }
            if (readTimeoutMillis != null) {
                properties.readTimeoutMillis = readTimeoutMillis;
            }
            if (contentType != null) {
                properties.contentType = contentType;
            }
            if (headers != null) {
                properties.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
            }
            return properties;
        }

        public OkHttpTransportPropertiesBuilder url(String url) {
            this.url = Objects.requireNonNull(url);
            return this;
        }

        public OkHttpTransportPropertiesBuilder connectTimeoutMillis(long connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        public OkHttpTransportPropertiesBuilder readTimeoutMillis(long readTimeoutMillis) {
            this.readTimeoutMillis = readTimeoutMillis;
            return this;
        }

        public OkHttpTransportPropertiesBuilder contentType(String contentType) {
            this.contentType = Objects.requireNonNull(contentType);
            return this;
        }

        public OkHttpTransportPropertiesBuilder headers(Map<String, String> headers) {
            this.headers = Objects.requireNonNull(headers);
            return this;
        }
    }
}
