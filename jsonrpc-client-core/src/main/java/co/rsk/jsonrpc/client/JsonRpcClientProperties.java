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

import co.rsk.jsonrpc.client.id.DecimalIdGenerator;
import co.rsk.jsonrpc.client.id.IdGenerator;
import co.rsk.jsonrpc.client.id.IdGenerators;
import co.rsk.jsonrpc.config.JsonRpcConfigurationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.Objects;

public class JsonRpcClientProperties {
    public static final String PROPERTY_VALIDATE = "jsonrpc.client.validate";
    public static final String PROPERTY_ID_GENERATOR = "jsonrpc.client.id.generator";
    public static final String PROPERTY_ID_START = "jsonrpc.client.id.start";

    private boolean validate;
    private IdGenerator idGenerator;

    //Default values
    private JsonRpcClientProperties() {
        this.validate = true;
        this.idGenerator = DecimalIdGenerator.getDefault();
    }

    public boolean isValidate() {
        return validate;
    }

    public IdGenerator getIdGenerator() {
        return idGenerator;
    }

    /**
     * Reads the client settings from a config that already has reference.conf as fallback.
     *
     * @throws JsonRpcConfigurationException on missing or ill-typed settings
     */
    public static JsonRpcClientProperties fromConfig(Config config) {
        try {
            return builder()
                    .validate(config.getBoolean(PROPERTY_VALIDATE))
                    .idGenerator(IdGenerators.fromName(
                            config.getString(PROPERTY_ID_GENERATOR),
                            config.getLong(PROPERTY_ID_START)
                    ))
                    .build();
        } catch (ConfigException | IllegalArgumentException e) {
            throw new JsonRpcConfigurationException("Invalid JSON-RPC client configuration: " + e.getMessage(), e);
        }
    }

    public static JsonRpcClientPropertiesBuilder builder() {
        return new JsonRpcClientPropertiesBuilder();
    }

    //Builder pattern
    public static class JsonRpcClientPropertiesBuilder {
        private Boolean validate;
        private IdGenerator idGenerator;

        public JsonRpcClientPropertiesBuilder() {
        }

        public JsonRpcClientProperties build() {
            JsonRpcClientProperties properties = new JsonRpcClientProperties();
            if (validate != null) {
                properties.validate = validate;
            }
            if (idGenerator != null) {
                properties.idGenerator = idGenerator;
            }
            return properties;
        }

        public JsonRpcClientPropertiesBuilder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public JsonRpcClientPropertiesBuilder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator);
            return this;
        }
    }
}
