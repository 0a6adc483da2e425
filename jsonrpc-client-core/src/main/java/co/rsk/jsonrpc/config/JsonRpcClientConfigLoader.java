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
package co.rsk.jsonrpc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Objects;

/**
 * Class that encapsulates config loading strategy.
 */
public class JsonRpcClientConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger("config");

    public static final String CONFIG_FILE_PROPERTY = "jsonrpc.conf.file";

    private static final String YES = "yes";
    private static final String NO = "no";

    private final ConfigFactoryWrapper configFactory;

    public JsonRpcClientConfigLoader() {
        this(ConfigFactoryWrapper.getInstance());
    }

    public JsonRpcClientConfigLoader(ConfigFactoryWrapper configFactory) {
        this.configFactory = Objects.requireNonNull(configFactory);
    }

    /**
     * Loads configurations from different sources with the following precedence:
     * 1. System properties
     * 2. User configuration file, named by the jsonrpc.conf.file system property
     * 3. Default settings in every reference.conf on the classpath
     *
     * @throws JsonRpcConfigurationException when the user configuration file can't be parsed
     */
    public Config getConfig() {
        Config systemPropsConfig = configFactory.systemProperties();
        Config userCustomConfig = getUserCustomConfig(systemPropsConfig);
        Config referenceConfig = configFactory.defaultReference();

        return configFactory.empty()
                .withFallback(systemPropsConfig)
                .withFallback(userCustomConfig)
                .withFallback(referenceConfig)
                .resolve();
    }

    private Config getUserCustomConfig(Config systemPropsConfig) {
        String file = systemPropsConfig.hasPath(CONFIG_FILE_PROPERTY) ? systemPropsConfig.getString(CONFIG_FILE_PROPERTY) : null;
        Config userConfig;
        try {
            userConfig = file != null ? configFactory.parseFile(new File(file)) : configFactory.empty();
        } catch (ConfigException e) {
            throw new JsonRpcConfigurationException(String.format("Cannot read client config file '%s'", file), e);
        }

        logger.info(
                "Config ( {} ): user properties from -D{} file '{}'",
                userConfig.entrySet().isEmpty() ? NO : YES,
                CONFIG_FILE_PROPERTY,
                file
        );
        return userConfig;
    }
}
