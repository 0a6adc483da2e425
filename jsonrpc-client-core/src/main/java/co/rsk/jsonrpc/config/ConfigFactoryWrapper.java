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
import com.typesafe.config.ConfigFactory;

import java.io.File;

public class ConfigFactoryWrapper {

    private static ConfigFactoryWrapper instance;

    public static synchronized ConfigFactoryWrapper getInstance() {
        if (instance == null) {
            instance = new ConfigFactoryWrapper();
        }

        return instance;
    }

    public Config systemProperties() {
        return ConfigFactory.systemProperties();
    }

    public Config empty() {
        return ConfigFactory.empty();
    }

    public Config parseFile(File file) {
        return ConfigFactory.parseFile(file);
    }

    public Config defaultReference() {
        return ConfigFactory.defaultReference();
    }
}
