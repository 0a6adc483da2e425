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
package co.rsk.jsonrpc.client.id;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Resolves id generators by the names used in configuration files.
 */
public final class IdGenerators {

    private static final Logger logger = LoggerFactory.getLogger("jsonrpc");

    public static final String DECIMAL = "decimal";
    public static final String HEXADECIMAL = "hexadecimal";
    public static final String RANDOM = "random";
    public static final String UUID = "uuid";

    private IdGenerators() {
        throw new IllegalAccessError("Utility class");
    }

    /**
     * The seed only applies to the counting generators. A decimal generator seeded at the
     * default value is the shared process-wide instance.
     */
    public static IdGenerator fromName(String name, long seed) {
        logger.debug("Using {} request ids starting at {}", name, seed);

        switch (name.toLowerCase(Locale.ROOT)) {
            case DECIMAL:
                return seed == DecimalIdGenerator.DEFAULT_SEED ? DecimalIdGenerator.getDefault() : new DecimalIdGenerator(seed);
            case HEXADECIMAL:
                return new HexadecimalIdGenerator(seed);
            case RANDOM:
                return new RandomIdGenerator();
            case UUID:
                return new UuidIdGenerator();
            default:
                String message = String.format("%s is not a valid id generator name", name);
                logger.warn(message);
                throw new IllegalArgumentException(message);
        }
    }
}
