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

import co.rsk.jsonrpc.JsonRpcRequestId;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Random string ids of eight lowercase letters and digits.
 * Collisions are unlikely but possible; use {@link DecimalIdGenerator} where uniqueness matters.
 */
public class RandomIdGenerator implements IdGenerator {

    static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    static final int LENGTH = 8;

    private final Random random;

    public RandomIdGenerator() {
        this(new SecureRandom());
    }

    public RandomIdGenerator(Random random) {
        this.random = random;
    }

    @Override
    public JsonRpcRequestId next() {
        char[] id = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            id[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }

        return new JsonRpcRequestId(new String(id));
    }
}
