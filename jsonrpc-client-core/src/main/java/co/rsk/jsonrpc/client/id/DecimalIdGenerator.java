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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing integer ids, starting from a seed, with no gaps and no reuse.
 *
 * The counter is atomic, so ids stay unique when several threads share a generator.
 * Uniqueness only holds within the lifetime of the generator, not across processes.
 */
public class DecimalIdGenerator implements IdGenerator {

    public static final long DEFAULT_SEED = 1;

    private static final DecimalIdGenerator DEFAULT = new DecimalIdGenerator();

    private final AtomicLong counter;

    public DecimalIdGenerator() {
        this(DEFAULT_SEED);
    }

    public DecimalIdGenerator(long seed) {
        this.counter = new AtomicLong(requireNonNegative(seed));
    }

    /**
     * @return the process-wide generator used by clients that aren't given one
     */
    public static DecimalIdGenerator getDefault() {
        return DEFAULT;
    }

    @Override
    public JsonRpcRequestId next() {
        return new JsonRpcRequestId(nextValue());
    }

    public long nextValue() {
        return counter.getAndIncrement();
    }

    public void reset() {
        reset(DEFAULT_SEED);
    }

    /**
     * Restarts the sequence. Ids handed out before the reset may be handed out again.
     */
    public void reset(long seed) {
        counter.set(requireNonNegative(seed));
    }

    private static long requireNonNegative(long seed) {
        if (seed < 0) {
            throw new IllegalArgumentException(String.format("Id seed should be a positive number, but was %d.", seed));
        }

        return seed;
    }
}
