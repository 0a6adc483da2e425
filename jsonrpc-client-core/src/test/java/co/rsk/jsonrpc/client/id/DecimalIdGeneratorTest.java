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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

class DecimalIdGeneratorTest {

    @AfterEach
    void tearDown() {
        DecimalIdGenerator.getDefault().reset();
    }

    @Test
    void generatesConsecutiveIdsFromOne() {
        DecimalIdGenerator generator = new DecimalIdGenerator();

        for (long expected = 1; expected <= 100; expected++) {
            JsonRpcRequestId id = generator.next();
            Assertions.assertTrue(id.isNumeric());
            assertThat(id.getValue(), is((Object) expected));
        }
    }

    @Test
    void startsFromSeed() {
        DecimalIdGenerator generator = new DecimalIdGenerator(40);

        assertThat(generator.next(), is(new JsonRpcRequestId(40)));
        assertThat(generator.next(), is(new JsonRpcRequestId(41)));
    }

    @Test
    void resetRestartsSequence() {
        DecimalIdGenerator generator = DecimalIdGenerator.getDefault();
        generator.next();
        generator.next();

        generator.reset();

        assertThat(generator.nextValue(), is(1L));

        generator.reset(10);

        assertThat(generator.nextValue(), is(10L));
    }

    @Test
    void negativeSeedIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new DecimalIdGenerator(-5));
    }

    @Test
    void concurrentCallersGetUniqueIds() throws InterruptedException {
        DecimalIdGenerator generator = new DecimalIdGenerator();
        Set<Object> ids = ConcurrentHashMap.newKeySet();
        int threads = 8;
        int perThread = 1000;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    ids.add(generator.next().getValue());
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        Assertions.assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertThat(ids.size(), is(threads * perThread));
        assertThat(generator.nextValue(), is((long) threads * perThread + 1));
    }

    @Test
    void sharedDefaultIsASingleInstance() {
        Set<DecimalIdGenerator> instances = new HashSet<>();
        instances.add(DecimalIdGenerator.getDefault());
        instances.add(DecimalIdGenerator.getDefault());

        assertThat(instances.size(), is(1));
    }
}
