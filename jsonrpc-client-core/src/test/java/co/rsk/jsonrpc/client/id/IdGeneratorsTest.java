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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

class IdGeneratorsTest {

    @Test
    void hexadecimalIdsCountInHex() {
        IdGenerator generator = new HexadecimalIdGenerator(9);

        assertThat(generator.next(), is(new JsonRpcRequestId("9")));
        assertThat(generator.next(), is(new JsonRpcRequestId("a")));
        assertThat(generator.next(), is(new JsonRpcRequestId("b")));
    }

    @Test
    void randomIdsUseLowercaseAlphabet() {
        IdGenerator generator = new RandomIdGenerator(new Random(42));

        for (int i = 0; i < 50; i++) {
            String id = (String) generator.next().getValue();
            assertThat(id.length(), is(RandomIdGenerator.LENGTH));
            Assertions.assertTrue(id.matches("[a-z0-9]+"), id);
        }
    }

    @Test
    void uuidIdsAreParseable() {
        String id = (String) new UuidIdGenerator().next().getValue();

        assertThat(UUID.fromString(id).toString(), is(id));
    }

    @Test
    void resolvesGeneratorsByName() {
        assertThat(IdGenerators.fromName("decimal", 1), is(sameInstance(DecimalIdGenerator.getDefault())));
        assertThat(IdGenerators.fromName("DECIMAL", 5), is(not(sameInstance(DecimalIdGenerator.getDefault()))));
        assertThat(IdGenerators.fromName("hexadecimal", 1), instanceOf(HexadecimalIdGenerator.class));
        assertThat(IdGenerators.fromName("random", 1), instanceOf(RandomIdGenerator.class));
        assertThat(IdGenerators.fromName("uuid", 1), instanceOf(UuidIdGenerator.class));
    }

    @Test
    void seededDecimalGeneratorStartsAtSeed() {
        IdGenerator generator = IdGenerators.fromName("decimal", 100);

        assertThat(generator.next(), is(new JsonRpcRequestId(100)));
    }

    @Test
    void unknownNameIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> IdGenerators.fromName("sequential", 1));
    }
}
