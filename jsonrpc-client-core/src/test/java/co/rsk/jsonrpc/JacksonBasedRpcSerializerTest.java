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
package co.rsk.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

class JacksonBasedRpcSerializerTest {

    private static final JsonNodeFactory JSON_NODE_FACTORY = JsonNodeFactory.instance;

    private JacksonBasedRpcSerializer serializer;

    @BeforeEach
    void init() {
        serializer = new JacksonBasedRpcSerializer();
    }

    @Test
    void serializeRequestWithPositionalParams() throws IOException {
        JsonRpcRequest request = new JsonRpcRequest(
                "eth_getBalance",
                JSON_NODE_FACTORY.arrayNode().add("0x01").add("latest"),
                new JsonRpcRequestId(7)
        );

        assertThat(
                serializer.serializeMessage(request),
                is("{\"jsonrpc\":\"2.0\",\"method\":\"eth_getBalance\",\"params\":[\"0x01\",\"latest\"],\"id\":7}")
        );
    }

    @Test
    void serializeRequestWithStringId() throws IOException {
        JsonRpcRequest request = new JsonRpcRequest("ping", null, new JsonRpcRequestId("abc"));

        assertThat(serializer.serializeMessage(request), is("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":\"abc\"}"));
    }

    @Test
    void serializeRequestWithNullIdKeepsTheMember() throws IOException {
        JsonRpcRequest request = new JsonRpcRequest("ping", null, JsonRpcRequestId.NULL);

        assertThat(serializer.serializeMessage(request), is("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":null}"));
    }

    @Test
    void serializeNotificationWithoutId() throws IOException {
        JsonRpcNotification notification = new JsonRpcNotification(
                "update",
                JSON_NODE_FACTORY.objectNode().put("value", 42)
        );

        String message = serializer.serializeMessage(notification);

        assertThat(message, is("{\"jsonrpc\":\"2.0\",\"method\":\"update\",\"params\":{\"value\":42}}"));
        Assertions.assertFalse(serializer.deserialize(message).has("id"));
    }

    @Test
    void serializeMessageToStream() throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream();

        serializer.serializeMessage(os, new JsonRpcNotification("ping", null));

        assertThat(os.toString(StandardCharsets.UTF_8.name()), is("{\"jsonrpc\":\"2.0\",\"method\":\"ping\"}"));
    }

    @Test
    void serializeBatchKeepsOrder() throws IOException {
        String batch = serializer.serializeBatch(Arrays.asList(
                new JsonRpcRequest("first", null, new JsonRpcRequestId(1)),
                new JsonRpcNotification("second", null),
                new JsonRpcRequest("third", null, new JsonRpcRequestId(2))
        ));

        assertThat(batch, is("[{\"jsonrpc\":\"2.0\",\"method\":\"first\",\"id\":1},"
                + "{\"jsonrpc\":\"2.0\",\"method\":\"second\"},"
                + "{\"jsonrpc\":\"2.0\",\"method\":\"third\",\"id\":2}]"));
    }

    @Test
    void toTreeMatchesWireForm() throws IOException {
        JsonRpcRequest request = new JsonRpcRequest("ping", null, new JsonRpcRequestId(3));

        JsonNode tree = serializer.toTree(request);

        assertThat(tree, is(serializer.deserialize(serializer.serializeMessage(request))));
    }

    @Test
    void deserializeRejectsTrailingTokens() {
        Assertions.assertThrows(
                JsonProcessingException.class,
                () -> serializer.deserialize("{\"jsonrpc\":\"2.0\",\"result\":1,\"id\":1} garbage")
        );
    }

    @Test
    void scalarParamsAreRejected() {
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> new JsonRpcNotification("ping", JSON_NODE_FACTORY.textNode("scalar"))
        );
    }

    @Test
    void negativeAndLargeIds() throws JsonProcessingException {
        JsonRpcRequest negative = new JsonRpcRequest("ping", null, new JsonRpcRequestId(-1));
        JsonRpcRequest large = new JsonRpcRequest("ping", null, new JsonRpcRequestId(new BigInteger("18446744073709551616")));

        assertThat(serializer.serializeMessage(negative), is("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":-1}"));
        assertThat(serializer.serializeMessage(large), is("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":18446744073709551616}"));
        assertThat(new JsonRpcRequestId(BigInteger.valueOf(-7)), is(new JsonRpcRequestId(-7)));
    }

    @Test
    void injectedMapperIsNotReconfigured() throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        JacksonBasedRpcSerializer withMapper = new JacksonBasedRpcSerializer(mapper);

        Assertions.assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
        Assertions.assertThrows(JsonProcessingException.class, () -> withMapper.deserialize("{} {}"));
        assertThat(mapper.readTree("{} {}"), is(mapper.createObjectNode()));
    }
}
