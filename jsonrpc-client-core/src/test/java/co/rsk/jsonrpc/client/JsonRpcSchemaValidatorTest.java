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

import co.rsk.jsonrpc.client.exception.JsonRpcValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

class JsonRpcSchemaValidatorTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final JsonRpcSchemaValidator validator = new JsonRpcSchemaValidator(true);

    @Test
    void validResponsesPass() throws IOException {
        assertValid("{\"jsonrpc\":\"2.0\",\"result\":5,\"id\":1}", JsonRpcSchema.RESPONSE);
        assertValid("{\"jsonrpc\":\"2.0\",\"result\":null,\"id\":\"abc\"}", JsonRpcSchema.RESPONSE);
        assertValid("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32000,\"message\":\"Not Found\"},\"id\":null}", JsonRpcSchema.RESPONSE);
        assertValid("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32000,\"message\":\"Not Found\",\"data\":[1,{}]},\"id\":null}", JsonRpcSchema.RESPONSE);
    }

    @Test
    void validRequestsPass() throws IOException {
        assertValid("{\"jsonrpc\":\"2.0\",\"method\":\"go\"}", JsonRpcSchema.REQUEST);
        assertValid("{\"jsonrpc\":\"2.0\",\"method\":\"go\",\"params\":[1,2],\"id\":1}", JsonRpcSchema.REQUEST);
        assertValid("{\"jsonrpc\":\"2.0\",\"method\":\"go\",\"params\":{\"a\":1},\"id\":null}", JsonRpcSchema.REQUEST);
    }

    @Test
    void validBatchPasses() throws IOException {
        assertValid("[{\"jsonrpc\":\"2.0\",\"result\":5,\"id\":1},"
                + "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32601,\"message\":\"Method not found\"},\"id\":2}]",
                JsonRpcSchema.RESPONSE);
    }

    @Test
    void missingVersionFails() throws IOException {
        assertInvalid("{\"json\":\"2.0\"}", JsonRpcSchema.RESPONSE, "");
        assertInvalid("{\"method\":\"go\"}", JsonRpcSchema.REQUEST, "");
    }

    @Test
    void wrongVersionFails() throws IOException {
        assertInvalid("{\"jsonrpc\":\"1.0\",\"result\":5,\"id\":1}", JsonRpcSchema.RESPONSE, "/jsonrpc");
        assertInvalid("{\"jsonrpc\":2.0,\"result\":5,\"id\":1}", JsonRpcSchema.RESPONSE, "/jsonrpc");
    }

    @Test
    void nonStringMethodFails() throws IOException {
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":5}", JsonRpcSchema.REQUEST, "/method");
        assertInvalid("{\"jsonrpc\":\"2.0\"}", JsonRpcSchema.REQUEST, "/method");
    }

    @Test
    void scalarParamsFail() throws IOException {
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":\"go\",\"params\":5}", JsonRpcSchema.REQUEST, "/params");
    }

    @Test
    void resultAndErrorAreExclusive() throws IOException {
        assertInvalid("{\"jsonrpc\":\"2.0\",\"id\":1}", JsonRpcSchema.RESPONSE, "");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"result\":1,\"error\":{\"code\":1,\"message\":\"x\"},\"id\":1}",
                JsonRpcSchema.RESPONSE, "");
    }

    @Test
    void incompleteErrorFails() throws IOException {
        assertInvalid("{\"jsonrpc\":\"2.0\",\"error\":{\"message\":\"x\"},\"id\":1}", JsonRpcSchema.RESPONSE, "/error/code");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":1},\"id\":1}", JsonRpcSchema.RESPONSE, "/error/message");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":1.5,\"message\":\"x\"},\"id\":1}", JsonRpcSchema.RESPONSE, "/error/code");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"error\":\"boom\",\"id\":1}", JsonRpcSchema.RESPONSE, "/error");
    }

    @Test
    void invalidIdFails() throws IOException {
        assertInvalid("{\"jsonrpc\":\"2.0\",\"result\":1}", JsonRpcSchema.RESPONSE, "");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"result\":1,\"id\":[1]}", JsonRpcSchema.RESPONSE, "/id");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":\"go\",\"id\":1.5}", JsonRpcSchema.REQUEST, "/id");
    }

    @Test
    void unknownMembersFail() throws IOException {
        assertInvalid("{\"jsonrpc\":\"2.0\",\"result\":1,\"id\":1,\"extra\":true}", JsonRpcSchema.RESPONSE, "/extra");
        assertInvalid("{\"jsonrpc\":\"2.0\",\"method\":\"go\",\"result\":1}", JsonRpcSchema.REQUEST, "/result");
    }

    @Test
    void batchElementsAreCheckedOneByOne() throws IOException {
        assertInvalid("[{\"jsonrpc\":\"2.0\",\"result\":5,\"id\":1},{\"json\":\"2.0\"}]", JsonRpcSchema.RESPONSE, "/1");
        assertInvalid("[]", JsonRpcSchema.RESPONSE, "");
        assertInvalid("[5]", JsonRpcSchema.RESPONSE, "/0");
    }

    @Test
    void disabledValidatorLetsAnythingThrough() throws IOException {
        JsonRpcSchemaValidator disabled = new JsonRpcSchemaValidator(JsonRpcClientProperties.builder().validate(false).build());
        JsonNode node = OBJECT_MAPPER.readTree("{\"json\":\"2.0\"}");

        Assertions.assertFalse(disabled.isEnabled());
        assertThat(disabled.validate(node, JsonRpcSchema.RESPONSE), is(sameInstance(node)));
    }

    private void assertValid(String json, JsonRpcSchema schema) throws IOException {
        JsonNode node = OBJECT_MAPPER.readTree(json);

        assertThat(validator.validate(node, schema), is(sameInstance(node)));
    }

    private void assertInvalid(String json, JsonRpcSchema schema, String path) throws IOException {
        JsonNode node = OBJECT_MAPPER.readTree(json);

        JsonRpcValidationException e = Assertions.assertThrows(
                JsonRpcValidationException.class,
                () -> validator.validate(node, schema),
                json
        );

        assertThat(e.getSchema(), is(schema));
        assertThat(json, e.getPath(), is(path));
    }
}
