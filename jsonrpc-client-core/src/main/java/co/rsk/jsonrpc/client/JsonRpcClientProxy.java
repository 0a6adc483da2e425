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

import co.rsk.jsonrpc.client.exception.JsonRpcClientException;
import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;

/**
 * Turns interface method invocations into JSON-RPC calls on a {@link JsonRpcClient}.
 *
 * The method name, or its {@link JsonRpcMethod} value, is the JSON-RPC method and the arguments are
 * sent as positional params. Every call is a request unless {@link JsonRpcMethod#notification()} is set;
 * a {@code void} method still gets its reply processed, so error replies raise. Results are converted
 * to the declared generic return type with Jackson; {@link JsonNode} results are returned as is.
 *
 * Interface methods that don't declare {@link java.io.IOException} get transport failures wrapped in
 * an {@link java.lang.reflect.UndeclaredThrowableException}.
 */
class JsonRpcClientProxy implements InvocationHandler {
    private static final Object[] NO_ARGS = new Object[0];

    private final JsonRpcClient client;

    JsonRpcClientProxy(JsonRpcClient client) {
        this.client = client;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }

        if (method.isDefault()) {
            return InvocationHandler.invokeDefault(proxy, method, args);
        }

        String name = methodName(method);
        Object[] params = args == null ? NO_ARGS : args;

        JsonNode result = isNotification(method) ? client.notify(name, params) : client.request(name, params);
        if (method.getReturnType() == void.class) {
            return null;
        }

        if (method.getReturnType() == JsonNode.class) {
            return result;
        }

        if (method.getReturnType().isPrimitive() && (result == null || result.isNull())) {
            throw new JsonRpcClientException(
                    String.format("Method %s returned no result, but %s expects a %s", name, method.getName(), method.getReturnType())
            );
        }

        return client.convertResult(result, method.getGenericReturnType());
    }

    static String methodName(Method method) {
        JsonRpcMethod annotation = method.getAnnotation(JsonRpcMethod.class);
        return annotation == null || annotation.value().isEmpty() ? method.getName() : annotation.value();
    }

    static boolean isNotification(Method method) {
        JsonRpcMethod annotation = method.getAnnotation(JsonRpcMethod.class);
        return annotation != null && annotation.notification();
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "JsonRpcClientProxy[" + client.getTransport() + "]";
            default:
                throw new UnsupportedOperationException(method.getName());
        }
    }
}
