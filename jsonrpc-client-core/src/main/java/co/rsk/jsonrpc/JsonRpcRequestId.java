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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Objects;

/**
 * The request id DTO for JSON serialization purposes.
 * Supports integer values of any size, strings and the null id.
 */
public final class JsonRpcRequestId {

    /**
     * The explicit {@code null} id. It is a valid id, unlike a missing one.
     */
    public static final JsonRpcRequestId NULL = new JsonRpcRequestId();

    private final Object id;

    @JsonCreator
    public JsonRpcRequestId(long id) {
        this.id = id;
    }

    /**
     * Integer ids are kept as {@link Long} whenever they fit, so equal ids compare equal.
     */
    public JsonRpcRequestId(BigInteger id) {
        this.id = id.bitLength() < Long.SIZE ? (Object) id.longValue() : id;
    }

    @JsonCreator
    public JsonRpcRequestId(String id) {
        this.id = Objects.requireNonNull(id);
    }

    private JsonRpcRequestId() {
        this.id = null;
    }

    /**
     * @return a {@link Long}, a {@link BigInteger} beyond the long range, a {@link String}, or null for {@link #NULL}
     */
    @JsonValue
    @Nullable
    public Object getValue() {
        return id;
    }

    public boolean isNumeric() {
        return id instanceof Long || id instanceof BigInteger;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }

        if (!(o instanceof JsonRpcRequestId)) {
            return false;
        }

        JsonRpcRequestId other = (JsonRpcRequestId) o;
        return Objects.equals(this.id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return String.valueOf(id);
    }
}
