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
package co.rsk.jsonrpc.logback;

import ch.qos.logback.core.ConsoleAppender;

/**
 * A console appender whose failures end up in logback's status instead of the caller.
 * Request and response logging must never change the outcome of a JSON-RPC call.
 */
public class SafeConsoleAppender<E> extends ConsoleAppender<E> {
    @Override
    protected void subAppend(E event) {
        try {
            super.subAppend(event);
        }
        catch (Throwable ex) {
            addError(ex.getMessage());
        }
    }
}
