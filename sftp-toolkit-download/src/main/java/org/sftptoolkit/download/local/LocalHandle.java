/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.sftptoolkit.download.local;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Represents the local file receiving the downloaded data
 */
public abstract class LocalHandle {
    private final Path path;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private long written;

    protected LocalHandle(Path path) {
        this.path = Objects.requireNonNull(path, "No local path");
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return Number of bytes written so far through this handle
     */
    public long getWrittenBytes() {
        return written;
    }

    protected void updateWrittenBytes(int count) {
        written += count;
    }

    public boolean isOpen() {
        return open.get();
    }

    protected boolean markClosed() {
        return open.getAndSet(false);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getPath() + "]";
    }
}
