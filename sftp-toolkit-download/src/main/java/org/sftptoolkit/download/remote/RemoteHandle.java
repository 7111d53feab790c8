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
package org.sftptoolkit.download.remote;

import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.sshd.common.util.ValidateUtils;

/**
 * Represents a file opened on the remote side. SFTP reads are positional, so the handle also keeps track of the offset
 * of the next read.
 */
public abstract class RemoteHandle {
    private final String path;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private long offset;

    protected RemoteHandle(String path) {
        this.path = ValidateUtils.checkNotNullAndNotEmpty(path, "No remote path");
    }

    public String getPath() {
        return path;
    }

    /**
     * @return The offset in the remote file from which the next read starts
     */
    public long getOffset() {
        return offset;
    }

    protected void advance(int count) {
        ValidateUtils.checkTrue(count >= 0, "Invalid advance count: %d", count);
        offset += count;
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Marks the handle as closed
     *
     * @return {@code true} if this is the first invocation
     */
    protected boolean markClosed() {
        return open.getAndSet(false);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getPath() + "@" + getOffset() + "]";
    }
}
