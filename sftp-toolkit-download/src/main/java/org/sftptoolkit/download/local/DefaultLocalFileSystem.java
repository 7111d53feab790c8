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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * A {@link LocalFileSystem} backed by NIO {@link FileChannel}s
 */
public class DefaultLocalFileSystem extends AbstractLoggingBean implements LocalFileSystem {
    public static final DefaultLocalFileSystem INSTANCE = new DefaultLocalFileSystem();

    public DefaultLocalFileSystem() {
        super();
    }

    @Override
    public LocalHandle open(Path path, Collection<LocalOpenMode> modes) throws IOException {
        Objects.requireNonNull(path, "No local path");
        Set<OpenOption> options = LocalOpenMode.toOpenOptions(modes);
        FileChannel channel = openChannel(path, options);
        if (log.isDebugEnabled()) {
            log.debug("open({}) options={}", path, options);
        }
        return new FileChannelHandle(path, channel);
    }

    protected FileChannel openChannel(Path path, Set<OpenOption> options) throws IOException {
        return FileChannel.open(path, options);
    }

    @Override
    public void write(LocalHandle handle, byte[] data, int offset, int len) throws IOException {
        FileChannelHandle fileHandle = checkHandle(handle);
        if (!fileHandle.isOpen()) {
            throw new ClosedChannelException();
        }

        ByteBuffer buffer = ByteBuffer.wrap(data, offset, len);
        FileChannel channel = fileHandle.getChannel();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        fileHandle.updateWrittenBytes(len);

        if (log.isTraceEnabled()) {
            log.trace("write({}) len={}, total={}", fileHandle.getPath(), len, fileHandle.getWrittenBytes());
        }
    }

    @Override
    public void close(LocalHandle handle) throws IOException {
        FileChannelHandle fileHandle = checkHandle(handle);
        if (!fileHandle.markClosed()) {
            return;
        }

        fileHandle.getChannel().close();
        if (log.isDebugEnabled()) {
            log.debug("close({}) written={}", fileHandle.getPath(), fileHandle.getWrittenBytes());
        }
    }

    protected FileChannelHandle checkHandle(LocalHandle handle) {
        return ValidateUtils.checkInstanceOf(handle, FileChannelHandle.class, "Unsupported local handle: %s", handle);
    }

    protected static class FileChannelHandle extends LocalHandle {
        private final FileChannel channel;

        protected FileChannelHandle(Path path, FileChannel channel) {
            super(path);
            this.channel = Objects.requireNonNull(channel, "No file channel");
        }

        public FileChannel getChannel() {
            return channel;
        }
    }
}
