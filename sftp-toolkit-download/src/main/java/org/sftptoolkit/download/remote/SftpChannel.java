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

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;

/**
 * The remote file operations a download needs from an already established SFTP channel. Every operation is bounded by
 * its own timeout - an expired timeout is reported as an {@link IOException} just like any other protocol failure.
 */
public interface SftpChannel {
    /**
     * @param  path        The remote file path
     * @param  modes       The requested {@link RemoteOpenMode}s
     * @param  timeout     Maximum time to wait for the operation - non-positive means no limit
     * @return             The opened {@link RemoteHandle}
     * @throws IOException If failed to open the file or timed out
     */
    RemoteHandle open(String path, Collection<RemoteOpenMode> modes, Duration timeout) throws IOException;

    /**
     * Reads the next chunk of data from the handle's current offset
     *
     * @param  handle      The {@link RemoteHandle} to read from
     * @param  dst         Destination buffer - data is placed starting at its beginning
     * @param  len         Maximum number of bytes to read - may not exceed the buffer length
     * @param  timeout     Maximum time to wait for the operation - non-positive means no limit
     * @return             Number of bytes actually read - may be less than requested, or -1 if end of data reached
     * @throws IOException If failed to read or timed out
     */
    int read(RemoteHandle handle, byte[] dst, int len, Duration timeout) throws IOException;

    /**
     * @param  handle      The {@link RemoteHandle} to release
     * @param  timeout     Maximum time to wait for the operation - non-positive means no limit
     * @throws IOException If failed to close or timed out
     */
    void close(RemoteHandle handle, Duration timeout) throws IOException;
}
