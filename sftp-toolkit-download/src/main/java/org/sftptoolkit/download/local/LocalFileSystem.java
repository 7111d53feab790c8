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
import java.nio.file.Path;
import java.util.Collection;

/**
 * The local file operations a download needs
 */
public interface LocalFileSystem {
    /**
     * @param  path        The local file path
     * @param  modes       The requested {@link LocalOpenMode}s
     * @return             The opened {@link LocalHandle}
     * @throws IOException If failed to open the file
     */
    LocalHandle open(Path path, Collection<LocalOpenMode> modes) throws IOException;

    /**
     * Writes <U>all</U> the specified data - i.e., does not return until all of it has been written
     *
     * @param  handle      The {@link LocalHandle} to write to
     * @param  data        The data buffer
     * @param  offset      Offset of the data in the buffer
     * @param  len         Number of bytes to write
     * @throws IOException If failed to write the data
     */
    void write(LocalHandle handle, byte[] data, int offset, int len) throws IOException;

    /**
     * @param  handle      The {@link LocalHandle} to release
     * @throws IOException If failed to close the file
     */
    void close(LocalHandle handle) throws IOException;
}
