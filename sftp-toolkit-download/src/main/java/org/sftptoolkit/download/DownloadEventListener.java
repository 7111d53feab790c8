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
package org.sftptoolkit.download;

import java.nio.file.Path;

import org.apache.sshd.common.util.SshdEventListener;

/**
 * Can be registered in order to receive events about downloads. Exceptions thrown by the listener are logged and
 * otherwise ignored - they never affect the download or its outcome.
 */
public interface DownloadEventListener extends SshdEventListener {
    /**
     * An &quot;empty&quot; implementation to be used instead of {@code null}s
     */
    DownloadEventListener EMPTY = new DownloadEventListener() {
        @Override
        public String toString() {
            return "EMPTY";
        }
    };

    /**
     * @param remotePath The remote file being downloaded
     * @param localPath  The <U>local</U> target file {@link Path}
     * @param config     The {@link TransferConfiguration} in effect
     */
    default void startDownload(String remotePath, Path localPath, TransferConfiguration config) {
        // ignored
    }

    /**
     * @param remotePath The remote file being downloaded
     * @param localPath  The <U>local</U> target file {@link Path}
     * @param offset     Offset of the chunk in the file
     * @param length     Number of bytes in the chunk - already written to the local file
     */
    default void chunkWritten(String remotePath, Path localPath, long offset, int length) {
        // ignored
    }

    /**
     * @param remotePath The remote file being downloaded
     * @param localPath  The <U>local</U> target file {@link Path}
     * @param length     Number of bytes written to the local file
     * @param result     The {@link DownloadResult}
     */
    default void endDownload(String remotePath, Path localPath, long length, DownloadResult result) {
        // ignored
    }

    static <L extends DownloadEventListener> L validateListener(L listener) {
        return SshdEventListener.validateListener(listener, DownloadEventListener.class.getSimpleName());
    }
}
