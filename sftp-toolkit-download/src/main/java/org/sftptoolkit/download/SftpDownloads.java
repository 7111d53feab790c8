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
import java.util.Objects;

import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.sftp.client.SftpClient;
import org.sftptoolkit.download.local.DefaultLocalFileSystem;
import org.sftptoolkit.download.remote.SftpClientChannel;

/**
 * Convenience entry points for downloading a file through an already open {@link SftpClient}
 */
public final class SftpDownloads {
    private SftpDownloads() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * Downloads the file using the configuration {@link TransferConfiguration#resolve resolved} from the client's
     * session properties
     *
     * @param  client     The open {@link SftpClient}
     * @param  remotePath The remote file path
     * @param  localPath  The local file path
     * @return            The {@link DownloadResult}
     * @see               DownloadModuleProperties
     */
    public static DownloadResult download(SftpClient client, String remotePath, Path localPath) {
        Objects.requireNonNull(client, "No SFTP client");
        ClientSession session = client.getClientSession();
        return download(client, remotePath, localPath, TransferConfiguration.resolve(session));
    }

    public static DownloadResult download(
            SftpClient client, String remotePath, Path localPath, TransferConfiguration config) {
        return download(client, remotePath, localPath, config, DownloadEventListener.EMPTY);
    }

    public static DownloadResult download(
            SftpClient client, String remotePath, Path localPath, TransferConfiguration config,
            DownloadEventListener listener) {
        ChunkedDownloader downloader = new ChunkedDownloader(DefaultLocalFileSystem.INSTANCE, listener);
        try (SftpClientChannel channel = new SftpClientChannel(client)) {
            return downloader.download(channel, remotePath, localPath, config);
        }
    }
}
