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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.sftptoolkit.download.local.DefaultLocalFileSystem;
import org.sftptoolkit.download.local.LocalFileSystem;
import org.sftptoolkit.download.local.LocalHandle;
import org.sftptoolkit.download.remote.RemoteHandle;
import org.sftptoolkit.download.remote.SftpChannel;

/**
 * Copies a remote file to a local one chunk by chunk, so that no more than one chunk of data is held in memory
 * regardless of the file size. The download is executed as an ordered sequence of stages:
 * <OL>
 * <LI>open the remote file</LI>
 * <LI>open the local file</LI>
 * <LI>read a chunk from the remote file and write it to the local one, until end of data is reached</LI>
 * <LI>close the remote file</LI>
 * <LI>close the local file</LI>
 * </OL>
 * The first stage that fails determines the {@link DownloadResult}. Whatever was successfully opened is still closed
 * before returning - failures of such cleanup are logged and attached to the result, but never replace the original
 * failure. Nothing is retried, and a partially written local file is left as-is.
 *
 * Instances hold no per-download state and can be used concurrently for independent downloads.
 */
public class ChunkedDownloader extends AbstractLoggingBean {
    private final LocalFileSystem localFileSystem;
    private final DownloadEventListener listener;

    public ChunkedDownloader() {
        this(DefaultLocalFileSystem.INSTANCE);
    }

    public ChunkedDownloader(LocalFileSystem localFileSystem) {
        this(localFileSystem, DownloadEventListener.EMPTY);
    }

    public ChunkedDownloader(LocalFileSystem localFileSystem, DownloadEventListener listener) {
        this.localFileSystem = Objects.requireNonNull(localFileSystem, "No local file system");
        this.listener = DownloadEventListener.validateListener(listener);
    }

    public LocalFileSystem getLocalFileSystem() {
        return localFileSystem;
    }

    public DownloadEventListener getDownloadEventListener() {
        return listener;
    }

    public DownloadResult download(SftpChannel channel, String remotePath, Path localPath) {
        return download(channel, remotePath, localPath, TransferConfiguration.DEFAULT);
    }

    /**
     * @param  channel    The {@link SftpChannel} used to access the remote file
     * @param  remotePath The remote file path
     * @param  localPath  The local file path
     * @param  config     The {@link TransferConfiguration} - if {@code null} then the defaults are used
     * @return            The {@link DownloadResult} - expected failures are reported through it and never thrown
     */
    public DownloadResult download(
            SftpChannel channel, String remotePath, Path localPath, TransferConfiguration config) {
        Objects.requireNonNull(channel, "No channel");
        ValidateUtils.checkNotNullAndNotEmpty(remotePath, "No remote path");
        Objects.requireNonNull(localPath, "No local path");

        TransferConfiguration effective = (config == null) ? TransferConfiguration.DEFAULT : config;
        if (log.isDebugEnabled()) {
            log.debug("download({} => {}) {}", remotePath, localPath, effective);
        }

        Transfer transfer = new Transfer(channel, remotePath, localPath, effective);
        invokeListener("startDownload", remotePath, l -> l.startDownload(remotePath, localPath, effective));

        DownloadResult result = execute(transfer);
        long length = transfer.getTransferredBytes();
        if (log.isDebugEnabled()) {
            if (result.isSuccess()) {
                log.debug("download({} => {}) completed - {} bytes", remotePath, localPath, length);
            } else {
                log.debug("download({} => {}) failed at {} after {} bytes",
                        remotePath, localPath, result.getStage().getName(), length);
            }
        }

        invokeListener("endDownload", remotePath, l -> l.endDownload(remotePath, localPath, length, result));
        return result;
    }

    protected DownloadResult execute(Transfer transfer) {
        try {
            return transfer.run();
        } catch (RuntimeException | Error e) {
            // collaborator contract violation - release what we can before propagating it
            try {
                transfer.release(null);
            } catch (RuntimeException | Error suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    protected void invokeListener(String event, String remotePath, Consumer<? super DownloadEventListener> invoker) {
        try {
            invoker.accept(listener);
        } catch (RuntimeException e) {
            warn("{}({}) listener={} failed ({}): {}",
                    event, remotePath, listener, e.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    /**
     * Tracks the resources of a single download. A handle reference is cleared <U>before</U> its close is attempted,
     * so whatever is still referenced is exactly what needs to be released - and no handle is ever used again once
     * its close was attempted.
     */
    protected class Transfer {
        private final SftpChannel channel;
        private final String remotePath;
        private final Path localPath;
        private final TransferConfiguration config;
        private final Duration timeout;

        private RemoteHandle remoteHandle;
        private LocalHandle localHandle;
        private long transferred;

        protected Transfer(SftpChannel channel, String remotePath, Path localPath, TransferConfiguration config) {
            this.channel = channel;
            this.remotePath = remotePath;
            this.localPath = localPath;
            this.config = config;
            this.timeout = config.getOperationTimeout();
        }

        public TransferConfiguration getConfiguration() {
            return config;
        }

        public long getTransferredBytes() {
            return transferred;
        }

        protected DownloadResult run() {
            try {
                remoteHandle = channel.open(remotePath, config.getRemoteOpenModes(), timeout);
            } catch (IOException e) {
                return fail(DownloadStage.REMOTE_OPEN, e);
            }

            try {
                localHandle = localFileSystem.open(localPath, config.getLocalOpenModes());
            } catch (IOException e) {
                return fail(DownloadStage.LOCAL_OPEN, e);
            }

            DownloadResult copyResult = copy();
            if (!copyResult.isSuccess()) {
                return copyResult;
            }

            try {
                closeRemote();
            } catch (IOException e) {
                return fail(DownloadStage.REMOTE_CLOSE, e);
            }

            try {
                closeLocal();
            } catch (IOException e) {
                return fail(DownloadStage.LOCAL_CLOSE, e);
            }

            return DownloadResult.success();
        }

        protected DownloadResult copy() {
            int chunkSize = config.getChunkSize();
            byte[] chunk = new byte[chunkSize];
            while (true) {
                int count;
                try {
                    count = channel.read(remoteHandle, chunk, chunkSize, timeout);
                } catch (IOException e) {
                    return fail(DownloadStage.READ, e);
                }

                if (count < 0) {
                    return DownloadResult.success();
                }
                ValidateUtils.checkState(count <= chunkSize, "Read %d bytes while only %d requested", count, chunkSize);

                try {
                    localFileSystem.write(localHandle, chunk, 0, count);
                } catch (IOException e) {
                    return fail(DownloadStage.WRITE, e);
                }

                long offset = transferred;
                int length = count;
                transferred += length;
                if (log.isTraceEnabled()) {
                    log.trace("copy({} => {}) wrote {} bytes at offset={}", remotePath, localPath, length, offset);
                }
                invokeListener("chunkWritten", remotePath, l -> l.chunkWritten(remotePath, localPath, offset, length));
            }
        }

        protected void closeRemote() throws IOException {
            RemoteHandle handle = remoteHandle;
            remoteHandle = null;
            channel.close(handle, timeout);
        }

        protected void closeLocal() throws IOException {
            LocalHandle handle = localHandle;
            localHandle = null;
            localFileSystem.close(handle);
        }

        protected DownloadResult fail(DownloadStage stage, IOException cause) {
            if (log.isDebugEnabled()) {
                log.debug("download({} => {}) {} failed ({}): {}",
                        remotePath, localPath, stage.getName(), cause.getClass().getSimpleName(), cause.getMessage());
            }

            return DownloadResult.failure(stage, cause, release(stage));
        }

        /**
         * Closes whatever is still open - remote handle first
         *
         * @param  stage The {@link DownloadStage} whose failure triggered the release - {@code null} if unexpected
         *               exception
         * @return       The failures encountered while closing - never {@code null}
         */
        protected List<IOException> release(DownloadStage stage) {
            String reason = (stage == null) ? "abort" : stage.getName();
            List<IOException> failures = null;
            if (remoteHandle != null) {
                try {
                    closeRemote();
                } catch (IOException e) {
                    warn("release({} => {}) failed ({}) to close remote file after {}: {}",
                            remotePath, localPath, e.getClass().getSimpleName(), reason, e.getMessage(), e);
                    failures = accumulate(failures, e);
                }
            }

            if (localHandle != null) {
                try {
                    closeLocal();
                } catch (IOException e) {
                    warn("release({} => {}) failed ({}) to close local file after {}: {}",
                            remotePath, localPath, e.getClass().getSimpleName(), reason, e.getMessage(), e);
                    failures = accumulate(failures, e);
                }
            }

            return (failures == null) ? Collections.emptyList() : failures;
        }

        private List<IOException> accumulate(List<IOException> failures, IOException e) {
            List<IOException> result = (failures == null) ? new ArrayList<>(2) : failures;
            result.add(e);
            return result;
        }
    }
}
