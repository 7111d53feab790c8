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

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.common.util.threads.ThreadUtils;
import org.apache.sshd.sftp.client.SftpClient;

/**
 * An {@link SftpChannel} on top of an {@link SftpClient}. The client API is synchronous, so each operation is executed
 * on a dedicated worker thread while the caller waits for it up to the requested timeout. <B>Note:</B> an operation
 * that timed out is not aborted on the server - its response is simply no longer awaited, and any operation issued
 * afterwards is queued behind it. A handle whose open completes after it was abandoned is closed as soon as it arrives.
 *
 * The wrapped client belongs to the caller and is not closed by {@link #close()}.
 */
public class SftpClientChannel extends AbstractLoggingBean implements SftpChannel, Closeable {
    private final SftpClient client;
    private final ExecutorService executor;
    private final boolean shutdownExecutor;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public SftpClientChannel(SftpClient client) {
        this(client, ThreadUtils.newSingleThreadExecutor("sftp-download"), true);
    }

    /**
     * @param client           The {@link SftpClient} used to access the remote files
     * @param executor         The {@link ExecutorService} running the client operations - should have a single
     *                         thread so that requests on the same handle are never interleaved
     * @param shutdownExecutor Whether to shut down the executor when this channel is closed
     */
    public SftpClientChannel(SftpClient client, ExecutorService executor, boolean shutdownExecutor) {
        this.client = Objects.requireNonNull(client, "No SFTP client");
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.shutdownExecutor = shutdownExecutor;
    }

    public SftpClient getClient() {
        return client;
    }

    @Override
    public RemoteHandle open(String path, Collection<RemoteOpenMode> modes, Duration timeout) throws IOException {
        ValidateUtils.checkNotNullAndNotEmpty(path, "No remote path");
        Set<SftpClient.OpenMode> sftpModes = RemoteOpenMode.toSftpModes(modes);
        SftpClient.CloseableHandle handle = invoke("open", path, timeout,
                () -> client.open(path, sftpModes), (SftpClient.CloseableHandle h) -> client.close(h));
        if (log.isDebugEnabled()) {
            log.debug("open({})[{}] modes={}", client, path, sftpModes);
        }
        return new SftpRemoteHandle(path, handle);
    }

    @Override
    public int read(RemoteHandle handle, byte[] dst, int len, Duration timeout) throws IOException {
        SftpRemoteHandle sftpHandle = checkHandle(handle);
        ValidateUtils.checkTrue((len > 0) && (len <= dst.length), "Invalid read length: %d", len);

        long offset = sftpHandle.getOffset();
        int count = invoke("read", sftpHandle.getPath(), timeout,
                () -> client.read(sftpHandle.getSftpHandle(), offset, dst, 0, len));
        if (count > 0) {
            sftpHandle.advance(count);
        }

        if (log.isTraceEnabled()) {
            log.trace("read({})[{}] offset={}, requested={}, read={}",
                    client, sftpHandle.getPath(), offset, len, count);
        }
        return count;
    }

    @Override
    public void close(RemoteHandle handle, Duration timeout) throws IOException {
        SftpRemoteHandle sftpHandle = checkHandle(handle);
        if (!sftpHandle.markClosed()) {
            if (log.isDebugEnabled()) {
                log.debug("close({})[{}] already closed", client, sftpHandle.getPath());
            }
            return;
        }

        invoke("close", sftpHandle.getPath(), timeout, () -> {
            client.close(sftpHandle.getSftpHandle());
            return null;
        });
    }

    protected SftpRemoteHandle checkHandle(RemoteHandle handle) {
        return ValidateUtils.checkInstanceOf(handle, SftpRemoteHandle.class, "Unsupported remote handle: %s", handle);
    }

    protected <T> T invoke(String op, String path, Duration timeout, SftpOperation<T> operation) throws IOException {
        return invoke(op, path, timeout, operation, null);
    }

    /**
     * @param  <T>         Type of operation result
     * @param  op          The operation name - used for logging and failure messages
     * @param  path        The remote path the operation refers to
     * @param  timeout     Maximum time to wait for the result - non-positive means no limit
     * @param  operation   The {@link SftpOperation} to execute
     * @param  releaser    Releases a result that is no longer awaited (timeout or interrupt) - may be {@code null} if
     *                     the result holds no resources
     * @return             The operation result
     * @throws IOException If the operation failed, timed out or the wait was interrupted
     */
    protected <T> T invoke(
            String op, String path, Duration timeout,
            SftpOperation<T> operation, SftpResultReleaser<? super T> releaser)
            throws IOException {
        if (!isOpen()) {
            throw new IOException(op + "(" + path + ") channel is closed");
        }

        if ((timeout == null) || GenericUtils.isNegativeOrNull(timeout)) {
            return operation.execute();
        }

        PendingOperation<T> task = new PendingOperation<>(op, path, operation, releaser);
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IOException(op + "(" + path + ") rejected by executor: " + e.getMessage(), e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(task, future);
            throw new SocketTimeoutException(
                    op + "(" + path + ") no response received within " + timeout.toMillis() + " msec.");
        } catch (InterruptedException e) {
            abandon(task, future);
            Thread.currentThread().interrupt();
            throw (IOException) new InterruptedIOException(op + "(" + path + ") interrupted while waiting for response")
                    .initCause(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new IOException(op + "(" + path + ") failed: " + cause, cause);
            }
        }
    }

    protected <T> void abandon(PendingOperation<T> task, Future<T> future) {
        if (!task.abandon()) {
            future.cancel(true);
            return;
        }

        // the result was handed over just before the wait ended - the future is about to complete
        T result;
        try {
            result = future.get();
        } catch (InterruptedException | ExecutionException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (log.isDebugEnabled()) {
                log.debug("abandon({})[{}] {} result not available ({}): {}",
                        client, task.getPath(), task.getOperationName(), e.getClass().getSimpleName(), e.getMessage());
            }
            return;
        }
        task.release(result);
    }

    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (!open.getAndSet(false)) {
            return;
        }

        if (shutdownExecutor) {
            executor.shutdownNow();
        }

        if (log.isDebugEnabled()) {
            log.debug("close({}) channel closed", client);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + client + "]";
    }

    @FunctionalInterface
    protected interface SftpOperation<T> {
        T execute() throws IOException;
    }

    @FunctionalInterface
    protected interface SftpResultReleaser<T> {
        void release(T result) throws IOException;
    }

    /**
     * An operation whose result is either handed over to the waiting caller or - once the caller gave up waiting -
     * released, but never both
     *
     * @param <T> Type of operation result
     */
    protected class PendingOperation<T> implements Callable<T> {
        private final String operationName;
        private final String path;
        private final SftpOperation<T> operation;
        private final SftpResultReleaser<? super T> releaser;
        private boolean abandoned;
        private boolean delivered;

        protected PendingOperation(
                String operationName, String path, SftpOperation<T> operation, SftpResultReleaser<? super T> releaser) {
            this.operationName = operationName;
            this.path = path;
            this.operation = operation;
            this.releaser = releaser;
        }

        public String getOperationName() {
            return operationName;
        }

        public String getPath() {
            return path;
        }

        @Override
        public T call() throws IOException {
            T result = operation.execute();
            synchronized (this) {
                if (!abandoned) {
                    delivered = true;
                    return result;
                }
            }

            release(result);
            return null;
        }

        /**
         * Marks the result as no longer awaited
         *
         * @return {@code true} if the result was already handed over, in which case the caller must release it
         */
        public synchronized boolean abandon() {
            abandoned = true;
            return delivered;
        }

        protected void release(T result) {
            if ((result == null) || (releaser == null)) {
                return;
            }

            try {
                releaser.release(result);
                if (log.isDebugEnabled()) {
                    log.debug("release({})[{}] released abandoned {} result", client, path, operationName);
                }
            } catch (IOException | RuntimeException e) {
                warn("release({})[{}] failed ({}) to release abandoned {} result: {}",
                        client, path, e.getClass().getSimpleName(), operationName, e.getMessage(), e);
            }
        }
    }

    protected static class SftpRemoteHandle extends RemoteHandle {
        private final SftpClient.CloseableHandle sftpHandle;

        protected SftpRemoteHandle(String path, SftpClient.CloseableHandle sftpHandle) {
            super(path);
            this.sftpHandle = Objects.requireNonNull(sftpHandle, "No SFTP handle");
        }

        public SftpClient.CloseableHandle getSftpHandle() {
            return sftpHandle;
        }
    }
}
