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
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.client.impl.DefaultCloseableHandle;
import org.apache.sshd.sftp.common.SftpConstants;
import org.apache.sshd.sftp.common.SftpException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.sftptoolkit.download.local.LocalHandle;
import org.sftptoolkit.download.remote.RemoteHandle;
import org.sftptoolkit.download.remote.SftpClientChannel;
import org.sftptoolkit.util.test.JUnitTestSupport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class ChunkedDownloaderTest extends JUnitTestSupport {
    private static final String REMOTE_PATH = "/data/file.bin";
    private static final String LOCAL_NAME = "file.bin";

    private List<String> journal;
    private InMemorySftpChannel channel;
    private RecordingLocalFileSystem localFs;
    private Path localPath;

    public ChunkedDownloaderTest() {
        super();
    }

    @BeforeEach
    void setUp() throws IOException {
        journal = new ArrayList<>();
        channel = new InMemorySftpChannel(journal);
        localFs = new RecordingLocalFileSystem(journal);
        localPath = createTempTestFolder().resolve(LOCAL_NAME);
    }

    @Test
    void downloadFileLargerThanChunk() throws IOException {
        byte[] data = createTestData(70000);
        channel.addFile(REMOTE_PATH, data);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertTrue(result.isSuccess(), "Download failed: " + result);
        assertNull(result.getStage(), "Unexpected stage on success");
        assertNull(result.getCause(), "Unexpected cause on success");

        assertEquals(Arrays.asList(32768, 32768, 4464, -1), channel.getReadCounts(), "Mismatched reads");
        assertEquals(Arrays.asList(32768, 32768, 4464), localFs.getWriteLengths(), "Mismatched writes");
        assertArrayEquals(data, Files.readAllBytes(localPath), "Mismatched local content");
        assertEquals(Arrays.asList(
                "remote.open " + REMOTE_PATH,
                "local.open " + LOCAL_NAME,
                "remote.read " + REMOTE_PATH,
                "local.write " + LOCAL_NAME,
                "remote.read " + REMOTE_PATH,
                "local.write " + LOCAL_NAME,
                "remote.read " + REMOTE_PATH,
                "local.write " + LOCAL_NAME,
                "remote.read " + REMOTE_PATH,
                "remote.close " + REMOTE_PATH,
                "local.close " + LOCAL_NAME), journal, "Mismatched operations sequence");
        assertAllHandlesClosed();
    }

    static Stream<Arguments> sizesAndChunks() {
        return Stream.of(
                Arguments.of(0, 1),
                Arguments.of(0, 32768),
                Arguments.of(1, 1),
                Arguments.of(1, 32768),
                Arguments.of(100, 1000),
                Arguments.of(4096, 1024),
                Arguments.of(5000, 1024),
                Arguments.of(7, 3),
                Arguments.of(70000, 32768),
                Arguments.of(131072, 32768));
    }

    @ParameterizedTest(name = "size={0}, chunk={1}")
    @MethodSource("sizesAndChunks")
    void contentPreservedInBoundedChunks(int size, int chunkSize) throws IOException {
        byte[] data = createTestData(size);
        channel.addFile(REMOTE_PATH, data);

        TransferConfiguration config = TransferConfiguration.builder().chunkSize(chunkSize).build();
        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath, config);
        assertTrue(result.isSuccess(), "Download failed: " + result);
        assertArrayEquals(data, Files.readAllBytes(localPath), "Mismatched local content");

        int expectedWrites = (size + chunkSize - 1) / chunkSize;
        assertEquals(expectedWrites, localFs.getWriteLengths().size(), "Mismatched number of writes");
        assertEquals(chunkSize, channel.getMaxRequestedLength(), "Mismatched read request size");
        for (int len : localFs.getWriteLengths()) {
            assertTrue((len > 0) && (len <= chunkSize), "Write length exceeds chunk: " + len);
        }
        assertAllHandlesClosed();
    }

    @Test
    void shortReadsWrittenBeforeNextRead() throws IOException {
        byte[] data = createTestData(10000);
        channel.addFile(REMOTE_PATH, data).setMaxReadSize(1000);

        TransferConfiguration config = TransferConfiguration.builder().chunkSize(4096).build();
        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath, config);
        assertTrue(result.isSuccess(), "Download failed: " + result);
        assertArrayEquals(data, Files.readAllBytes(localPath), "Mismatched local content");
        assertEquals(Collections.nCopies(10, 1000), localFs.getWriteLengths(), "Mismatched writes");

        // each read is followed by the write of its data, except for the one that signals end of data
        List<String> loop = journal.subList(2, journal.size() - 3);
        for (int index = 0; index < loop.size(); index += 2) {
            assertEquals("remote.read " + REMOTE_PATH, loop.get(index), "Mismatched operation at " + index);
            assertEquals("local.write " + LOCAL_NAME, loop.get(index + 1), "Mismatched operation at " + (index + 1));
        }
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(DownloadStage.class)
    void failureClassifiedByStage(DownloadStage stage) throws IOException {
        channel.addFile(REMOTE_PATH, createTestData(70000));
        IOException failure = new IOException("Simulated " + stage.getName() + " failure");
        switch (stage) {
            case REMOTE_OPEN:
                channel.failOn(InMemorySftpChannel.Operation.OPEN, 1, failure);
                break;
            case LOCAL_OPEN:
                localFs.failOn(RecordingLocalFileSystem.Operation.OPEN, 1, failure);
                break;
            case READ:
                channel.failOn(InMemorySftpChannel.Operation.READ, 1, failure);
                break;
            case WRITE:
                localFs.failOn(RecordingLocalFileSystem.Operation.WRITE, 1, failure);
                break;
            case REMOTE_CLOSE:
                channel.failOn(InMemorySftpChannel.Operation.CLOSE, 1, failure);
                break;
            case LOCAL_CLOSE:
                localFs.failOn(RecordingLocalFileSystem.Operation.CLOSE, 1, failure);
                break;
            default:
                throw new UnsupportedOperationException("Unknown stage: " + stage);
        }

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertFalse(result.isSuccess(), "Unexpected success");
        assertSame(stage, result.getStage(), "Mismatched stage");
        assertSame(failure, result.getCause(), "Cause not preserved");
        assertTrue(result.getCleanupFailures().isEmpty(), "Unexpected cleanup failures: " + result);
        assertAllHandlesClosed();
    }

    @Test
    void remoteOpenPermissionDenied() {
        channel.addFile(REMOTE_PATH, createTestData(1024));
        SftpException denied = new SftpException(SftpConstants.SSH_FX_PERMISSION_DENIED, "Permission denied");
        channel.failOn(InMemorySftpChannel.Operation.OPEN, 1, denied);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.REMOTE_OPEN, result.getStage(), "Mismatched stage");
        assertSame(denied, result.getCause(), "Cause not preserved");
        assertEquals(SftpConstants.SSH_FX_PERMISSION_DENIED, ((SftpException) result.getCause()).getStatus());
        assertEquals(0, localFs.getInvocations(RecordingLocalFileSystem.Operation.OPEN), "Local file opened");
        assertEquals(Collections.singletonList("remote.open " + REMOTE_PATH), journal, "Unexpected operations");
        assertFalse(Files.exists(localPath), "Local file created");
    }

    @Test
    void remoteHandleClosedWhenLocalOpenFails() {
        channel.addFile(REMOTE_PATH, createTestData(1024));
        IOException failure = new IOException("Simulated local open failure");
        localFs.failOn(RecordingLocalFileSystem.Operation.OPEN, 1, failure);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.LOCAL_OPEN, result.getStage(), "Mismatched stage");
        assertSame(failure, result.getCause(), "Cause not preserved");
        assertEquals(Arrays.asList(
                "remote.open " + REMOTE_PATH,
                "local.open " + LOCAL_NAME,
                "remote.close " + REMOTE_PATH), journal, "Mismatched operations sequence");
        assertAllHandlesClosed();
    }

    @Test
    void localOpenFailureTakesPrecedenceOverCleanupFailure() {
        channel.addFile(REMOTE_PATH, createTestData(1024));
        IOException openFailure = new IOException("Simulated local open failure");
        IOException closeFailure = new IOException("Simulated remote close failure");
        localFs.failOn(RecordingLocalFileSystem.Operation.OPEN, 1, openFailure);
        channel.failOn(InMemorySftpChannel.Operation.CLOSE, 1, closeFailure);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.LOCAL_OPEN, result.getStage(), "Mismatched stage");
        assertSame(openFailure, result.getCause(), "Original failure not reported");
        assertEquals(Collections.singletonList(closeFailure), result.getCleanupFailures(), "Cleanup failure not kept");
        assertEquals(1, channel.getInvocations(InMemorySftpChannel.Operation.CLOSE), "Remote close retried");
    }

    @Test
    void localCloseAttemptedWhenRemoteCloseFails() throws IOException {
        byte[] data = createTestData(5000);
        channel.addFile(REMOTE_PATH, data);
        IOException failure = new IOException("Simulated remote close failure");
        channel.failOn(InMemorySftpChannel.Operation.CLOSE, 1, failure);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.REMOTE_CLOSE, result.getStage(), "Mismatched stage");
        assertSame(failure, result.getCause(), "Cause not preserved");
        assertEquals(Arrays.asList("remote.close " + REMOTE_PATH, "local.close " + LOCAL_NAME),
                journal.subList(journal.size() - 2, journal.size()), "Mismatched closing sequence");
        assertArrayEquals(data, Files.readAllBytes(localPath), "Mismatched local content");
        assertAllHandlesClosed();
    }

    @Test
    void remoteCloseFailureTakesPrecedenceOverLocalCloseFailure() {
        channel.addFile(REMOTE_PATH, createTestData(5000));
        IOException remoteFailure = new IOException("Simulated remote close failure");
        IOException localFailure = new IOException("Simulated local close failure");
        channel.failOn(InMemorySftpChannel.Operation.CLOSE, 1, remoteFailure);
        localFs.failOn(RecordingLocalFileSystem.Operation.CLOSE, 1, localFailure);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.REMOTE_CLOSE, result.getStage(), "Mismatched stage");
        assertSame(remoteFailure, result.getCause(), "Original failure not reported");
        assertEquals(Collections.singletonList(localFailure), result.getCleanupFailures(), "Cleanup failure not kept");

        DownloadException err = assertThrows(DownloadException.class, result::verify);
        assertSame(DownloadStage.REMOTE_CLOSE, err.getStage(), "Mismatched exception stage");
        assertSame(remoteFailure, err.getCause(), "Mismatched exception cause");
        assertArrayEquals(new Throwable[] { localFailure }, err.getSuppressed(), "Mismatched suppressed failures");
    }

    @Test
    void readFailureOnSecondChunkLeavesFirstChunk() throws IOException {
        byte[] data = createTestData(70000);
        channel.addFile(REMOTE_PATH, data);
        IOException failure = new IOException("Simulated read failure");
        channel.failOn(InMemorySftpChannel.Operation.READ, 2, failure);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.READ, result.getStage(), "Mismatched stage");
        assertSame(failure, result.getCause(), "Cause not preserved");
        assertTrue(result.getStage().isTransferStage(), "Not reported as transfer stage");

        byte[] written = Files.readAllBytes(localPath);
        assertArrayEquals(Arrays.copyOf(data, 32768), written, "Mismatched partial content");
        assertEquals(Arrays.asList("remote.close " + REMOTE_PATH, "local.close " + LOCAL_NAME),
                journal.subList(journal.size() - 2, journal.size()), "Mismatched closing sequence");
        assertAllHandlesClosed();
    }

    @Test
    void writeFailureLeavesPartialFile() throws IOException {
        byte[] data = createTestData(70000);
        channel.addFile(REMOTE_PATH, data);
        IOException failure = new IOException("No space left on device");
        localFs.failOn(RecordingLocalFileSystem.Operation.WRITE, 3, failure);

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath);
        assertSame(DownloadStage.WRITE, result.getStage(), "Mismatched stage");
        assertSame(failure, result.getCause(), "Cause not preserved");
        assertArrayEquals(Arrays.copyOf(data, 65536), Files.readAllBytes(localPath), "Mismatched partial content");
        assertEquals(3, channel.getInvocations(InMemorySftpChannel.Operation.READ), "Reading continued after failure");
        assertAllHandlesClosed();
    }

    @Test
    void missingRemoteFileReportedAsRemoteOpen() {
        DownloadResult result = new ChunkedDownloader(localFs).download(channel, "/no/such/file", localPath);
        assertSame(DownloadStage.REMOTE_OPEN, result.getStage(), "Mismatched stage");
        SftpException cause = (SftpException) result.getCause();
        assertEquals(SftpConstants.SSH_FX_NO_SUCH_FILE, cause.getStatus(), "Mismatched status");
    }

    @Test
    void defaultConfigurationUsedWhenNoneGiven() throws IOException {
        channel.addFile(REMOTE_PATH, createTestData(40000));
        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath, null);
        assertTrue(result.isSuccess(), "Download failed: " + result);

        List<String> explicitJournal = new ArrayList<>();
        InMemorySftpChannel explicitChannel = new InMemorySftpChannel(explicitJournal)
                .addFile(REMOTE_PATH, createTestData(40000));
        RecordingLocalFileSystem explicitFs = new RecordingLocalFileSystem(explicitJournal);
        TransferConfiguration explicit = TransferConfiguration.builder()
                .chunkSize(32768)
                .operationTimeout(5000L)
                .remoteOpenModes(TransferConfiguration.DEFAULT_REMOTE_OPEN_MODES)
                .localOpenModes(TransferConfiguration.DEFAULT_LOCAL_OPEN_MODES)
                .build();
        Path explicitPath = localPath.resolveSibling("explicit-" + LOCAL_NAME);
        DownloadResult explicitResult = new ChunkedDownloader(explicitFs)
                .download(explicitChannel, REMOTE_PATH, explicitPath, explicit);
        assertTrue(explicitResult.isSuccess(), "Explicit download failed: " + explicitResult);

        assertEquals(channel.getReadCounts(), explicitChannel.getReadCounts(), "Mismatched reads");
        assertEquals(localFs.getWriteLengths(), explicitFs.getWriteLengths(), "Mismatched writes");
        assertEquals(channel.getMaxRequestedLength(), explicitChannel.getMaxRequestedLength(), "Mismatched chunk");
        assertEquals(channel.getLastOpenModes(), explicitChannel.getLastOpenModes(), "Mismatched remote modes");
        assertEquals(Duration.ofMillis(5000L), channel.getLastTimeout(), "Mismatched default timeout");
        assertEquals(channel.getLastTimeout(), explicitChannel.getLastTimeout(), "Mismatched timeout");
        assertArrayEquals(Files.readAllBytes(localPath), Files.readAllBytes(explicitPath), "Mismatched content");
    }

    @Test
    void configuredTimeoutPassedToRemoteOperations() {
        channel.addFile(REMOTE_PATH, createTestData(100));
        TransferConfiguration config = TransferConfiguration.builder().operationTimeout(Duration.ofSeconds(7L)).build();

        DownloadResult result = new ChunkedDownloader(localFs).download(channel, REMOTE_PATH, localPath, config);
        assertTrue(result.isSuccess(), "Download failed: " + result);
        assertEquals(Duration.ofSeconds(7L), channel.getLastTimeout(), "Mismatched timeout");
    }

    @Test
    void listenerNotifiedOfProgress() {
        channel.addFile(REMOTE_PATH, createTestData(70000));
        List<String> events = new ArrayList<>();
        DownloadEventListener listener = new DownloadEventListener() {
            @Override
            public void startDownload(String remotePath, Path localPath, TransferConfiguration config) {
                events.add("start " + remotePath + " chunk=" + config.getChunkSize());
            }

            @Override
            public void chunkWritten(String remotePath, Path localPath, long offset, int length) {
                events.add("chunk " + offset + "/" + length);
            }

            @Override
            public void endDownload(String remotePath, Path localPath, long length, DownloadResult result) {
                events.add("end " + length + " " + result.isSuccess());
            }
        };

        DownloadResult result = new ChunkedDownloader(localFs, listener).download(channel, REMOTE_PATH, localPath);
        assertTrue(result.isSuccess(), "Download failed: " + result);
        assertEquals(Arrays.asList(
                "start " + REMOTE_PATH + " chunk=32768",
                "chunk 0/32768",
                "chunk 32768/32768",
                "chunk 65536/4464",
                "end 70000 true"), events, "Mismatched events");
    }

    @Test
    void listenerFailureDoesNotAffectDownload() throws IOException {
        byte[] data = createTestData(70000);
        channel.addFile(REMOTE_PATH, data);
        DownloadEventListener listener = new DownloadEventListener() {
            @Override
            public void chunkWritten(String remotePath, Path localPath, long offset, int length) {
                throw new IllegalStateException("Simulated listener failure at offset=" + offset);
            }
        };

        DownloadResult result = new ChunkedDownloader(localFs, listener).download(channel, REMOTE_PATH, localPath);
        assertTrue(result.isSuccess(), "Download failed: " + result);
        assertArrayEquals(data, Files.readAllBytes(localPath), "Mismatched local content");
    }

    @Test
    void unexpectedExceptionStillReleasesResources() {
        channel.addFile(REMOTE_PATH, createTestData(1024));
        RecordingLocalFileSystem brokenFs = new RecordingLocalFileSystem(journal) {
            @Override
            public void write(LocalHandle handle, byte[] data, int offset, int len) throws IOException {
                throw new IllegalStateException("Simulated bug");
            }
        };

        ChunkedDownloader downloader = new ChunkedDownloader(brokenFs);
        assertThrows(IllegalStateException.class, () -> downloader.download(channel, REMOTE_PATH, localPath));
        for (RemoteHandle handle : channel.getHandles()) {
            assertFalse(handle.isOpen(), "Remote handle not closed: " + handle);
        }
        for (LocalHandle handle : brokenFs.getHandles()) {
            assertFalse(handle.isOpen(), "Local handle not closed: " + handle);
        }
    }

    @Test
    void releaseFailureDoesNotHideUnexpectedException() {
        channel.addFile(REMOTE_PATH, createTestData(1024));
        IllegalStateException writeFailure = new IllegalStateException("Simulated write bug");
        IllegalStateException closeFailure = new IllegalStateException("Simulated close bug");
        RecordingLocalFileSystem brokenFs = new RecordingLocalFileSystem(journal) {
            @Override
            public void write(LocalHandle handle, byte[] data, int offset, int len) throws IOException {
                throw writeFailure;
            }

            @Override
            public void close(LocalHandle handle) throws IOException {
                super.close(handle);
                throw closeFailure;
            }
        };

        ChunkedDownloader downloader = new ChunkedDownloader(brokenFs);
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> downloader.download(channel, REMOTE_PATH, localPath));
        assertSame(writeFailure, e, "Original exception not propagated");
        assertArrayEquals(new Throwable[] { closeFailure }, e.getSuppressed(), "Release failure not suppressed");
        for (RemoteHandle handle : channel.getHandles()) {
            assertFalse(handle.isOpen(), "Remote handle not closed: " + handle);
        }
        for (LocalHandle handle : brokenFs.getHandles()) {
            assertFalse(handle.isOpen(), "Local handle not closed: " + handle);
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void remoteReadTimeoutReportedAsReadFailure() throws IOException {
        SftpClient client = Mockito.mock(SftpClient.class);
        SftpClient.CloseableHandle sftpHandle
                = new DefaultCloseableHandle(client, REMOTE_PATH, REMOTE_PATH.getBytes(StandardCharsets.UTF_8));
        Mockito.when(client.open(ArgumentMatchers.eq(REMOTE_PATH), ArgumentMatchers.any(Collection.class)))
                .thenReturn(sftpHandle);
        CountDownLatch stalled = new CountDownLatch(1);
        Mockito.when(client.read(ArgumentMatchers.any(SftpClient.Handle.class), ArgumentMatchers.anyLong(),
                ArgumentMatchers.any(byte[].class), ArgumentMatchers.anyInt(), ArgumentMatchers.anyInt()))
                .thenAnswer(invocation -> {
                    stalled.await(5L, TimeUnit.SECONDS);
                    return -1;
                });

        TransferConfiguration config = TransferConfiguration.builder().operationTimeout(100L).build();
        DownloadResult result;
        try (SftpClientChannel sftpChannel = new SftpClientChannel(client)) {
            result = new ChunkedDownloader(localFs).download(sftpChannel, REMOTE_PATH, localPath, config);
        } finally {
            stalled.countDown();
        }

        assertSame(DownloadStage.READ, result.getStage(), "Mismatched stage: " + result);
        assertTrue(result.getCause() instanceof SocketTimeoutException, "Unexpected cause: " + result.getCause());
        assertTrue(result.getCleanupFailures().isEmpty(), "Unexpected cleanup failures: " + result);
        Mockito.verify(client, Mockito.times(1)).close(sftpHandle);
        assertEquals(Arrays.asList("local.open " + LOCAL_NAME, "local.close " + LOCAL_NAME), journal);
        for (LocalHandle handle : localFs.getHandles()) {
            assertFalse(handle.isOpen(), "Local handle not closed: " + handle);
        }
    }

    @Test
    void invalidArgumentsRejected() {
        ChunkedDownloader downloader = new ChunkedDownloader(localFs);
        assertThrows(NullPointerException.class, () -> downloader.download(null, REMOTE_PATH, localPath));
        assertThrows(IllegalArgumentException.class, () -> downloader.download(channel, "", localPath));
        assertThrows(NullPointerException.class, () -> downloader.download(channel, REMOTE_PATH, null));
        assertTrue(journal.isEmpty(), "Unexpected operations: " + journal);
    }

    private void assertAllHandlesClosed() {
        for (RemoteHandle handle : channel.getHandles()) {
            assertFalse(handle.isOpen(), "Remote handle not closed: " + handle);
        }
        for (LocalHandle handle : localFs.getHandles()) {
            assertFalse(handle.isOpen(), "Local handle not closed: " + handle);
        }
    }
}
