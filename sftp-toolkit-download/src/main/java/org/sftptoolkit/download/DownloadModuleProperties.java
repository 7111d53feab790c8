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

import java.time.Duration;

import org.apache.sshd.common.Property;
import org.apache.sshd.common.util.ValidateUtils;
import org.sftptoolkit.download.local.LocalOpenMode;
import org.sftptoolkit.download.remote.RemoteOpenMode;

/**
 * Configurable properties for downloads - can be set on any {@link org.apache.sshd.common.PropertyResolver} (client,
 * session, etc.) and are resolved by {@link TransferConfiguration#resolve(org.apache.sshd.common.PropertyResolver)}.
 */
public final class DownloadModuleProperties {

    /**
     * Maximum number of bytes requested by each read - also the size of the transfer buffer
     */
    public static final Property<Integer> CHUNK_SIZE = Property.validating(
            Property.integer("sftp-download-chunk-size", TransferConfiguration.DEFAULT_CHUNK_SIZE),
            v -> ValidateUtils.checkTrue(v > 0, "Invalid chunk size: %d", v));

    /**
     * Timeout (msec.) applied to each remote open/read/close - not to the whole download
     */
    public static final Property<Duration> OPERATION_TIMEOUT
            = Property.duration("sftp-download-operation-timeout", TransferConfiguration.DEFAULT_OPERATION_TIMEOUT);

    /**
     * Comma-separated list of {@link RemoteOpenMode} names
     */
    public static final Property<String> REMOTE_OPEN_MODE
            = Property.string("sftp-download-remote-mode",
                    RemoteOpenMode.toString(TransferConfiguration.DEFAULT_REMOTE_OPEN_MODES));

    /**
     * Comma-separated list of {@link LocalOpenMode} names
     */
    public static final Property<String> LOCAL_OPEN_MODE
            = Property.string("sftp-download-local-mode",
                    LocalOpenMode.toString(TransferConfiguration.DEFAULT_LOCAL_OPEN_MODES));

    private DownloadModuleProperties() {
        throw new UnsupportedOperationException("No instance");
    }
}
