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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.apache.sshd.common.PropertyResolver;
import org.apache.sshd.common.util.ValidateUtils;
import org.sftptoolkit.download.local.LocalOpenMode;
import org.sftptoolkit.download.remote.RemoteOpenMode;

/**
 * Immutable settings of a single download. Settings that are not specified fall back to their defaults
 * independently of each other.
 */
public final class TransferConfiguration {
    public static final int DEFAULT_CHUNK_SIZE = 32768;

    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofMillis(5000L);

    public static final Set<RemoteOpenMode> DEFAULT_REMOTE_OPEN_MODES
            = Collections.unmodifiableSet(EnumSet.of(RemoteOpenMode.READ, RemoteOpenMode.BINARY));

    public static final Set<LocalOpenMode> DEFAULT_LOCAL_OPEN_MODES
            = Collections.unmodifiableSet(EnumSet.of(LocalOpenMode.WRITE, LocalOpenMode.BINARY));

    public static final TransferConfiguration DEFAULT = builder().build();

    private final int chunkSize;
    private final Duration operationTimeout;
    private final Set<RemoteOpenMode> remoteOpenModes;
    private final Set<LocalOpenMode> localOpenModes;

    private TransferConfiguration(Builder builder) {
        chunkSize = (builder.chunkSize == null) ? DEFAULT_CHUNK_SIZE : builder.chunkSize;
        ValidateUtils.checkTrue(chunkSize > 0, "Invalid chunk size: %d", chunkSize);

        operationTimeout = (builder.operationTimeout == null) ? DEFAULT_OPERATION_TIMEOUT : builder.operationTimeout;
        ValidateUtils.checkTrue(!operationTimeout.isNegative(), "Negative operation timeout: %s", operationTimeout);

        remoteOpenModes = RemoteOpenMode.validate(
                (builder.remoteOpenModes == null) ? DEFAULT_REMOTE_OPEN_MODES : builder.remoteOpenModes);
        localOpenModes = LocalOpenMode.validate(
                (builder.localOpenModes == null) ? DEFAULT_LOCAL_OPEN_MODES : builder.localOpenModes);
    }

    /**
     * @return Maximum number of bytes read and written per loop iteration - also the size of the only buffer
     *         allocated by the download
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * @return Timeout applied to <U>each</U> remote operation - zero means no limit
     */
    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public Set<RemoteOpenMode> getRemoteOpenModes() {
        return remoteOpenModes;
    }

    public Set<LocalOpenMode> getLocalOpenModes() {
        return localOpenModes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .chunkSize(getChunkSize())
                .operationTimeout(getOperationTimeout())
                .remoteOpenModes(getRemoteOpenModes())
                .localOpenModes(getLocalOpenModes());
    }

    /**
     * Builds a configuration from the {@link DownloadModuleProperties} found in the resolver (or its ancestors)
     *
     * @param  resolver                 The {@link PropertyResolver} - if {@code null} then {@link #DEFAULT} is used
     * @return                          The resolved configuration
     * @throws IllegalArgumentException If any of the values is invalid
     */
    public static TransferConfiguration resolve(PropertyResolver resolver) {
        if (resolver == null) {
            return DEFAULT;
        }

        String remoteModes = DownloadModuleProperties.REMOTE_OPEN_MODE.getRequired(resolver);
        String localModes = DownloadModuleProperties.LOCAL_OPEN_MODE.getRequired(resolver);
        return builder()
                .chunkSize(DownloadModuleProperties.CHUNK_SIZE.getRequired(resolver))
                .operationTimeout(DownloadModuleProperties.OPERATION_TIMEOUT.getRequired(resolver))
                .remoteOpenModes(RemoteOpenMode.parseModes(remoteModes))
                .localOpenModes(LocalOpenMode.parseModes(localModes))
                .build();
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkSize, operationTimeout, remoteOpenModes, localOpenModes);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (obj.getClass() != getClass())) {
            return false;
        }

        TransferConfiguration other = (TransferConfiguration) obj;
        return (chunkSize == other.chunkSize)
                && Objects.equals(operationTimeout, other.operationTimeout)
                && Objects.equals(remoteOpenModes, other.remoteOpenModes)
                && Objects.equals(localOpenModes, other.localOpenModes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[chunkSize=" + getChunkSize()
               + ", operationTimeout=" + getOperationTimeout()
               + ", remoteOpenModes=" + RemoteOpenMode.toString(getRemoteOpenModes())
               + ", localOpenModes=" + LocalOpenMode.toString(getLocalOpenModes())
               + "]";
    }

    public static final class Builder {
        private Integer chunkSize;
        private Duration operationTimeout;
        private Set<RemoteOpenMode> remoteOpenModes;
        private Set<LocalOpenMode> localOpenModes;

        private Builder() {
            super();
        }

        /**
         * @param  chunkSize The chunk size - {@code null} restores the default
         * @return           This builder
         */
        public Builder chunkSize(Integer chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder operationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        public Builder operationTimeout(long timeoutMillis) {
            return operationTimeout(Duration.ofMillis(timeoutMillis));
        }

        public Builder remoteOpenModes(Collection<RemoteOpenMode> modes) {
            this.remoteOpenModes = (modes == null) ? null : copyOf(modes, RemoteOpenMode.class);
            return this;
        }

        public Builder remoteOpenModes(RemoteOpenMode... modes) {
            return remoteOpenModes((modes == null) ? null : Arrays.asList(modes));
        }

        public Builder localOpenModes(Collection<LocalOpenMode> modes) {
            this.localOpenModes = (modes == null) ? null : copyOf(modes, LocalOpenMode.class);
            return this;
        }

        public Builder localOpenModes(LocalOpenMode... modes) {
            return localOpenModes((modes == null) ? null : Arrays.asList(modes));
        }

        public TransferConfiguration build() {
            return new TransferConfiguration(this);
        }

        private static <E extends Enum<E>> Set<E> copyOf(Collection<E> values, Class<E> type) {
            Set<E> result = EnumSet.noneOf(type);
            result.addAll(values);
            return result;
        }
    }
}
