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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.sshd.common.util.GenericUtils;

/**
 * The outcome of a single download - either success or a failure tagged with the {@link DownloadStage} that failed
 * and the exact exception reported by the failing collaborator.
 */
public final class DownloadResult {
    private static final DownloadResult SUCCESS = new DownloadResult(null, null, Collections.emptyList());

    private final DownloadStage stage;
    private final IOException cause;
    private final List<IOException> cleanupFailures;

    private DownloadResult(DownloadStage stage, IOException cause, List<IOException> cleanupFailures) {
        this.stage = stage;
        this.cause = cause;
        this.cleanupFailures = cleanupFailures;
    }

    public static DownloadResult success() {
        return SUCCESS;
    }

    public static DownloadResult failure(DownloadStage stage, IOException cause) {
        return failure(stage, cause, Collections.emptyList());
    }

    /**
     * @param  stage           The {@link DownloadStage} that failed
     * @param  cause           The failure reported by the collaborator
     * @param  cleanupFailures Failures encountered while releasing the resources after the original one - may be
     *                         {@code null}/empty
     * @return                 The failed result
     */
    public static DownloadResult failure(
            DownloadStage stage, IOException cause, Collection<? extends IOException> cleanupFailures) {
        return new DownloadResult(
                Objects.requireNonNull(stage, "No failed stage"),
                Objects.requireNonNull(cause, "No failure cause"),
                GenericUtils.isEmpty(cleanupFailures)
                        ? Collections.emptyList()
                        : Collections.unmodifiableList(new ArrayList<>(cleanupFailures)));
    }

    public boolean isSuccess() {
        return stage == null;
    }

    /**
     * @return The failed {@link DownloadStage} - {@code null} if successful
     */
    public DownloadStage getStage() {
        return stage;
    }

    /**
     * @return The failure as reported by the failing collaborator - {@code null} if successful
     */
    public IOException getCause() {
        return cause;
    }

    /**
     * @return Failures that occurred while releasing resources after the reported one - never {@code null}
     */
    public List<IOException> getCleanupFailures() {
        return cleanupFailures;
    }

    /**
     * @return                   This instance if successful
     * @throws DownloadException If the download failed
     */
    public DownloadResult verify() throws DownloadException {
        if (isSuccess()) {
            return this;
        }

        DownloadException err = new DownloadException(stage, stage.getName() + ": " + cause.getMessage(), cause);
        for (IOException e : cleanupFailures) {
            err.addSuppressed(e);
        }
        throw err;
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, cause);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (obj.getClass() != getClass())) {
            return false;
        }

        DownloadResult other = (DownloadResult) obj;
        return (stage == other.stage)
                && Objects.equals(cause, other.cause)
                && Objects.equals(cleanupFailures, other.cleanupFailures);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "DownloadResult[ok]";
        }

        return "DownloadResult[" + stage.getName() + ": " + cause
               + (cleanupFailures.isEmpty() ? "" : ", cleanupFailures=" + cleanupFailures)
               + "]";
    }
}
