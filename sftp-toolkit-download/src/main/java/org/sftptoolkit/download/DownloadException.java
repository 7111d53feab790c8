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
import java.util.Objects;

/**
 * Thrown by {@link DownloadResult#verify()} for a failed download. The original cause is kept as-is, and failures of
 * the cleanup that followed it are attached as suppressed exceptions.
 */
public class DownloadException extends IOException {
    private static final long serialVersionUID = -2751620962736094451L;

    private final DownloadStage stage;

    public DownloadException(DownloadStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "No stage");
    }

    public DownloadStage getStage() {
        return stage;
    }
}
