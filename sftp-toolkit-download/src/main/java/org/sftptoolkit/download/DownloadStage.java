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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.sshd.common.NamedResource;

/**
 * The stages of a download, in the order they are executed. A failed download is tagged with the first stage that
 * failed.
 */
public enum DownloadStage implements NamedResource {
    REMOTE_OPEN("remote_open"),
    LOCAL_OPEN("local_open"),
    READ("download.read"),
    WRITE("download.write"),
    REMOTE_CLOSE("remote_close"),
    LOCAL_CLOSE("local_close");

    public static final Set<DownloadStage> VALUES = Collections.unmodifiableSet(EnumSet.allOf(DownloadStage.class));

    private final String tag;

    DownloadStage(String tag) {
        this.tag = tag;
    }

    /**
     * @return The stage tag - e.g., {@code download.read}
     */
    @Override
    public String getName() {
        return tag;
    }

    /**
     * @return {@code true} if the stage belongs to the copy loop
     */
    public boolean isTransferStage() {
        return (this == READ) || (this == WRITE);
    }

    public static DownloadStage fromName(String name) {
        return NamedResource.findByName(name, String.CASE_INSENSITIVE_ORDER, VALUES);
    }
}
