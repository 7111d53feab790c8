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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.sftp.client.SftpClient;

/**
 * Capabilities requested when opening a file on the remote side.
 */
public enum RemoteOpenMode implements NamedResource {
    READ("read", SftpClient.OpenMode.Read),
    WRITE("write", SftpClient.OpenMode.Write),
    CREATE("create", SftpClient.OpenMode.Create),
    TRUNCATE("truncate", SftpClient.OpenMode.Truncate),
    APPEND("append", SftpClient.OpenMode.Append),
    /**
     * Accepted for compatibility with file-mode conventions - SFTP transfers are always binary, so it has no
     * {@link SftpClient.OpenMode} counterpart
     */
    BINARY("binary", null);

    public static final Set<RemoteOpenMode> VALUES = Collections.unmodifiableSet(EnumSet.allOf(RemoteOpenMode.class));

    private final String modeName;
    private final SftpClient.OpenMode sftpMode;

    RemoteOpenMode(String name, SftpClient.OpenMode sftpMode) {
        this.modeName = name;
        this.sftpMode = sftpMode;
    }

    @Override
    public String getName() {
        return modeName;
    }

    /**
     * @return The matching {@link SftpClient.OpenMode} - {@code null} if none
     */
    public SftpClient.OpenMode getSftpMode() {
        return sftpMode;
    }

    /**
     * @param  name The mode name - case <U>insensitive</U>
     * @return      The matching {@link RemoteOpenMode} - {@code null} if no match found
     */
    public static RemoteOpenMode fromName(String name) {
        return NamedResource.findByName(name, String.CASE_INSENSITIVE_ORDER, VALUES);
    }

    /**
     * @param  value                    A comma-separated list of mode names
     * @return                          The parsed modes - empty if {@code null}/empty value
     * @throws IllegalArgumentException If an unknown mode name is encountered
     */
    public static Set<RemoteOpenMode> parseModes(String value) {
        String[] names = GenericUtils.split(value, ',');
        if (GenericUtils.isEmpty(names)) {
            return Collections.emptySet();
        }

        Set<RemoteOpenMode> modes = EnumSet.noneOf(RemoteOpenMode.class);
        for (String n : names) {
            n = GenericUtils.trimToEmpty(n);
            if (GenericUtils.isEmpty(n)) {
                continue;
            }

            RemoteOpenMode mode = fromName(n);
            ValidateUtils.checkNotNull(mode, "Unknown remote open mode: %s", n);
            modes.add(mode);
        }

        return modes;
    }

    /**
     * Makes sure the modes can be used to download a file
     *
     * @param  modes                    The requested modes
     * @return                          An unmodifiable copy of the modes
     * @throws IllegalArgumentException If no modes specified or {@link #READ} is not among them
     */
    public static Set<RemoteOpenMode> validate(Collection<RemoteOpenMode> modes) {
        ValidateUtils.checkNotNullAndNotEmpty(modes, "No remote open modes specified");
        ValidateUtils.checkTrue(modes.contains(READ), "Remote open modes do not allow reading: %s", modes);
        return Collections.unmodifiableSet(EnumSet.copyOf(modes));
    }

    /**
     * @param  modes The requested modes - ignored if {@code null}/empty
     * @return       The equivalent {@link SftpClient.OpenMode}s
     */
    public static Set<SftpClient.OpenMode> toSftpModes(Collection<RemoteOpenMode> modes) {
        if (GenericUtils.isEmpty(modes)) {
            return Collections.emptySet();
        }

        Set<SftpClient.OpenMode> result = EnumSet.noneOf(SftpClient.OpenMode.class);
        for (RemoteOpenMode m : modes) {
            SftpClient.OpenMode sftpMode = m.getSftpMode();
            if (sftpMode != null) {
                result.add(sftpMode);
            }
        }

        return result;
    }

    public static String toString(Collection<RemoteOpenMode> modes) {
        return NamedResource.getNames(modes).toLowerCase(Locale.ENGLISH);
    }
}
