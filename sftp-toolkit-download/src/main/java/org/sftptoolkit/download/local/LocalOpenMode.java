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
package org.sftptoolkit.download.local;

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * Modes used to open the local file that receives the downloaded data. The semantics follow the usual file mode
 * conventions:
 * <UL>
 * <LI>{@link #WRITE} - creates the file if missing and truncates it, unless combined with {@link #READ} or
 * {@link #APPEND}</LI>
 * <LI>{@link #APPEND} - writes at the end of the file, creating it if missing</LI>
 * <LI>{@link #EXCLUSIVE} - fails if the file already exists</LI>
 * <LI>{@link #READ} - also opens the file for reading</LI>
 * <LI>{@link #SYNC} - requires every update to be written synchronously to the storage device</LI>
 * <LI>{@link #BINARY} - ignored, data is always handled as raw bytes</LI>
 * </UL>
 */
public enum LocalOpenMode implements NamedResource {
    READ("read"),
    WRITE("write"),
    APPEND("append"),
    EXCLUSIVE("exclusive"),
    SYNC("sync"),
    BINARY("binary");

    public static final Set<LocalOpenMode> VALUES = Collections.unmodifiableSet(EnumSet.allOf(LocalOpenMode.class));

    private final String modeName;

    LocalOpenMode(String name) {
        this.modeName = name;
    }

    @Override
    public String getName() {
        return modeName;
    }

    public static LocalOpenMode fromName(String name) {
        return NamedResource.findByName(name, String.CASE_INSENSITIVE_ORDER, VALUES);
    }

    /**
     * @param  value                    A comma-separated list of mode names
     * @return                          The parsed modes - empty if {@code null}/empty value
     * @throws IllegalArgumentException If an unknown mode name is encountered
     */
    public static Set<LocalOpenMode> parseModes(String value) {
        String[] names = GenericUtils.split(value, ',');
        if (GenericUtils.isEmpty(names)) {
            return Collections.emptySet();
        }

        Set<LocalOpenMode> modes = EnumSet.noneOf(LocalOpenMode.class);
        for (String n : names) {
            n = GenericUtils.trimToEmpty(n);
            if (GenericUtils.isEmpty(n)) {
                continue;
            }

            LocalOpenMode mode = fromName(n);
            ValidateUtils.checkNotNull(mode, "Unknown local open mode: %s", n);
            modes.add(mode);
        }

        return modes;
    }

    /**
     * Makes sure the modes can be used to store downloaded data
     *
     * @param  modes                    The requested modes
     * @return                          An unmodifiable copy of the modes
     * @throws IllegalArgumentException If no write access requested or the combination is not supported
     */
    public static Set<LocalOpenMode> validate(Collection<LocalOpenMode> modes) {
        ValidateUtils.checkNotNullAndNotEmpty(modes, "No local open modes specified");
        ValidateUtils.checkTrue(modes.contains(WRITE) || modes.contains(APPEND),
                "Local open modes do not allow writing: %s", modes);
        ValidateUtils.checkTrue(!(modes.contains(READ) && modes.contains(APPEND)),
                "Reading is not supported in append mode: %s", modes);
        return Collections.unmodifiableSet(EnumSet.copyOf(modes));
    }

    /**
     * @param  modes                    The requested modes
     * @return                          The equivalent {@link OpenOption}s
     * @throws IllegalArgumentException If the modes do not pass {@link #validate(Collection) validation}
     */
    public static Set<OpenOption> toOpenOptions(Collection<LocalOpenMode> modes) {
        validate(modes);

        boolean read = modes.contains(READ);
        boolean append = modes.contains(APPEND);
        boolean exclusive = modes.contains(EXCLUSIVE);

        Set<OpenOption> options = new LinkedHashSet<>();
        options.add(StandardOpenOption.WRITE);
        options.add(exclusive ? StandardOpenOption.CREATE_NEW : StandardOpenOption.CREATE);
        if (append) {
            options.add(StandardOpenOption.APPEND);
        } else if ((!read) && (!exclusive)) {
            options.add(StandardOpenOption.TRUNCATE_EXISTING);
        }

        if (read) {
            options.add(StandardOpenOption.READ);
        }
        if (modes.contains(SYNC)) {
            options.add(StandardOpenOption.SYNC);
        }

        return options;
    }

    public static String toString(Collection<LocalOpenMode> modes) {
        return NamedResource.getNames(modes).toLowerCase(Locale.ENGLISH);
    }
}
