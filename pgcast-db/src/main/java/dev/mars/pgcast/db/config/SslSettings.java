package dev.mars.pgcast.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.Locale;
import java.util.Objects;

/**
 * Transport security settings for the dedicated notification connection and the pool.
 *
 * <ul>
 *   <li>{@link Mode#PREFER}: try TLS first, fall back to plaintext only when the server
 *       reports that it does not support SSL.</li>
 *   <li>{@link Mode#REQUIRED}: TLS with explicit parameters, no downgrade.</li>
 *   <li>{@link Mode#DISABLED}: plaintext.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class SslSettings {

    public enum Mode {
        PREFER,
        REQUIRED,
        DISABLED;

        /**
         * Parses a mode name as used in properties files ("prefer", "required", "disabled").
         * "require", "true" and "false" are accepted as aliases.
         */
        public static Mode parse(String value) {
            Objects.requireNonNull(value, "ssl mode");
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "prefer":
                    return PREFER;
                case "required":
                case "require":
                case "true":
                    return REQUIRED;
                case "disabled":
                case "disable":
                case "false":
                    return DISABLED;
                default:
                    throw new IllegalArgumentException("Unknown ssl mode: '" + value
                        + "'. Expected one of: prefer, required, disabled");
            }
        }
    }

    private static final SslSettings PREFER = new SslSettings(Mode.PREFER, false, null);
    private static final SslSettings DISABLED = new SslSettings(Mode.DISABLED, false, null);

    private final Mode mode;
    private final boolean rejectUnauthorized;
    private final String caPem;

    private SslSettings(Mode mode, boolean rejectUnauthorized, String caPem) {
        this.mode = mode;
        this.rejectUnauthorized = rejectUnauthorized;
        this.caPem = caPem;
    }

    public static SslSettings prefer() {
        return PREFER;
    }

    public static SslSettings disabled() {
        return DISABLED;
    }

    /**
     * TLS without fallback. When {@code rejectUnauthorized} is set the server certificate must
     * chain to a trusted CA and match the host being connected to.
     *
     * @param rejectUnauthorized whether the server certificate and host name are verified
     * @param caPem optional PEM encoded CA certificate(s) to trust, null to use the JVM trust store
     */
    public static SslSettings required(boolean rejectUnauthorized, String caPem) {
        return new SslSettings(Mode.REQUIRED, rejectUnauthorized, caPem);
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isRejectUnauthorized() {
        return rejectUnauthorized;
    }

    public String getCaPem() {
        return caPem;
    }

    @Override
    public String toString() {
        return "SslSettings{mode=" + mode
            + (mode == Mode.REQUIRED ? ", rejectUnauthorized=" + rejectUnauthorized + ", ca=" + (caPem != null ? "provided" : "none") : "")
            + '}';
    }
}
