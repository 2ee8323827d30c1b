package dev.mars.pgcast.api.error;

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

/**
 * Standard error codes for the PgCast broadcast layer.
 *
 * Error code ranges:
 * - PGCERR0001-0049: General/System errors
 * - PGCERR0100-0149: Setup/Configuration errors
 * - PGCERR0400-0449: Notification delivery errors
 * - PGCERR0500-0549: Database/Connection errors
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PgCastErrorCodes {

    private PgCastErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String CLOSED = "PGCERR0001";

    // ========================================================================
    // Setup/Configuration Errors (0100-0149)
    // ========================================================================
    public static final String NOT_INITIALIZED = "PGCERR0100";
    public static final String INVALID_CONFIG = "PGCERR0101";

    // ========================================================================
    // Notification Delivery Errors (0400-0449)
    // ========================================================================
    public static final String CALLBACK_FAILED = "PGCERR0400";
    public static final String PAYLOAD_CODEC_FAILED = "PGCERR0401";

    // ========================================================================
    // Database/Connection Errors (0500-0549)
    // ========================================================================
    public static final String CONNECTION_FAILED = "PGCERR0500";
    public static final String LISTEN_FAILED = "PGCERR0501";
    public static final String LOCK_FAILED = "PGCERR0502";
}
