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
 * A subscriber handler threw while a notification was being fanned out.
 * Handlers registered after the failing one did not receive the notification.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class CallbackFailureException extends PgCastException {

    private final String channel;

    public CallbackFailureException(String channel, Throwable cause) {
        super(PgCastErrorCodes.CALLBACK_FAILED, "Notification handler failed on channel '" + channel + "'", cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
