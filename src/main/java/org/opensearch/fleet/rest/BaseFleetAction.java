/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.OpenSearchException;
import org.opensearch.common.time.DateFormatter;
import org.opensearch.common.time.DateMathParser;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.rest.BaseRestHandler;
import org.opensearch.rest.BytesRestResponse;
import org.opensearch.rest.RestRequest;

import java.util.function.LongSupplier;

/**
 * Shared plumbing of the fleet REST handlers: parameter parsing and translation of failures into
 * {@code {"error": ...}} responses carrying the failure's status.
 */
public abstract class BaseFleetAction extends BaseRestHandler {

    private static final Logger logger = LogManager.getLogger(BaseFleetAction.class);

    protected static final String BASE_PATH = "/_fleet";
    protected static final String CLIENT_PATH = BASE_PATH + "/clients/{client_id}";

    protected static final String CLIENT_ID_PARAM = "client_id";
    protected static final String START_PARAM = "start";
    protected static final String END_PARAM = "end";
    protected static final String OFFSET_PARAM = "offset";
    protected static final String COUNT_PARAM = "count";
    protected static final String ERROR_FIELD = "error";

    /** Header naming the user on whose behalf a mutating request runs. */
    public static final String USER_HEADER = "X-Fleet-User";

    private static final DateMathParser DATE_MATH_PARSER = DateFormatter.forPattern("strict_date_optional_time||epoch_millis")
        .toDateMathParser();

    private final LongSupplier clock;

    protected BaseFleetAction(LongSupplier clock) {
        this.clock = clock;
    }

    protected long nowMillis() {
        return clock.getAsLong();
    }

    /**
     * Parses a date math or epoch millis time parameter value.
     *
     * @return the time in epoch millis, or null if the value is absent
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    protected static Long parseTime(String paramName, String timeString, long nowMillis) {
        if (timeString == null || timeString.isEmpty()) {
            return null;
        }
        try {
            return DATE_MATH_PARSER.parse(timeString, () -> nowMillis).toEpochMilli();
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid [" + paramName + "] time [" + timeString + "]", e);
        }
    }

    protected static int parseNonNegativeInt(String paramName, String value, int defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid [" + paramName + "] value [" + value + "]", e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException("[" + paramName + "] must be >= 0, got " + parsed);
        }
        return parsed;
    }

    /**
     * @throws IllegalArgumentException if the user header is missing or blank
     */
    protected static String requireUser(RestRequest request) {
        String user = request.header(USER_HEADER);
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("Missing [" + USER_HEADER + "] header");
        }
        return user;
    }

    /**
     * Responds with {@code body} and status 200.
     */
    protected static RestChannelConsumer respond(ToXContent body) {
        return channel -> {
            XContentBuilder builder = channel.newBuilder();
            body.toXContent(builder, ToXContent.EMPTY_PARAMS);
            channel.sendResponse(new BytesRestResponse(RestStatus.OK, builder));
        };
    }

    protected static RestChannelConsumer errorResponse(RestStatus status, String message) {
        return channel -> {
            XContentBuilder response = channel.newErrorBuilder();
            response.startObject();
            response.field(ERROR_FIELD, message);
            response.endObject();
            channel.sendResponse(new BytesRestResponse(status, response));
        };
    }

    /**
     * Maps a failure to an error response: the status of an {@link OpenSearchException}, 400 for an
     * {@link IllegalArgumentException}, 500 otherwise.
     */
    protected static RestChannelConsumer failureResponse(Exception e) {
        if (e instanceof OpenSearchException) {
            OpenSearchException ose = (OpenSearchException) e;
            if (ose.status().getStatus() >= 500) {
                logger.warn("Fleet request failed", e);
            }
            return errorResponse(ose.status(), e.getMessage());
        }
        if (e instanceof IllegalArgumentException) {
            return errorResponse(RestStatus.BAD_REQUEST, e.getMessage());
        }
        logger.error("Unexpected failure handling fleet request", e);
        return errorResponse(RestStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
}
