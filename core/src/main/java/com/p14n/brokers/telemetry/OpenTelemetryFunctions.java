package com.p14n.brokers.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        /**
         * Message header carrying the W3C trace context.
         */
        public static final String TRACEPARENT = "traceparent";

        private static final TextMapGetter<Map<String, String>> MAP_GETTER = new TextMapGetter<>() {
                @Override
                public Iterable<String> keys(Map<String, String> carrier) {
                        return carrier.keySet();
                }

                @Override
                public String get(Map<String, String> carrier, String key) {
                        return carrier == null ? null : carrier.get(key);
                }
        };

        private OpenTelemetryFunctions() {
        }

        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get(TRACEPARENT);
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put(TRACEPARENT, traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier, MAP_GETTER);
        }

        /**
         * Copies message headers and adds the trace context of a
         * {@code publish_message} span for the event.
         */
        public static Map<String, Object> withTraceContext(OpenTelemetry ot, Tracer tracer, String event,
                        Map<String, Object> headers) {
                return processWithTelemetry(tracer, "publish_message", event, () -> {
                        Map<String, Object> copy = new HashMap<>(headers);
                        String traceparent = serializeTraceContext(ot);
                        if (traceparent != null) {
                                copy.put(TRACEPARENT, traceparent);
                        }
                        return copy;
                });
        }

        /**
         * @return the trace context header of a message, or null
         */
        public static String traceparentOf(Map<String, Object> headers) {
                Object value = headers == null ? null : headers.get(TRACEPARENT);
                return value == null ? null : value.toString();
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String event,
                        String traceparent, Supplier<T> action) {

                Context parentContext = traceparent == null ? null
                                : deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("event", event);
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String event, Supplier<T> action) {
                Span span = tracer.spanBuilder(spanName).setAttribute("event", event).startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
