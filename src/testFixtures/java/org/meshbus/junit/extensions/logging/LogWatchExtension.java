package org.meshbus.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test when it logs at WARN or above without permission.
 * <p>
 * Installs a Logback {@link TurboFilter} for the test class that captures events from every
 * thread, including bus consumer and provider call threads. After each test, captured events
 * not covered by {@link AllowLog} or {@link ExpectLog} fail the test, as do {@link ExpectLog}
 * entries with too few matches. {@link FailOnLog} changes the threshold or turns the check off.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.clear();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = resolveRules(context);
        List<Event> events = filter.snapshot();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            events.stream()
                .filter(e -> e.level().isGreaterOrEqual(toLogback(rules.minLevel())))
                .filter(e -> !rules.permits(e))
                .forEach(e -> problems.add("Unexpected log: " + e));
        }
        for (ExpectLog expected : rules.expects()) {
            long found = events.stream()
                .filter(e -> matches(e, expected.level(), expected.loggerPattern(), expected.messagePattern()))
                .count();
            if (found < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog failOnLog = context.getElement()
            .map(el -> el.getAnnotation(FailOnLog.class))
            .orElseGet(() -> context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        LogLevel minLevel = failOnLog != null ? failOnLog.level() : LogLevel.WARN;
        boolean disabled = failOnLog != null && failOnLog.disabled();
        return new Rules(minLevel, disabled,
            collect(context, AllowLog.class, AllowLog[]::new),
            collect(context, ExpectLog.class, ExpectLog[]::new));
    }

    // Class-level annotations first, then method-level ones.
    private static <A extends Annotation> A[] collect(ExtensionContext context, Class<A> type,
                                                     java.util.function.IntFunction<A[]> array) {
        Stream<A> fromClass = context.getTestClass().stream().flatMap(c -> Arrays.stream(c.getAnnotationsByType(type)));
        Stream<A> fromElement = context.getElement()
            .filter(el -> !(el instanceof Class<?>))
            .stream()
            .flatMap((AnnotatedElement el) -> Arrays.stream(el.getAnnotationsByType(type)));
        return Stream.concat(fromClass, fromElement).toArray(array);
    }

    private static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level().isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, e.loggerName())
            && Pattern.matches(messagePattern, e.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            Rules current = rules;
            if (level == null || !level.isGreaterOrEqual(toLogback(current.minLevel()))) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message == null ? "" : message);
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> snapshot() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, AllowLog[] allows, ExpectLog[] expects) {
        boolean permits(Event e) {
            return Arrays.stream(allows).anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()))
                || Arrays.stream(expects).anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }
}
